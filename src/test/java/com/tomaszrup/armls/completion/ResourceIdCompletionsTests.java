////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.armls.completion;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.expressions.Parser;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.json.JsonParser;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.resources.ResourceGraphBuilder;
import com.tomaszrup.armls.resources.ResourceInfo;

class ResourceIdCompletionsTests {
	private static final int STRING_START = 10;
	private static final int CURSOR = 40;

	private static BuiltinFunctions builtinFunctions;
	private static List<ResourceInfo> resources;

	@BeforeAll
	static void setupAll() {
		builtinFunctions = BuiltinFunctions.loadBundled();
		StringBuilder contents = new StringBuilder();
		contents.append("[\n");
		contents.append("  { \"name\": \"server\", \"type\": \"Microsoft.Sql/servers\", \"resources\": [\n");
		contents.append("    { \"name\": \"db\", \"type\": \"databases\" },\n");
		contents.append("    { \"name\": \"logs\", \"type\": \"databases\" } ] },\n");
		contents.append("  { \"name\": \"other/db2\", \"type\": \"Microsoft.Sql/servers/databases\" },\n");
		contents.append("  { \"name\": \"site\", \"type\": \"Microsoft.Web/sites\" }\n");
		contents.append("]");
		List<ObjectValue> objects = new ArrayList<>();
		for (JsonValue element : JsonParser.parse(contents.toString()).getValue().asArrayValue().getElements()) {
			objects.add(element.asObjectValue());
		}
		resources = ResourceGraphBuilder.build(objects);
	}

	private static List<CompletionItem> complete(String quotedString, int argumentIndex) {
		FunctionCall call = (FunctionCall) Parser.parse(quotedString).getExpression();
		return ResourceIdCompletions.getCompletions(call, argumentIndex, quotedString, STRING_START, CURSOR, resources,
				builtinFunctions);
	}

	private static List<String> labels(List<CompletionItem> items) {
		List<String> result = new ArrayList<>();
		for (CompletionItem item : items) {
			result.add(item.getLabel());
		}
		return result;
	}

	// ------------------------------------------------------------------
	// resource types
	// ------------------------------------------------------------------

	@Test
	void testFirstArgumentOffersTypes() {
		String quoted = "\"[resourceId('Micro')]\"";
		List<CompletionItem> items = complete(quoted, 0);
		Assertions.assertEquals(List.of("'Microsoft.Sql/servers'", "'Microsoft.Sql/servers/databases'",
				"'Microsoft.Web/sites'"), labels(items));
		CompletionItem first = items.get(0);
		Assertions.assertEquals(CompletionKind.RESOURCE_ID_TYPE, first.getKind());
		Assertions.assertEquals(CompletionPriority.HIGH, first.getPriority());
		Assertions.assertTrue(first.isPreselect());
		Assertions.assertEquals(new Span(quoted.indexOf("'Micro'") + STRING_START, 7), first.getSpan());
	}

	@Test
	void testTypesAfterOptionalArguments() {
		List<CompletionItem> items = complete("\"[resourceId('sub', 'rg', )]\"", 2);
		Assertions.assertEquals(3, items.size());
		Assertions.assertEquals(new Span(CURSOR, 0), items.get(0).getSpan());
	}

	@Test
	void testNoTypesPastOptionalArguments() {
		Assertions.assertTrue(complete("\"[resourceId('a', 'b', 'c', )]\"", 3).isEmpty());
	}

	// ------------------------------------------------------------------
	// resource names
	// ------------------------------------------------------------------

	@Test
	void testNamesOfMatchingType() {
		List<CompletionItem> items = complete("\"[resourceId('Microsoft.Sql/servers/databases', )]\"", 1);
		Assertions.assertEquals(List.of("'server'", "'other'"), labels(items));
		Assertions.assertEquals(CompletionKind.RESOURCE_ID_NAME, items.get(0).getKind());
	}

	@Test
	void testNamesFilteredByPreviousSegments() {
		List<CompletionItem> items = complete("\"[resourceId('Microsoft.Sql/servers/databases', 'SERVER', '')]\"", 2);
		Assertions.assertEquals(List.of("'db'", "'logs'"), labels(items));
	}

	@Test
	void testTypeAfterSubscriptionArgument() {
		List<CompletionItem> items = complete("\"[resourceId('sub', 'microsoft.web/sites', )]\"", 2);
		Assertions.assertEquals(List.of("'site'"), labels(items));
	}

	@Test
	void testMissingPreviousArgumentYieldsNothing() {
		Assertions.assertTrue(complete("\"[resourceId('Microsoft.Sql/servers/databases', , )]\"", 2).isEmpty());
	}

	@Test
	void testNoMoreSegments() {
		Assertions.assertTrue(complete("\"[resourceId('Microsoft.Web/sites', 'site', )]\"", 2).isEmpty());
	}

	// ------------------------------------------------------------------
	// other functions
	// ------------------------------------------------------------------

	@Test
	void testFunctionWithoutBehaviorYieldsNothing() {
		Assertions.assertTrue(complete("\"[concat('a', )]\"", 1).isEmpty());
	}

	@Test
	void testUserFunctionYieldsNothing() {
		Assertions.assertTrue(complete("\"[ns.resourceId('a')]\"", 0).isEmpty());
	}

	@Test
	void testCursorOutsideArgumentsYieldsNothing() {
		Assertions.assertTrue(complete("\"[resourceId('a')]\"", -1).isEmpty());
	}
}
