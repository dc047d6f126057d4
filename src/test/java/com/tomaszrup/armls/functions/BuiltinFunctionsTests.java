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
package com.tomaszrup.armls.functions;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BuiltinFunctionsTests {

	private static final String SMALL_CATALOGUE = "{ \"functionSignatures\": ["
			+ "{ \"name\": \"concat\", \"expectedUsage\": \"concat(arg1, arg2, ...)\", \"description\": \"Joins.\", \"minimumArguments\": 0 },"
			+ "{ \"name\": \"resourceGroup\", \"expectedUsage\": \"resourceGroup()\", \"minimumArguments\": 0, \"maximumArguments\": 0,"
			+ "  \"returnValueMembers\": [ { \"name\": \"name\" }, { \"name\": \"id\" } ] },"
			+ "{ \"name\": \"resourceId\", \"expectedUsage\": \"resourceId([subscriptionId], resourceType, resourceName1, ...)\","
			+ "  \"minimumArguments\": 2, \"behaviors\": [ \"usesResourceIdCompletions\", \"unknownBehavior\" ] }"
			+ "] }";

	// ------------------------------------------------------------------
	// loading
	// ------------------------------------------------------------------

	@Test
	void testLoadBundled() {
		BuiltinFunctions functions = BuiltinFunctions.loadBundled();
		Assertions.assertFalse(functions.getAll().isEmpty());
		Assertions.assertNotNull(functions.findByName("concat"));
		Assertions.assertNotNull(functions.findByName("resourceGroup"));
		Assertions.assertTrue(functions.findByName("resourceId").hasBehavior(FunctionBehavior.USES_RESOURCE_ID_COMPLETIONS));
	}

	@Test
	void testFromJson() {
		BuiltinFunctions functions = BuiltinFunctions.fromJson(SMALL_CATALOGUE);
		Assertions.assertEquals(3, functions.getAll().size());
		Assertions.assertEquals("Joins.", functions.findByName("concat").getDescription());
	}

	@Test
	void testInvalidJsonYieldsEmptyCatalogue() {
		Assertions.assertTrue(BuiltinFunctions.fromJson("{ not json").getAll().isEmpty());
		Assertions.assertTrue(BuiltinFunctions.fromJson("").getAll().isEmpty());
		Assertions.assertTrue(BuiltinFunctions.fromJson("{}").getAll().isEmpty());
	}

	@Test
	void testLoadFromFile(@TempDir Path tempDir) throws Exception {
		Path file = tempDir.resolve("metadata.json");
		Files.write(file, SMALL_CATALOGUE.getBytes(StandardCharsets.UTF_8));
		Assertions.assertEquals(3, BuiltinFunctions.load(file).getAll().size());
	}

	@Test
	void testLoadMissingFileYieldsEmptyCatalogue(@TempDir Path tempDir) {
		Assertions.assertTrue(BuiltinFunctions.load(tempDir.resolve("missing.json")).getAll().isEmpty());
	}

	// ------------------------------------------------------------------
	// queries
	// ------------------------------------------------------------------

	@Test
	void testFindByNameIsCaseInsensitive() {
		BuiltinFunctions functions = BuiltinFunctions.fromJson(SMALL_CATALOGUE);
		Assertions.assertSame(functions.findByName("resourcegroup"), functions.findByName("RESOURCEGROUP"));
		Assertions.assertNull(functions.findByName("nothing"));
		Assertions.assertNull(functions.findByName(null));
	}

	@Test
	void testFilterByPrefix() {
		BuiltinFunctions functions = BuiltinFunctions.fromJson(SMALL_CATALOGUE);
		List<BuiltinFunctionMetadata> result = functions.filterByPrefix("RES");
		Assertions.assertEquals(2, result.size());
		Assertions.assertEquals(3, functions.filterByPrefix("").size());
	}

	@Test
	void testMissingMaximumIsUnbounded() {
		BuiltinFunctions functions = BuiltinFunctions.fromJson(SMALL_CATALOGUE);
		Assertions.assertEquals(Integer.MAX_VALUE, functions.findByName("concat").getMaximumArguments());
		Assertions.assertEquals(0, functions.findByName("resourceGroup").getMaximumArguments());
	}

	@Test
	void testReturnValueMembersAreSorted() {
		BuiltinFunctions functions = BuiltinFunctions.fromJson(SMALL_CATALOGUE);
		Assertions.assertEquals(List.of("id", "name"), functions.findByName("resourceGroup").getReturnValueMembers());
	}

	@Test
	void testUnknownBehaviorIgnored() {
		BuiltinFunctionMetadata resourceId = BuiltinFunctions.fromJson(SMALL_CATALOGUE).findByName("resourceId");
		Assertions.assertTrue(resourceId.hasBehavior(FunctionBehavior.USES_RESOURCE_ID_COMPLETIONS));
	}

	// ------------------------------------------------------------------
	// parameters parsed from usage
	// ------------------------------------------------------------------

	@Test
	void testParametersFromUsage() {
		BuiltinFunctionMetadata concat = BuiltinFunctions.fromJson(SMALL_CATALOGUE).findByName("concat");
		List<FunctionParameterMetadata> parameters = concat.getParameters();
		Assertions.assertEquals(3, parameters.size());
		Assertions.assertEquals("arg1", parameters.get(0).getName());
		Assertions.assertFalse(parameters.get(0).isVariadic());
		Assertions.assertTrue(parameters.get(2).isVariadic());
	}

	@Test
	void testNoParameters() {
		BuiltinFunctionMetadata resourceGroup = BuiltinFunctions.fromJson(SMALL_CATALOGUE).findByName("resourceGroup");
		Assertions.assertTrue(resourceGroup.getParameters().isEmpty());
	}

	@Test
	void testParameterUsageWithType() {
		Assertions.assertEquals("prefix [string]", new FunctionParameterMetadata("prefix", "string").getUsage());
		Assertions.assertEquals("prefix", new FunctionParameterMetadata("prefix", null).getUsage());
	}
}
