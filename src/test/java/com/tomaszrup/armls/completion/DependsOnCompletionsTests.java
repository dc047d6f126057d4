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

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.resources.ResourceInfo;
import com.tomaszrup.armls.template.DeploymentTemplate;

class DependsOnCompletionsTests {
	private static final String CURSOR_IN_DB = "/*db*/";
	private static final String CURSOR_IN_SITE = "/*site*/";

	private static String templateText() {
		StringBuilder contents = new StringBuilder();
		contents.append("{ \"resources\": [\n");
		contents.append("  { \"name\": \"server\", \"type\": \"Microsoft.Sql/servers\", \"resources\": [\n");
		contents.append("    { \"name\": \"db\", \"type\": \"databases\", \"dependsOn\": [ " + CURSOR_IN_DB + " ] } ] },\n");
		contents.append("  { \"name\": \"site\", \"type\": \"Microsoft.Web/sites\",\n");
		contents.append("    \"copy\": { \"name\": \"siteLoop\", \"count\": 2 },\n");
		contents.append("    \"dependsOn\": [ " + CURSOR_IN_SITE + " ] }\n");
		contents.append("] }");
		return contents.toString();
	}

	private static List<ResourceInfo> resources(String text) {
		DeploymentTemplate template = new DeploymentTemplate(URI.create("file:///dependsOn.json"), text);
		return template.getResourceGraph(template.getTopLevelScope());
	}

	private static List<CompletionItem> complete(String marker) {
		String text = templateText();
		int index = text.indexOf(marker);
		return DependsOnCompletions.getCompletions(resources(text), new Span(index, 0), index);
	}

	private static List<String> labels(List<CompletionItem> items) {
		List<String> result = new ArrayList<>();
		for (CompletionItem item : items) {
			result.add(item.getLabel());
		}
		return result;
	}

	@Test
	void testNoResources() {
		Assertions.assertTrue(DependsOnCompletions.getCompletions(Collections.<ResourceInfo>emptyList(),
				new Span(0, 0), 0).isEmpty());
	}

	@Test
	void testParentOfferedFirstAndSelfExcluded() {
		List<CompletionItem> items = complete(CURSOR_IN_DB);
		Assertions.assertEquals(List.of("Parent (server)", "site", "Loop siteLoop"), labels(items));

		CompletionItem parent = items.get(0);
		Assertions.assertEquals(CompletionKind.DEPENDS_ON_RESOURCE_ID, parent.getKind());
		Assertions.assertEquals(CompletionPriority.HIGH, parent.getPriority());
		Assertions.assertEquals("\"[resourceId('Microsoft.Sql/servers', 'server')]\"", parent.getInsertText());
		Assertions.assertTrue(parent.getFilterText().endsWith(" parent"));
		Assertions.assertEquals("Microsoft.Sql/servers", parent.getDetail());
	}

	@Test
	void testCopyLoopCompletion() {
		List<CompletionItem> items = complete(CURSOR_IN_DB);
		CompletionItem loop = items.get(2);
		Assertions.assertEquals(CompletionKind.DEPENDS_ON_COPY_LOOP, loop.getKind());
		Assertions.assertEquals("\"siteLoop\"", loop.getInsertText());
		Assertions.assertTrue(loop.getDocumentation().contains("from resource `site`"));
	}

	@Test
	void testOwnCopyLoopAndSelfExcluded() {
		List<CompletionItem> items = complete(CURSOR_IN_SITE);
		Assertions.assertEquals(List.of("server", "db"), labels(items));
		Assertions.assertEquals("\"[resourceId('Microsoft.Sql/servers/databases', 'server', 'db')]\"",
				items.get(1).getInsertText());
		Assertions.assertEquals(CompletionPriority.NORMAL, items.get(0).getPriority());
	}

	@Test
	void testParentExcludesDescendants() {
		String text = templateText();
		int index = text.indexOf("\"type\": \"Microsoft.Sql/servers\"");
		List<CompletionItem> items = DependsOnCompletions.getCompletions(resources(text), new Span(index, 0), index);
		Assertions.assertEquals(List.of("site", "Loop siteLoop"), labels(items));
	}

	@Test
	void testOutsideAnyResource() {
		List<CompletionItem> items = DependsOnCompletions.getCompletions(resources(templateText()), new Span(0, 0), 0);
		Assertions.assertEquals(4, items.size());
	}

	@Test
	void testClosestEnclosingResourceDescends() {
		String text = templateText();
		List<ResourceInfo> resources = resources(text);
		ResourceInfo found = DependsOnCompletions.findClosestEnclosingResource(resources, text.indexOf(CURSOR_IN_DB));
		Assertions.assertEquals(List.of("'server'", "'db'"), found.getNameSegments());
		Assertions.assertNull(DependsOnCompletions.findClosestEnclosingResource(resources, 0));
	}

	@Test
	void testSpanIsPassedThrough() {
		Span span = new Span(5, 3);
		String text = templateText();
		for (CompletionItem item : DependsOnCompletions.getCompletions(resources(text), span, text.indexOf(CURSOR_IN_DB))) {
			Assertions.assertEquals(span, item.getSpan());
		}
	}
}
