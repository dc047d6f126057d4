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
package com.tomaszrup.armls.position;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.tomaszrup.armls.completion.CompletionItem;
import com.tomaszrup.armls.completion.CompletionKind;
import com.tomaszrup.armls.completion.Completions;
import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.functions.BuiltinFunctionMetadata;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.functions.UserFunctionMetadata;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.DefinitionKind;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.template.ParameterDefinition;
import com.tomaszrup.armls.template.VariableDefinition;

class TemplatePositionContextTests {
	private static final String CURSOR = "<!cursor!>";
	private static final URI URI_TEMPLATE = URI.create("file:///test/template.json");

	private static BuiltinFunctions builtinFunctions;

	@BeforeAll
	static void setupAll() {
		builtinFunctions = BuiltinFunctions.loadBundled();
	}

	/**
	 * Parses the text with the cursor marker removed and returns the context
	 * at the marker.
	 */
	private static TemplatePositionContext contextAt(String textWithCursor) {
		int index = textWithCursor.indexOf(CURSOR);
		Assertions.assertTrue(index >= 0, "missing cursor marker");
		String text = textWithCursor.substring(0, index) + textWithCursor.substring(index + CURSOR.length());
		DeploymentTemplate template = new DeploymentTemplate(URI_TEMPLATE, text);
		return TemplatePositionContext.fromDocumentCharacterIndex(template, builtinFunctions, index);
	}

	private static List<String> labels(Completions completions) {
		List<String> result = new ArrayList<>();
		for (CompletionItem item : completions.getItems()) {
			result.add(item.getLabel());
		}
		return result;
	}

	private static String userFunctionTemplate(String expression) {
		StringBuilder contents = new StringBuilder();
		contents.append("{\n");
		contents.append("  \"functions\": [ { \"namespace\": \"contoso\", \"members\": {\n");
		contents.append("    \"uniqueName\": {\n");
		contents.append("      \"parameters\": [ { \"name\": \"namePrefix\", \"type\": \"string\" } ],\n");
		contents.append("      \"output\": { \"type\": \"string\", \"value\": \"[parameters('namePrefix')]\" }\n");
		contents.append("    }\n");
		contents.append("  } } ],\n");
		contents.append("  \"outputs\": { \"o\": { \"value\": \"" + expression + "\" } }\n");
		contents.append("}");
		return contents.toString();
	}

	// ------------------------------------------------------------------
	// construction
	// ------------------------------------------------------------------

	@Test
	void testNegativeIndexThrows() {
		DeploymentTemplate template = new DeploymentTemplate(URI_TEMPLATE, "{}");
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> TemplatePositionContext.fromDocumentCharacterIndex(template, builtinFunctions, -1));
	}

	@Test
	void testIndexPastEndIsClamped() {
		DeploymentTemplate template = new DeploymentTemplate(URI_TEMPLATE, "{}");
		TemplatePositionContext context = TemplatePositionContext.fromDocumentCharacterIndex(template,
				builtinFunctions, 50);
		Assertions.assertEquals(2, context.getDocumentCharacterIndex());
	}

	@Test
	void testInsideExpression() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[concat(<!cursor!>'x')]\" }");
		Assertions.assertTrue(context.isInsideJsonString());
		Assertions.assertTrue(context.isInsideExpression());
		Assertions.assertEquals(7, context.getJsonStringStartIndex());
		Assertions.assertEquals(9, context.getTleCharacterIndex());
	}

	@Test
	void testOutsideString() {
		TemplatePositionContext context = contextAt("{ <!cursor!> \"a\": 1 }");
		Assertions.assertFalse(context.isInsideJsonString());
		Assertions.assertFalse(context.isInsideExpression());
		Assertions.assertEquals(-1, context.getTleCharacterIndex());
		Assertions.assertNull(context.getTleValue());
		Assertions.assertNotNull(context.getScope());
	}

	// ------------------------------------------------------------------
	// function and namespace completions
	// ------------------------------------------------------------------

	@Test
	void testBuiltinsRightAfterLeftBracket() {
		String text = "{ 'a': \"[concat('B')]\" }";
		DeploymentTemplate template = new DeploymentTemplate(URI_TEMPLATE, text);
		Completions completions = TemplatePositionContext.fromDocumentCharacterIndex(template, builtinFunctions, 9)
				.getCompletions(null);

		List<String> labels = labels(completions);
		Assertions.assertEquals(builtinFunctions.getAll().size(), labels.size());
		Set<String> unique = new HashSet<>(labels);
		Assertions.assertEquals(labels.size(), unique.size());
		for (BuiltinFunctionMetadata function : builtinFunctions.getAll()) {
			Assertions.assertTrue(unique.contains(function.getName()), function.getName());
		}
	}

	@Test
	void testFunctionNamePrefixReplacesName() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[con<!cursor!>]\" }");
		Completions completions = context.getCompletions(null);
		Assertions.assertTrue(labels(completions).contains("concat"));
		CompletionItem first = completions.getItems().get(0);
		Assertions.assertEquals(new Span(9, 3), first.getSpan());
		Assertions.assertEquals(CompletionKind.FUNCTION, first.getKind());
	}

	@Test
	void testEmptyExpressionOffersFunctionsAndNamespaces() {
		TemplatePositionContext context = contextAt(userFunctionTemplate("[<!cursor!>]"));
		List<String> labels = labels(context.getCompletions(null));
		Assertions.assertTrue(labels.contains("contoso"));
		Assertions.assertTrue(labels.contains("resourceGroup"));
		Assertions.assertEquals(builtinFunctions.getAll().size() + 1, labels.size());
	}

	@Test
	void testNothingAfterClosingBracket() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[concat('x')]  <!cursor!>\" }");
		Assertions.assertTrue(context.getCompletions(null).getItems().isEmpty());
	}

	@Test
	void testNamespaceMembersAfterPeriod() {
		TemplatePositionContext context = contextAt(userFunctionTemplate("[contoso.<!cursor!>]"));
		Completions completions = context.getCompletions(".");
		Assertions.assertEquals(List.of("contoso.uniqueName"), labels(completions));
		CompletionItem item = completions.getItems().get(0);
		Assertions.assertEquals("uniqueName", item.getInsertText());
		Assertions.assertEquals(CompletionKind.USER_FUNCTION, item.getKind());
	}

	@Test
	void testNamespaceMembersAfterPeriodFollowedBySpace() {
		String text = userFunctionTemplate("[contoso.<!cursor!> uniqueName()]");
		TemplatePositionContext context = contextAt(text);
		Completions completions = context.getCompletions(null);
		Assertions.assertEquals(List.of("contoso.uniqueName"), labels(completions));
		Assertions.assertEquals(new Span(text.indexOf(CURSOR), 0), completions.getItems().get(0).getSpan());
	}

	@Test
	void testUnknownNamespaceAfterPeriod() {
		TemplatePositionContext context = contextAt(userFunctionTemplate("[fabrikam.<!cursor!>]"));
		Assertions.assertTrue(context.getCompletions(".").getItems().isEmpty());
	}

	@Test
	void testNamespaceMemberPrefix() {
		TemplatePositionContext context = contextAt(userFunctionTemplate("[contoso.uni<!cursor!>()]"));
		Completions completions = context.getCompletions(null);
		Assertions.assertEquals(List.of("contoso.uniqueName"), labels(completions));
		Assertions.assertEquals(3, completions.getItems().get(0).getSpan().getLength());
	}

	// ------------------------------------------------------------------
	// parameter and variable completions
	// ------------------------------------------------------------------

	@Test
	void testVariableNameBetweenEmptyQuotes() {
		TemplatePositionContext context = contextAt(
				"{ 'variables': { 'vName': 20 }, 'a': \"[variables('<!cursor!>')]\" }");
		Completions completions = context.getCompletions("'");
		Assertions.assertEquals(1, completions.getItems().size());
		CompletionItem item = completions.getItems().get(0);
		Assertions.assertEquals("'vName'", item.getLabel());
		Assertions.assertEquals(2, item.getSpan().getLength());
		Assertions.assertEquals("'vName'", item.getInsertText());
		Assertions.assertTrue(item.isIncludeSingleQuotes());
		Assertions.assertFalse(item.isIncludeRightParenthesis());
		Assertions.assertEquals(CompletionKind.VARIABLE, item.getKind());
	}

	@Test
	void testParameterNameWithoutClosingParenthesis() {
		TemplatePositionContext context = contextAt("{ 'parameters': {'sku':{}}, 'a': \"[parameters(<!cursor!>\" }");
		Completions completions = context.getCompletions("(");
		Assertions.assertEquals(List.of("'sku'"), labels(completions));
		CompletionItem item = completions.getItems().get(0);
		Assertions.assertEquals("'sku')", item.getInsertText());
		Assertions.assertTrue(item.isIncludeSingleQuotes());
		Assertions.assertTrue(item.isIncludeRightParenthesis());
	}

	@Test
	void testNoVariableNamesBeforeLeftParenthesis() {
		String text = "{ 'variables': { 'v': 1 }, 'a': \"[variables <!cursor!>()]\" }";
		TemplatePositionContext context = contextAt(text);
		Completions completions = context.getCompletions(null);
		Span emptySpan = new Span(text.indexOf(CURSOR), 0);
		for (CompletionItem item : completions.getItems()) {
			Assertions.assertNotEquals(CompletionKind.VARIABLE, item.getKind(), item.toString());
			Assertions.assertEquals(emptySpan, item.getSpan(), item.toString());
		}
	}

	@Test
	void testNoVariableNamesAfterRightParenthesis() {
		String text = "{ 'variables': { 'v': 1 }, 'a': \"[variables()<!cursor!>]\" }";
		Completions completions = contextAt(text).getCompletions(null);
		for (CompletionItem item : completions.getItems()) {
			Assertions.assertNotEquals(CompletionKind.VARIABLE, item.getKind(), item.toString());
		}
	}

	@Test
	void testParameterNameReplacesUpToClosingParenthesis() {
		String text = "{ 'parameters': {'sku':{}, 'size':{}}, 'a': \"[parameters(<!cursor!>)]\" }";
		TemplatePositionContext context = contextAt(text);
		Completions completions = context.getCompletions("(");
		Assertions.assertEquals(List.of("'sku'", "'size'"), labels(completions));
		CompletionItem item = completions.getItems().get(0);
		Assertions.assertEquals("'sku')", item.getInsertText());
		Assertions.assertEquals(new Span(text.indexOf(CURSOR), 1), item.getSpan());
	}

	@Test
	void testParameterNameInsidePartialString() {
		String text = "{ 'parameters': {'sku':{}}, 'a': \"[parameters('s<!cursor!>')]\" }";
		TemplatePositionContext context = contextAt(text);
		CompletionItem item = context.getCompletions(null).getItems().get(0);
		Assertions.assertEquals("'sku')", item.getInsertText());
		Assertions.assertEquals(text.indexOf("('s") + 1, item.getSpan().getStartIndex());
		Assertions.assertEquals("'s')".length(), item.getSpan().getLength());
	}

	@Test
	void testUserFunctionSeesOnlyItsParameters() {
		StringBuilder contents = new StringBuilder();
		contents.append("{ \"parameters\": { \"top\": {} },\n");
		contents.append("  \"functions\": [ { \"namespace\": \"ns\", \"members\": { \"f\": {\n");
		contents.append("    \"parameters\": [ { \"name\": \"inner\" } ],\n");
		contents.append("    \"output\": { \"value\": \"[parameters(<!cursor!>)]\" } } } } ] }");
		TemplatePositionContext context = contextAt(contents.toString());
		Assertions.assertEquals(List.of("'inner'"), labels(context.getCompletions("(")));
	}

	// ------------------------------------------------------------------
	// property access completions
	// ------------------------------------------------------------------

	@Test
	void testDeepVariablePropertyAccess() {
		TemplatePositionContext context = contextAt(
				"{\"variables\":{\"a\":{\"bb\":{\"cc\":200}}},\"b\":\"[variables('a').bb.<!cursor!>]\"}");
		Completions completions = context.getCompletions(".");
		Assertions.assertEquals(List.of("cc"), labels(completions));
		Assertions.assertEquals(CompletionKind.PROPERTY, completions.getItems().get(0).getKind());
	}

	@Test
	void testDeepPropertyAccessListsRedeclaredNameOnce() {
		TemplatePositionContext context = contextAt(
				"{\"variables\":{\"a\":{\"Size\":1,\"size\":2}},\"b\":\"[variables('a').<!cursor!>]\"}");
		Assertions.assertEquals(List.of("size"), labels(context.getCompletions(".")));
	}

	@Test
	void testParameterDefaultValueAccess() {
		TemplatePositionContext context = contextAt(
				"{\"parameters\":{\"p\":{\"type\":\"object\",\"defaultValue\":{\"one\":1,\"two\":2}}},"
						+ "\"b\":\"[parameters('p').t<!cursor!>]\"}");
		Completions completions = context.getCompletions(null);
		Assertions.assertEquals(List.of("two"), labels(completions));
		Assertions.assertEquals(1, completions.getItems().get(0).getSpan().getLength());
	}

	@Test
	void testBuiltinReturnMembers() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[resourceGroup().<!cursor!>]\" }");
		List<String> labels = labels(context.getCompletions("."));
		Assertions.assertEquals(builtinFunctions.findByName("resourceGroup").getReturnValueMembers(), labels);
		Assertions.assertTrue(labels.contains("location"));
	}

	@Test
	void testBuiltinReturnMembersFilteredByPrefix() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[resourceGroup().LOC<!cursor!>]\" }");
		Assertions.assertEquals(List.of("location"), labels(context.getCompletions(null)));
	}

	@Test
	void testNoMembersForSecondLevelBuiltinAccess() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[resourceGroup().properties.<!cursor!>]\" }");
		Assertions.assertTrue(context.getCompletions(".").getItems().isEmpty());
	}

	// ------------------------------------------------------------------
	// resourceId and dependsOn completions
	// ------------------------------------------------------------------

	private static String resourcesTemplate(String firstDependsOn, String output) {
		StringBuilder contents = new StringBuilder();
		contents.append("{ \"resources\": [\n");
		contents.append("  { \"name\": \"site\", \"type\": \"Microsoft.Web/sites\", \"dependsOn\": [ " + firstDependsOn
				+ " ] },\n");
		contents.append("  { \"name\": \"plan\", \"type\": \"Microsoft.Web/serverfarms\" }\n");
		contents.append("],\n");
		contents.append("  \"outputs\": { \"o\": { \"value\": \"" + output + "\" } } }");
		return contents.toString();
	}

	@Test
	void testResourceIdTypeArgument() {
		TemplatePositionContext context = contextAt(resourcesTemplate("", "[resourceId('<!cursor!>')]"));
		List<String> labels = labels(context.getCompletions("'"));
		Assertions.assertEquals(List.of("'Microsoft.Web/sites'", "'Microsoft.Web/serverfarms'"), labels);
	}

	@Test
	void testResourceIdNameArgument() {
		TemplatePositionContext context = contextAt(
				resourcesTemplate("", "[resourceId('Microsoft.Web/serverfarms', <!cursor!>)]"));
		Assertions.assertEquals(List.of("'plan'"), labels(context.getCompletions(",")));
	}

	@Test
	void testDependsOnInEmptyString() {
		TemplatePositionContext context = contextAt(resourcesTemplate("\"<!cursor!>\"", ""));
		Completions completions = context.getCompletions("\"");
		Assertions.assertEquals(List.of("plan"), labels(completions));
		CompletionItem item = completions.getItems().get(0);
		Assertions.assertEquals(CompletionKind.DEPENDS_ON_RESOURCE_ID, item.getKind());
		Assertions.assertEquals(2, item.getSpan().getLength());
	}

	@Test
	void testDependsOnOutsideString() {
		TemplatePositionContext context = contextAt(resourcesTemplate("<!cursor!>", ""));
		Completions completions = context.getCompletions(null);
		Assertions.assertEquals(List.of("plan"), labels(completions));
		Assertions.assertTrue(completions.getItems().get(0).getSpan().isEmpty());
	}

	@Test
	void testDependsOnNotOfferedForOtherTriggers() {
		TemplatePositionContext context = contextAt(resourcesTemplate("<!cursor!>", ""));
		Assertions.assertTrue(context.getCompletions(",").getItems().isEmpty());
	}

	@Test
	void testDependsOnNotOfferedInsideExpression() {
		TemplatePositionContext context = contextAt(resourcesTemplate("\"[concat(<!cursor!>)]\"", ""));
		for (CompletionItem item : context.getCompletions(null).getItems()) {
			Assertions.assertNotEquals(CompletionKind.DEPENDS_ON_RESOURCE_ID, item.getKind());
		}
	}

	@Test
	void testNewObjectInArrayAsksForRetrigger() {
		TemplatePositionContext context = contextAt("{ \"resources\": [ {<!cursor!>} ] }");
		Completions completions = context.getCompletions("{");
		Assertions.assertTrue(completions.isTriggerSuggest());
		Assertions.assertTrue(completions.getItems().isEmpty());
	}

	@Test
	void testNoRetriggerWithoutBraceTrigger() {
		TemplatePositionContext context = contextAt("{ \"resources\": [ {<!cursor!>} ] }");
		Assertions.assertFalse(context.getCompletions(null).isTriggerSuggest());
	}

	@Test
	void testNoRetriggerInNonEmptyObject() {
		TemplatePositionContext context = contextAt("{ \"resources\": [ {<!cursor!> \"a\": 1 } ] }");
		Assertions.assertFalse(context.getCompletions("{").isTriggerSuggest());
	}

	// ------------------------------------------------------------------
	// reference sites
	// ------------------------------------------------------------------

	@Test
	void testParameterReferenceSite() {
		String text = "{ \"parameters\": { \"sku\": {} }, \"a\": \"[parameters('s<!cursor!>ku')]\" }";
		ReferenceSite site = contextAt(text).getReferenceSite(false);
		Assertions.assertNotNull(site);
		Assertions.assertEquals(ReferenceSiteKind.REFERENCE, site.getKind());
		Assertions.assertTrue(site.getDefinition() instanceof ParameterDefinition);
		Assertions.assertEquals(new Span(text.indexOf("'s") + 1, 3), site.getUnquotedReferenceSpan());
	}

	@Test
	void testVariableReferenceSite() {
		ReferenceSite site = contextAt("{ \"variables\": { \"v\": 1 }, \"a\": \"[variables('<!cursor!>v')]\" }")
				.getReferenceSite(false);
		Assertions.assertTrue(site.getDefinition() instanceof VariableDefinition);
	}

	@Test
	void testUnknownParameterHasNoSite() {
		Assertions.assertNull(contextAt("{ \"a\": \"[parameters('no<!cursor!>ne')]\" }").getReferenceSite(true));
	}

	@Test
	void testDefinitionSite() {
		String text = "{ \"parameters\": { \"s<!cursor!>ku\": {} }, \"a\": \"[parameters('sku')]\" }";
		TemplatePositionContext context = contextAt(text);
		Assertions.assertNull(context.getReferenceSite(false));
		ReferenceSite site = context.getReferenceSite(true);
		Assertions.assertEquals(ReferenceSiteKind.DEFINITION, site.getKind());
		Assertions.assertEquals(DefinitionKind.PARAMETER, site.getDefinition().getDefinitionKind());
		Assertions.assertEquals(new Span(text.indexOf("\"s") + 1, 3), site.getUnquotedReferenceSpan());
	}

	@Test
	void testBuiltinFunctionSite() {
		ReferenceSite site = contextAt("{ \"a\": \"[con<!cursor!>cat('x')]\" }").getReferenceSite(false);
		Assertions.assertEquals(DefinitionKind.BUILTIN_FUNCTION, site.getDefinition().getDefinitionKind());
		Assertions.assertEquals("concat", site.getDefinition().getName());
	}

	@Test
	void testUserFunctionAndNamespaceSites() {
		ReferenceSite namespaceSite = contextAt(userFunctionTemplate("[con<!cursor!>toso.uniqueName('a')]"))
				.getReferenceSite(false);
		Assertions.assertEquals(DefinitionKind.NAMESPACE, namespaceSite.getDefinition().getDefinitionKind());
		ReferenceSite functionSite = contextAt(userFunctionTemplate("[contoso.unique<!cursor!>Name('a')]"))
				.getReferenceSite(false);
		Assertions.assertEquals(DefinitionKind.USER_FUNCTION, functionSite.getDefinition().getDefinitionKind());
	}

	@Test
	void testUserFunctionDefinitionSite() {
		StringBuilder contents = new StringBuilder();
		contents.append("{ \"functions\": [ { \"namespace\": \"ns\", \"members\": {\n");
		contents.append("  \"f<!cursor!>n\": { \"output\": { \"value\": 1 } } } } ],\n");
		contents.append("  \"outputs\": { \"o\": { \"value\": \"[ns.fn()]\" } } }");
		TemplatePositionContext context = contextAt(contents.toString());
		ReferenceSite site = context.getReferenceSite(true);
		Assertions.assertEquals(DefinitionKind.USER_FUNCTION, site.getDefinition().getDefinitionKind());
		Assertions.assertEquals(2, context.getReferences().size());
	}

	@Test
	void testReferencesFromDefinition() {
		String text = "{ \"parameters\": { \"<!cursor!>sku\": {} }, \"a\": \"[parameters('sku')]\", "
				+ "\"b\": \"[concat(parameters('SKU'), 'x')]\" }";
		TemplatePositionContext context = contextAt(text);
		String clean = context.getTemplate().getText();
		List<Span> references = context.getReferences();
		Assertions.assertEquals(3, references.size());
		Assertions.assertEquals(new Span(clean.indexOf("\"sku\"") + 1, 3), references.get(0));
		Assertions.assertEquals(new Span(clean.indexOf("'sku'") + 1, 3), references.get(1));
		Assertions.assertEquals(new Span(clean.indexOf("'SKU'") + 1, 3), references.get(2));
	}

	@Test
	void testNoReferencesOutsideNames() {
		Assertions.assertNull(contextAt("{ \"a\": \"pla<!cursor!>in\" }").getReferences());
	}

	// ------------------------------------------------------------------
	// signature help
	// ------------------------------------------------------------------

	@Test
	void testSignatureHelpActiveParameter() {
		FunctionSignatureHelp help = contextAt("{ \"a\": \"[concat('a', <!cursor!>)]\" }").getSignatureHelp();
		Assertions.assertNotNull(help);
		Assertions.assertEquals("concat", help.getFunctionMetadata().getFullName());
		Assertions.assertEquals(1, help.getActiveParameterIndex());
	}

	@Test
	void testSignatureHelpInsideNestedArgument() {
		FunctionSignatureHelp help = contextAt("{ \"a\": \"[concat('a', 'b<!cursor!>')]\" }").getSignatureHelp();
		Assertions.assertEquals("concat", help.getFunctionMetadata().getFullName());
		Assertions.assertEquals(1, help.getActiveParameterIndex());
	}

	@Test
	void testSignatureHelpVariadicClamp() {
		FunctionSignatureHelp help = contextAt("{ \"a\": \"[concat('a', 'b', 'c', 'd<!cursor!>')]\" }")
				.getSignatureHelp();
		int last = help.getFunctionMetadata().getParameters().size() - 1;
		Assertions.assertTrue(help.getFunctionMetadata().getParameters().get(last).isVariadic());
		Assertions.assertEquals(last, help.getActiveParameterIndex());
	}

	@Test
	void testSignatureHelpOnFunctionName() {
		FunctionSignatureHelp help = contextAt("{ \"a\": \"[con<!cursor!>cat('a')]\" }").getSignatureHelp();
		Assertions.assertEquals(-1, help.getActiveParameterIndex());
	}

	@Test
	void testSignatureHelpForUserFunction() {
		FunctionSignatureHelp help = contextAt(userFunctionTemplate("[contoso.uniqueName(<!cursor!>)]"))
				.getSignatureHelp();
		Assertions.assertTrue(help.getFunctionMetadata() instanceof UserFunctionMetadata);
		Assertions.assertEquals(0, help.getActiveParameterIndex());
		Assertions.assertEquals("namePrefix [string]", help.getFunctionMetadata().getParameters().get(0).getUsage());
	}

	@Test
	void testNoSignatureHelpForUnknownFunction() {
		Assertions.assertNull(contextAt("{ \"a\": \"[nothing(<!cursor!>)]\" }").getSignatureHelp());
		Assertions.assertNull(contextAt("{ \"a\": \"plain <!cursor!>\" }").getSignatureHelp());
	}

	@Test
	void testFunctionCallArgumentIndex() {
		TemplatePositionContext context = contextAt("{ \"a\": \"[concat('a', 'b', <!cursor!>'c')]\" }");
		FunctionCall call = (FunctionCall) context.getParseResult().getExpression();
		Assertions.assertEquals(Integer.valueOf(2), context.getFunctionCallArgumentIndex(call));
	}

	// ------------------------------------------------------------------
	// completion spans
	// ------------------------------------------------------------------

	@Test
	void testCompletionSpansStayInsideDocument() {
		String[] texts = {
				userFunctionTemplate("[contoso.uniqueName(parameters('namePrefix'))]"),
				userFunctionTemplate("[contoso. uniqueName()]"),
				userFunctionTemplate("[concat(variables( ), parameters(']"),
				"{\"variables\":{\"a\":{\"bb\":1}},\"b\":\"[variables('a').bb[0].]\",\"c\":\"[resourceGroup().]\"}",
				"{\"resources\":[{\"dependsOn\":[\"\"]}],\"d\":\"[ns.(]\"}",
		};
		String[] triggers = { null, "." };
		for (String text : texts) {
			DeploymentTemplate template = new DeploymentTemplate(URI_TEMPLATE, text);
			for (int index = 0; index <= text.length(); index++) {
				TemplatePositionContext context = TemplatePositionContext.fromDocumentCharacterIndex(template,
						builtinFunctions, index);
				for (String trigger : triggers) {
					for (CompletionItem item : context.getCompletions(trigger).getItems()) {
						Span span = item.getSpan();
						String where = "index " + index + " of " + text + ": " + item.getLabel();
						Assertions.assertTrue(span.getStartIndex() >= 0, where);
						Assertions.assertTrue(span.getAfterEndIndex() <= text.length(), where);
					}
				}
			}
		}
	}
}
