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
package com.tomaszrup.armls.template;

import java.net.URI;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Issue;

class DeploymentTemplateTests {
	private static final URI URI_TEMPLATE = URI.create("file:///test/azuredeploy.json");

	private static DeploymentTemplate template(String text) {
		return new DeploymentTemplate(URI_TEMPLATE, text);
	}

	private static StringValue stringAt(DeploymentTemplate template, String search) {
		int index = template.getText().indexOf(search);
		Assertions.assertTrue(index >= 0, "text not found: " + search);
		JsonValue value = template.getJsonParseResult().getValueAtCharacterIndex(index, ContainsBehavior.STRICT);
		return JsonValue.asStringValue(value);
	}

	// ------------------------------------------------------------------
	// top-level members
	// ------------------------------------------------------------------

	@Test
	void testEmptyDocument() {
		DeploymentTemplate template = template("");
		Assertions.assertNull(template.getTopLevelValue());
		Assertions.assertEquals(1, template.getAllScopes().size());
		Assertions.assertTrue(template.getTopLevelScope().getParameterDefinitions().isEmpty());
		Assertions.assertTrue(template.getExpressionIssues().isEmpty());
	}

	@Test
	void testParametersAndVariables() {
		StringBuilder contents = new StringBuilder();
		contents.append("{\n");
		contents.append("  \"parameters\": {\n");
		contents.append("    \"location\": { \"type\": \"string\", \"defaultValue\": \"westus\",\n");
		contents.append("      \"metadata\": { \"description\": \"Where to deploy\" } },\n");
		contents.append("    \"count\": { \"type\": \"int\" }\n");
		contents.append("  },\n");
		contents.append("  \"variables\": { \"prefix\": \"app\", \"PREFIX\": \"override\" }\n");
		contents.append("}");
		TemplateScope scope = template(contents.toString()).getTopLevelScope();

		Assertions.assertEquals(TemplateScopeKind.TOP_LEVEL, scope.getKind());
		Assertions.assertEquals(2, scope.getParameterDefinitions().size());

		ParameterDefinition location = scope.getParameterDefinition("LOCATION");
		Assertions.assertNotNull(location);
		Assertions.assertEquals("string", location.getType());
		Assertions.assertEquals("Where to deploy", location.getDescription());
		Assertions.assertEquals("westus", location.getDefaultValue().asStringValue().getUnquotedValue());
		Assertions.assertNull(scope.getParameterDefinition("count").getDescription());

		VariableDefinition prefix = scope.getVariableDefinition("prefix");
		Assertions.assertEquals("PREFIX", prefix.getName());
		Assertions.assertEquals("override", prefix.getValue().asStringValue().getUnquotedValue());
	}

	@Test
	void testCopyVariables() {
		StringBuilder contents = new StringBuilder();
		contents.append("{ \"variables\": {\n");
		contents.append("  \"copy\": [\n");
		contents.append("    { \"name\": \"disks\", \"count\": 3, \"input\": { \"size\": 10 } },\n");
		contents.append("    { \"count\": 2 }\n");
		contents.append("  ],\n");
		contents.append("  \"plain\": 1\n");
		contents.append("} }");
		TemplateScope scope = template(contents.toString()).getTopLevelScope();

		List<VariableDefinition> variables = scope.getVariableDefinitions();
		Assertions.assertEquals(2, variables.size());
		VariableDefinition disks = scope.getVariableDefinition("disks");
		Assertions.assertTrue(disks.isIterationVariable());
		Assertions.assertEquals("iteration variable", disks.getFriendlyType());
		Assertions.assertNotNull(disks.getValue().asObjectValue());
		Assertions.assertNull(scope.getVariableDefinition("copy"));
		Assertions.assertEquals("variable", scope.getVariableDefinition("plain").getFriendlyType());
	}

	// ------------------------------------------------------------------
	// user functions
	// ------------------------------------------------------------------

	private static String userFunctionTemplate() {
		StringBuilder contents = new StringBuilder();
		contents.append("{\n");
		contents.append("  \"parameters\": { \"topParam\": { \"type\": \"string\" } },\n");
		contents.append("  \"functions\": [\n");
		contents.append("    { \"namespace\": \"contoso\", \"members\": {\n");
		contents.append("        \"uniqueName\": {\n");
		contents.append("          \"parameters\": [ { \"name\": \"namePrefix\", \"type\": \"string\" } ],\n");
		contents.append("          \"output\": { \"type\": \"string\", \"value\": \"[concat(parameters('namePrefix'), 'x')]\" }\n");
		contents.append("        }\n");
		contents.append("    } },\n");
		contents.append("    { \"members\": {} }\n");
		contents.append("  ]\n");
		contents.append("}");
		return contents.toString();
	}

	@Test
	void testUserFunctionNamespace() {
		TemplateScope scope = template(userFunctionTemplate()).getTopLevelScope();
		Assertions.assertEquals(1, scope.getNamespaceDefinitions().size());

		UserFunctionNamespaceDefinition contoso = scope.getFunctionNamespaceDefinition("Contoso");
		Assertions.assertNotNull(contoso);
		Assertions.assertEquals("Members:\n* uniqueName(namePrefix [string]) [string]", contoso.getDescription());

		UserFunctionDefinition uniqueName = scope.getUserFunctionDefinition("contoso", "UNIQUENAME");
		Assertions.assertNotNull(uniqueName);
		Assertions.assertEquals("contoso.uniqueName", uniqueName.getFullName());
		Assertions.assertEquals("string", uniqueName.getOutputType());
		Assertions.assertEquals("contoso.uniqueName(namePrefix [string]) [string]", uniqueName.getUsage());
		Assertions.assertNull(scope.getUserFunctionDefinition("contoso", "missing"));
		Assertions.assertNull(scope.getUserFunctionDefinition("missing", "uniqueName"));
	}

	@Test
	void testUserFunctionScopeSeesOnlyItsParameters() {
		DeploymentTemplate template = template(userFunctionTemplate());
		Assertions.assertEquals(2, template.getAllScopes().size());

		StringValue output = stringAt(template, "[concat(parameters('namePrefix')");
		TemplateScope scope = template.getScopeForValue(output);
		Assertions.assertEquals(TemplateScopeKind.USER_FUNCTION, scope.getKind());
		Assertions.assertTrue(scope.isInUserFunction());
		Assertions.assertNotNull(scope.getParameterDefinition("namePrefix"));
		Assertions.assertNull(scope.getParameterDefinition("topParam"));
		Assertions.assertTrue(scope.getVariableDefinitions().isEmpty());
		Assertions.assertTrue(scope.getNamespaceDefinitions().isEmpty());
	}

	@Test
	void testNamespaceWithoutMembers() {
		String text = "{ \"functions\": [ { \"namespace\": \"empty\" } ] }";
		UserFunctionNamespaceDefinition empty = template(text).getTopLevelScope().getFunctionNamespaceDefinition("empty");
		Assertions.assertTrue(empty.getMembers().isEmpty());
		Assertions.assertEquals("No members", empty.getDescription());
	}

	// ------------------------------------------------------------------
	// nested deployments
	// ------------------------------------------------------------------

	private static String nestedTemplate(String scopeValue) {
		StringBuilder contents = new StringBuilder();
		contents.append("{\n");
		contents.append("  \"parameters\": { \"outerParam\": { \"type\": \"string\" } },\n");
		contents.append("  \"resources\": [ {\n");
		contents.append("    \"type\": \"Microsoft.Resources/deployments\",\n");
		contents.append("    \"name\": \"inner\",\n");
		contents.append("    \"properties\": {\n");
		if (scopeValue != null) {
			contents.append("      \"expressionEvaluationOptions\": { \"scope\": \"" + scopeValue + "\" },\n");
		}
		contents.append("      \"template\": {\n");
		contents.append("        \"parameters\": { \"innerParam\": { \"type\": \"string\" } },\n");
		contents.append("        \"resources\": [ { \"type\": \"a/b\", \"name\": \"[parameters('innerParam')]\" } ]\n");
		contents.append("      }\n");
		contents.append("    }\n");
		contents.append("  } ]\n");
		contents.append("}");
		return contents.toString();
	}

	@Test
	void testNestedInnerScope() {
		DeploymentTemplate template = template(nestedTemplate("inner"));
		Assertions.assertEquals(2, template.getAllScopes().size());

		TemplateScope scope = template.getScopeForValue(stringAt(template, "[parameters('innerParam')]"));
		Assertions.assertEquals(TemplateScopeKind.NESTED_DEPLOYMENT_INNER_SCOPE, scope.getKind());
		Assertions.assertEquals("nested template inner", scope.getDisplayName());
		Assertions.assertNotNull(scope.getParameterDefinition("innerParam"));
		Assertions.assertNull(scope.getParameterDefinition("outerParam"));
		Assertions.assertEquals(1, scope.getResourceObjects().size());
	}

	@Test
	void testNestedOuterScopeSharesParentMembers() {
		DeploymentTemplate template = template(nestedTemplate(null));
		TemplateScope scope = template.getScopeForValue(stringAt(template, "[parameters('innerParam')]"));
		Assertions.assertEquals(TemplateScopeKind.NESTED_DEPLOYMENT_OUTER_SCOPE, scope.getKind());
		Assertions.assertFalse(scope.hasUniqueParamsVarsAndFunctions());
		Assertions.assertNotNull(scope.getParameterDefinition("outerParam"));
		Assertions.assertNull(scope.getParameterDefinition("innerParam"));
		Assertions.assertEquals(1, scope.getResourceObjects().size());
	}

	@Test
	void testValueOutsideNestedTemplateUsesTopLevelScope() {
		DeploymentTemplate template = template(nestedTemplate("inner"));
		TemplateScope scope = template.getScopeForValue(stringAt(template, "\"inner\""));
		Assertions.assertSame(template.getTopLevelScope(), scope);
	}

	// ------------------------------------------------------------------
	// expressions
	// ------------------------------------------------------------------

	@Test
	void testStringValuesIncludePropertyNames() {
		DeploymentTemplate template = template("{ \"a\": \"b\", \"c\": [ \"d\" ] }");
		Assertions.assertEquals(4, template.getStringValues().size());
	}

	@Test
	void testParseResultIsCached() {
		DeploymentTemplate template = template("{ \"a\": \"[concat('x')]\" }");
		StringValue value = stringAt(template, "[concat");
		Assertions.assertSame(template.getParseResult(value), template.getParseResult(value));
		Assertions.assertTrue(template.getParseResult(value).isExpression());
	}

	@Test
	void testExpressionIssuesUseDocumentOffsets() {
		String text = "{ \"a\": \"[concat('x')\" }";
		DeploymentTemplate template = template(text);
		List<Issue> issues = template.getExpressionIssues();
		Assertions.assertEquals(1, issues.size());
		Assertions.assertEquals(text.indexOf("\" }"), issues.get(0).getSpan().getStartIndex());
	}

	@Test
	void testDefinitionKindFriendlyNames() {
		Assertions.assertEquals("parameter", DefinitionKind.PARAMETER.getFriendlyName());
		Assertions.assertEquals("user-defined function", DefinitionKind.USER_FUNCTION.getFriendlyName());
	}
}
