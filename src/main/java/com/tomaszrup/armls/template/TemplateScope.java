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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.armls.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.armls.expressions.ExpressionValue;
import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.expressions.StringLiteral;
import com.tomaszrup.armls.json.ArrayValue;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.StringValue;

/**
 * The parameters, variables, user function namespaces and resources visible
 * to the expressions inside {@link #getRootObject()}. Name lookups are
 * case-insensitive and the last declaration of a name wins.
 */
public abstract class TemplateScope {
	private final TemplateScope parent;
	private final ObjectValue rootObject;
	private final String displayName;
	private final List<ObjectValue> resourceObjects;
	private final List<TemplateScope> deploymentScopes;

	protected TemplateScope(TemplateScope parent, ObjectValue rootObject, String displayName, boolean ownsResources) {
		this.parent = parent;
		this.rootObject = rootObject;
		this.displayName = displayName;
		this.resourceObjects = ownsResources ? readResourceObjects(rootObject) : Collections.<ObjectValue>emptyList();
		this.deploymentScopes = Collections.unmodifiableList(createDeploymentScopes(this, resourceObjects));
	}

	public abstract TemplateScopeKind getKind();

	public abstract List<ParameterDefinition> getParameterDefinitions();

	public abstract List<VariableDefinition> getVariableDefinitions();

	public abstract List<UserFunctionNamespaceDefinition> getNamespaceDefinitions();

	/**
	 * Whether parameters, variables and namespaces belong to this scope rather
	 * than being shared with the parent. Resources always belong to the scope.
	 */
	public boolean hasUniqueParamsVarsAndFunctions() {
		return true;
	}

	public TemplateScope getParent() {
		return parent;
	}

	/** Expressions inside this object are evaluated in this scope. */
	public ObjectValue getRootObject() {
		return rootObject;
	}

	public String getDisplayName() {
		return displayName;
	}

	/** Objects of this scope's {@code "resources"} array. */
	public List<ObjectValue> getResourceObjects() {
		return resourceObjects;
	}

	/**
	 * Nested deployment scopes and, for scopes with their own members, the
	 * scopes of the user functions.
	 */
	public List<TemplateScope> getChildScopes() {
		List<TemplateScope> result = new ArrayList<>(deploymentScopes);
		if (hasUniqueParamsVarsAndFunctions()) {
			for (UserFunctionNamespaceDefinition namespace : getNamespaceDefinitions()) {
				for (UserFunctionDefinition member : namespace.getMembers()) {
					result.add(member.getScope());
				}
			}
		}
		return result;
	}

	public ParameterDefinition getParameterDefinition(String parameterName) {
		return findLast(getParameterDefinitions(), parameterName);
	}

	public VariableDefinition getVariableDefinition(String variableName) {
		return findLast(getVariableDefinitions(), variableName);
	}

	public UserFunctionNamespaceDefinition getFunctionNamespaceDefinition(String namespaceName) {
		return findLast(getNamespaceDefinitions(), namespaceName);
	}

	public UserFunctionDefinition getUserFunctionDefinition(String namespaceName, String functionName) {
		UserFunctionNamespaceDefinition namespace = getFunctionNamespaceDefinition(namespaceName);
		return namespace != null ? namespace.getMemberDefinition(functionName) : null;
	}

	/**
	 * For {@code parameters('name')}, the parameter it refers to.
	 */
	public ParameterDefinition getParameterDefinitionFromFunctionCall(FunctionCall call) {
		String name = getFirstStringArgument(call, TemplateKeys.PARAMETERS);
		return name != null ? getParameterDefinition(name) : null;
	}

	/**
	 * For {@code variables('name')}, the variable it refers to.
	 */
	public VariableDefinition getVariableDefinitionFromFunctionCall(FunctionCall call) {
		String name = getFirstStringArgument(call, TemplateKeys.VARIABLES);
		return name != null ? getVariableDefinition(name) : null;
	}

	public boolean isInUserFunction() {
		return getKind() == TemplateScopeKind.USER_FUNCTION;
	}

	private static String getFirstStringArgument(FunctionCall call, String builtinName) {
		if (call == null || !call.isCallToBuiltinWithName(builtinName) || call.getArgumentExpressions().isEmpty()) {
			return null;
		}
		ExpressionValue argument = call.getArgumentExpressions().get(0);
		return argument instanceof StringLiteral ? ((StringLiteral) argument).getUnquotedValue() : null;
	}

	private static <T extends NamedDefinition> T findLast(List<T> definitions, String name) {
		if (name == null || name.isEmpty()) {
			return null;
		}
		for (int i = definitions.size() - 1; i >= 0; i--) {
			T definition = definitions.get(i);
			if (definition.getName().equalsIgnoreCase(name)) {
				return definition;
			}
		}
		return null;
	}

	private static List<ObjectValue> readResourceObjects(ObjectValue rootObject) {
		List<ObjectValue> result = new ArrayList<>();
		ArrayValue resources = rootObject != null
				? JsonValue.asArrayValue(rootObject.getPropertyValue(TemplateKeys.RESOURCES))
				: null;
		if (resources != null) {
			for (JsonValue element : resources.getElements()) {
				ObjectValue resource = JsonValue.asObjectValue(element);
				if (resource != null) {
					result.add(resource);
				}
			}
		}
		return Collections.unmodifiableList(result);
	}

	private static List<TemplateScope> createDeploymentScopes(TemplateScope parent, List<ObjectValue> resources) {
		List<TemplateScope> result = new ArrayList<>();
		for (ObjectValue resource : resources) {
			if (!isDeploymentResource(resource)) {
				continue;
			}
			ObjectValue properties = JsonValue.asObjectValue(resource.getPropertyValue(TemplateKeys.PROPERTIES));
			ObjectValue template = properties != null
					? JsonValue.asObjectValue(properties.getPropertyValue(TemplateKeys.NESTED_TEMPLATE))
					: null;
			if (template == null) {
				continue;
			}
			StringValue resourceName = JsonValue.asStringValue(resource.getPropertyValue(TemplateKeys.RESOURCE_NAME));
			String displayName = "nested template " + (resourceName != null ? resourceName.getUnquotedValue() : "(unnamed)");
			if (isInnerScope(properties)) {
				result.add(new NestedTemplateInnerScope(parent, template, displayName));
			} else {
				result.add(new NestedTemplateOuterScope(parent, template, displayName));
			}
		}
		return result;
	}

	static boolean isDeploymentResource(ObjectValue resource) {
		StringValue type = JsonValue.asStringValue(resource.getPropertyValue(TemplateKeys.RESOURCE_TYPE));
		return type != null && type.getUnquotedValue().equalsIgnoreCase(TemplateKeys.DEPLOYMENTS_RESOURCE_TYPE);
	}

	private static boolean isInnerScope(ObjectValue deploymentProperties) {
		ObjectValue options = JsonValue.asObjectValue(
				deploymentProperties.getPropertyValue(TemplateKeys.EXPRESSION_EVALUATION_OPTIONS));
		StringValue scope = options != null
				? JsonValue.asStringValue(options.getPropertyValue(TemplateKeys.EXPRESSION_EVALUATION_SCOPE))
				: null;
		return scope != null && scope.getUnquotedValue().equalsIgnoreCase(TemplateKeys.INNER_SCOPE);
	}

	@Override
	public String toString() {
		return displayName;
	}
}
