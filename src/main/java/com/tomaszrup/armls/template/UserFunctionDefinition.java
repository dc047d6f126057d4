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

import com.tomaszrup.armls.json.ArrayValue;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.Span;

/**
 * A member of a user function namespace:
 *
 * <pre>
 * "members": {
 *     "uniqueName": {
 *         "parameters": [{"name": "namePrefix", "type": "string"}],
 *         "output": {"type": "string", "value": "[...]"}
 *     }
 * }
 * </pre>
 */
public final class UserFunctionDefinition implements NamedDefinition {
	private final UserFunctionNamespaceDefinition namespace;
	private final StringValue nameValue;
	private final ObjectValue objectValue;
	private final Span span;
	private final List<ParameterDefinition> parameterDefinitions;
	private final TemplateScope scope;

	UserFunctionDefinition(TemplateScope parentScope, UserFunctionNamespaceDefinition namespace, StringValue nameValue,
			ObjectValue objectValue, Span span) {
		this.namespace = namespace;
		this.nameValue = nameValue;
		this.objectValue = objectValue;
		this.span = span;
		this.parameterDefinitions = Collections.unmodifiableList(readParameters(objectValue));
		this.scope = new UserFunctionScope(parentScope, objectValue, parameterDefinitions, getFullName());
	}

	private static List<ParameterDefinition> readParameters(ObjectValue objectValue) {
		List<ParameterDefinition> result = new ArrayList<>();
		ArrayValue parameters = JsonValue.asArrayValue(objectValue.getPropertyValue(TemplateKeys.PARAMETERS));
		if (parameters != null) {
			for (JsonValue element : parameters.getElements()) {
				ObjectValue parameterObject = JsonValue.asObjectValue(element);
				if (parameterObject != null) {
					ParameterDefinition definition = ParameterDefinition.fromUserFunctionParameter(parameterObject);
					if (definition != null) {
						result.add(definition);
					}
				}
			}
		}
		return result;
	}

	@Override
	public DefinitionKind getDefinitionKind() {
		return DefinitionKind.USER_FUNCTION;
	}

	@Override
	public StringValue getNameValue() {
		return nameValue;
	}

	@Override
	public String getName() {
		return nameValue.getUnquotedValue();
	}

	public UserFunctionNamespaceDefinition getNamespace() {
		return namespace;
	}

	public String getFullName() {
		return namespace.getName() + "." + getName();
	}

	public ObjectValue getObjectValue() {
		return objectValue;
	}

	public Span getSpan() {
		return span;
	}

	public List<ParameterDefinition> getParameterDefinitions() {
		return parameterDefinitions;
	}

	/** Scope of expressions inside the function body. */
	public TemplateScope getScope() {
		return scope;
	}

	/** The declared output type, or {@code null}. */
	public String getOutputType() {
		ObjectValue output = JsonValue.asObjectValue(objectValue.getPropertyValue(TemplateKeys.OUTPUT));
		if (output == null) {
			return null;
		}
		StringValue type = JsonValue.asStringValue(output.getPropertyValue(TemplateKeys.PARAMETER_TYPE));
		return type != null ? type.getUnquotedValue() : null;
	}

	@Override
	public String getUsage() {
		return getUsage(true);
	}

	/**
	 * Usage text such as {@code contoso.uniqueName(namePrefix [string]) [string]}.
	 */
	public String getUsage(boolean includeNamespace) {
		List<String> parameters = new ArrayList<>();
		for (ParameterDefinition parameter : parameterDefinitions) {
			parameters.add(parameter.getType() != null
					? parameter.getName() + " [" + parameter.getType() + "]"
					: parameter.getName());
		}
		String usage = (includeNamespace ? getFullName() : getName()) + "(" + String.join(", ", parameters) + ")";
		String outputType = getOutputType();
		if (outputType != null) {
			usage += " [" + outputType + "]";
		}
		return usage;
	}

	@Override
	public String getDescription() {
		return null;
	}

	@Override
	public String toString() {
		return getFullName();
	}
}
