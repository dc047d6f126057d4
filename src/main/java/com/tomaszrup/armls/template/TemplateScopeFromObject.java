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
import com.tomaszrup.armls.json.Property;

/**
 * A scope whose members are declared in its own template object.
 */
abstract class TemplateScopeFromObject extends TemplateScope {
	private final List<ParameterDefinition> parameterDefinitions;
	private final List<VariableDefinition> variableDefinitions;
	private final List<UserFunctionNamespaceDefinition> namespaceDefinitions;

	TemplateScopeFromObject(TemplateScope parent, ObjectValue templateObject, String displayName) {
		super(parent, templateObject, displayName, true);
		this.parameterDefinitions = Collections.unmodifiableList(readParameters(templateObject));
		this.variableDefinitions = Collections.unmodifiableList(readVariables(templateObject));
		this.namespaceDefinitions = Collections.unmodifiableList(readNamespaces(this, templateObject));
	}

	@Override
	public List<ParameterDefinition> getParameterDefinitions() {
		return parameterDefinitions;
	}

	@Override
	public List<VariableDefinition> getVariableDefinitions() {
		return variableDefinitions;
	}

	@Override
	public List<UserFunctionNamespaceDefinition> getNamespaceDefinitions() {
		return namespaceDefinitions;
	}

	private static List<ParameterDefinition> readParameters(ObjectValue templateObject) {
		List<ParameterDefinition> result = new ArrayList<>();
		ObjectValue parameters = templateObject != null
				? JsonValue.asObjectValue(templateObject.getPropertyValue(TemplateKeys.PARAMETERS))
				: null;
		if (parameters != null) {
			for (Property parameter : parameters.getProperties()) {
				result.add(ParameterDefinition.fromProperty(parameter));
			}
		}
		return result;
	}

	private static List<VariableDefinition> readVariables(ObjectValue templateObject) {
		List<VariableDefinition> result = new ArrayList<>();
		ObjectValue variables = templateObject != null
				? JsonValue.asObjectValue(templateObject.getPropertyValue(TemplateKeys.VARIABLES))
				: null;
		if (variables == null) {
			return result;
		}
		for (Property variable : variables.getProperties()) {
			if (variable.hasName(TemplateKeys.COPY_LOOP)) {
				ArrayValue copyBlocks = JsonValue.asArrayValue(variable.getValue());
				if (copyBlocks != null) {
					for (JsonValue element : copyBlocks.getElements()) {
						VariableDefinition definition = VariableDefinition.fromCopyBlock(element);
						if (definition != null) {
							result.add(definition);
						}
					}
				}
			} else {
				result.add(VariableDefinition.fromProperty(variable));
			}
		}
		return result;
	}

	private static List<UserFunctionNamespaceDefinition> readNamespaces(TemplateScope scope, ObjectValue templateObject) {
		List<UserFunctionNamespaceDefinition> result = new ArrayList<>();
		ArrayValue functions = templateObject != null
				? JsonValue.asArrayValue(templateObject.getPropertyValue(TemplateKeys.FUNCTIONS))
				: null;
		if (functions != null) {
			for (JsonValue element : functions.getElements()) {
				ObjectValue namespaceObject = JsonValue.asObjectValue(element);
				if (namespaceObject != null) {
					UserFunctionNamespaceDefinition namespace =
							UserFunctionNamespaceDefinition.createIfValid(scope, namespaceObject);
					if (namespace != null) {
						result.add(namespace);
					}
				}
			}
		}
		return result;
	}
}
