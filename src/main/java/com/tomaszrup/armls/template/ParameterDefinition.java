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

import java.util.Objects;

import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.Property;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.Span;

/**
 * A template parameter ({@code "parameters": {"name": {...}}}) or a user
 * function parameter ({@code "parameters": [{"name": "x", "type": "string"}]}).
 */
public final class ParameterDefinition implements NamedDefinition {
	private final StringValue nameValue;
	private final ObjectValue definitionObject;
	private final Span span;

	private ParameterDefinition(StringValue nameValue, ObjectValue definitionObject, Span span) {
		this.nameValue = Objects.requireNonNull(nameValue, "nameValue");
		this.definitionObject = definitionObject;
		this.span = span;
	}

	public static ParameterDefinition fromProperty(Property property) {
		return new ParameterDefinition(property.getNameValue(), JsonValue.asObjectValue(property.getValue()),
				property.getSpan());
	}

	/**
	 * Creates a user function parameter definition, or returns {@code null}
	 * when the object has no string {@code name}.
	 */
	public static ParameterDefinition fromUserFunctionParameter(ObjectValue parameterObject) {
		StringValue name = JsonValue.asStringValue(parameterObject.getPropertyValue(TemplateKeys.LOOP_VAR_NAME));
		if (name == null) {
			return null;
		}
		return new ParameterDefinition(name, parameterObject, parameterObject.getSpan());
	}

	@Override
	public DefinitionKind getDefinitionKind() {
		return DefinitionKind.PARAMETER;
	}

	@Override
	public StringValue getNameValue() {
		return nameValue;
	}

	@Override
	public String getName() {
		return nameValue.getUnquotedValue();
	}

	public Span getSpan() {
		return span;
	}

	/** The declared type, e.g. {@code "string"}, or {@code null}. */
	public String getType() {
		StringValue type = definitionObject != null
				? JsonValue.asStringValue(definitionObject.getPropertyValue(TemplateKeys.PARAMETER_TYPE))
				: null;
		return type != null ? type.getUnquotedValue() : null;
	}

	public JsonValue getDefaultValue() {
		return definitionObject != null ? definitionObject.getPropertyValue(TemplateKeys.PARAMETER_DEFAULT_VALUE) : null;
	}

	@Override
	public String getDescription() {
		if (definitionObject == null) {
			return null;
		}
		ObjectValue metadata = JsonValue.asObjectValue(definitionObject.getPropertyValue(TemplateKeys.METADATA));
		if (metadata == null) {
			return null;
		}
		StringValue description = JsonValue.asStringValue(metadata.getPropertyValue(TemplateKeys.DESCRIPTION));
		return description != null ? description.getUnquotedValue() : null;
	}

	@Override
	public String getUsage() {
		return getName();
	}

	@Override
	public String toString() {
		return getName();
	}
}
