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
 * A variable, either a property of {@code "variables"} or an entry of its
 * {@code "copy"} array.
 */
public final class VariableDefinition implements NamedDefinition {
	private final StringValue nameValue;
	private final JsonValue value;
	private final Span span;
	private final boolean iterationVariable;

	private VariableDefinition(StringValue nameValue, JsonValue value, Span span, boolean iterationVariable) {
		this.nameValue = Objects.requireNonNull(nameValue, "nameValue");
		this.value = value;
		this.span = span;
		this.iterationVariable = iterationVariable;
	}

	public static VariableDefinition fromProperty(Property property) {
		return new VariableDefinition(property.getNameValue(), property.getValue(), property.getSpan(), false);
	}

	/**
	 * Creates a definition from a {@code {"name", "count", "input"}} copy block
	 * entry, or returns {@code null} if it has no string name.
	 */
	public static VariableDefinition fromCopyBlock(JsonValue copyElement) {
		ObjectValue copyObject = JsonValue.asObjectValue(copyElement);
		if (copyObject == null) {
			return null;
		}
		StringValue name = JsonValue.asStringValue(copyObject.getPropertyValue(TemplateKeys.LOOP_VAR_NAME));
		if (name == null) {
			return null;
		}
		return new VariableDefinition(name, copyObject.getPropertyValue(TemplateKeys.LOOP_VAR_INPUT),
				copyObject.getSpan(), true);
	}

	@Override
	public DefinitionKind getDefinitionKind() {
		return DefinitionKind.VARIABLE;
	}

	@Override
	public StringValue getNameValue() {
		return nameValue;
	}

	@Override
	public String getName() {
		return nameValue.getUnquotedValue();
	}

	/** The variable's value (for copy blocks, the {@code input} value). */
	public JsonValue getValue() {
		return value;
	}

	public Span getSpan() {
		return span;
	}

	public boolean isIterationVariable() {
		return iterationVariable;
	}

	@Override
	public String getFriendlyType() {
		return iterationVariable ? "iteration variable" : "variable";
	}

	@Override
	public String getUsage() {
		return getName();
	}

	@Override
	public String getDescription() {
		return null;
	}

	@Override
	public String toString() {
		return getName();
	}
}
