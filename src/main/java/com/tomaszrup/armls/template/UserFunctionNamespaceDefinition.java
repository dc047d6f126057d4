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

import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.Property;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.Span;

/**
 * An element of the {@code "functions"} array:
 * {@code {"namespace": "contoso", "members": {...}}}.
 */
public final class UserFunctionNamespaceDefinition implements NamedDefinition {
	private final StringValue nameValue;
	private final ObjectValue objectValue;
	private final List<UserFunctionDefinition> members;

	private UserFunctionNamespaceDefinition(TemplateScope parentScope, StringValue nameValue, ObjectValue objectValue) {
		this.nameValue = nameValue;
		this.objectValue = objectValue;
		List<UserFunctionDefinition> result = new ArrayList<>();
		ObjectValue membersObject = JsonValue.asObjectValue(objectValue.getPropertyValue(TemplateKeys.MEMBERS));
		if (membersObject != null) {
			for (Property member : membersObject.getProperties()) {
				ObjectValue memberObject = JsonValue.asObjectValue(member.getValue());
				if (memberObject != null) {
					result.add(new UserFunctionDefinition(parentScope, this, member.getNameValue(), memberObject,
							member.getSpan()));
				}
			}
		}
		this.members = Collections.unmodifiableList(result);
	}

	/**
	 * Returns {@code null} when the object has no string {@code namespace}.
	 */
	static UserFunctionNamespaceDefinition createIfValid(TemplateScope parentScope, ObjectValue namespaceObject) {
		StringValue name = JsonValue.asStringValue(namespaceObject.getPropertyValue(TemplateKeys.NAMESPACE));
		return name != null ? new UserFunctionNamespaceDefinition(parentScope, name, namespaceObject) : null;
	}

	@Override
	public DefinitionKind getDefinitionKind() {
		return DefinitionKind.NAMESPACE;
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
		return objectValue.getSpan();
	}

	public List<UserFunctionDefinition> getMembers() {
		return members;
	}

	public UserFunctionDefinition getMemberDefinition(String functionName) {
		if (functionName == null || functionName.isEmpty()) {
			return null;
		}
		UserFunctionDefinition result = null;
		for (UserFunctionDefinition member : members) {
			if (member.getName().equalsIgnoreCase(functionName)) {
				result = member;
			}
		}
		return result;
	}

	@Override
	public String getUsage() {
		return getName();
	}

	@Override
	public String getDescription() {
		if (members.isEmpty()) {
			return "No members";
		}
		StringBuilder description = new StringBuilder("Members:");
		for (UserFunctionDefinition member : members) {
			description.append('\n').append("* ").append(member.getUsage(false));
		}
		return description.toString();
	}

	@Override
	public String toString() {
		return getName();
	}
}
