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
package com.tomaszrup.armls.functions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.template.DefinitionKind;
import com.tomaszrup.armls.template.NamedDefinition;

public final class BuiltinFunctionMetadata implements FunctionMetadata, NamedDefinition {
	private final String name;
	private final String lowerCaseName;
	private final String usage;
	private final String description;
	private final int minimumArguments;
	private final int maximumArguments;
	private final List<String> returnValueMembers;
	private final Set<FunctionBehavior> behaviors;
	private final List<FunctionParameterMetadata> parameters;

	public BuiltinFunctionMetadata(String name, String usage, String description, int minimumArguments,
			int maximumArguments, List<String> returnValueMembers, Set<FunctionBehavior> behaviors) {
		this.name = name != null ? name : "";
		this.lowerCaseName = this.name.toLowerCase(Locale.ROOT);
		this.usage = usage != null ? usage : this.name;
		this.description = description;
		this.minimumArguments = minimumArguments;
		this.maximumArguments = maximumArguments;
		List<String> members = new ArrayList<>(returnValueMembers);
		Collections.sort(members);
		this.returnValueMembers = Collections.unmodifiableList(members);
		this.behaviors = behaviors.isEmpty() ? EnumSet.noneOf(FunctionBehavior.class) : EnumSet.copyOf(behaviors);
		this.parameters = Collections.unmodifiableList(parseParameters(this.usage));
	}

	/**
	 * Parameter names are the comma-separated words between the parentheses of
	 * the usage text, e.g. {@code resourceId([subscriptionId], [resourceGroupName], resourceType, resourceName1, ...)}.
	 */
	static List<FunctionParameterMetadata> parseParameters(String usage) {
		List<FunctionParameterMetadata> result = new ArrayList<>();
		int left = usage.indexOf('(');
		int right = usage.indexOf(')', left + 1);
		if (left < 0 || right < 0) {
			return result;
		}
		String parameterList = usage.substring(left + 1, right);
		if (parameterList.trim().isEmpty()) {
			return result;
		}
		for (String parameter : parameterList.split(",")) {
			result.add(new FunctionParameterMetadata(parameter.trim(), null));
		}
		return result;
	}

	@Override
	public String getName() {
		return name;
	}

	public String getLowerCaseName() {
		return lowerCaseName;
	}

	@Override
	public String getFullName() {
		return name;
	}

	@Override
	public String getUsage() {
		return usage;
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public List<FunctionParameterMetadata> getParameters() {
		return parameters;
	}

	@Override
	public int getMinimumArguments() {
		return minimumArguments;
	}

	@Override
	public int getMaximumArguments() {
		return maximumArguments;
	}

	@Override
	public List<String> getReturnValueMembers() {
		return returnValueMembers;
	}

	@Override
	public boolean hasBehavior(FunctionBehavior behavior) {
		return behaviors.contains(behavior);
	}

	@Override
	public DefinitionKind getDefinitionKind() {
		return DefinitionKind.BUILTIN_FUNCTION;
	}

	@Override
	public StringValue getNameValue() {
		return null;
	}

	@Override
	public String toString() {
		return name;
	}
}
