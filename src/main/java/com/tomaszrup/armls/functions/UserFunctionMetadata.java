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
import java.util.List;

import com.tomaszrup.armls.template.ParameterDefinition;
import com.tomaszrup.armls.template.UserFunctionDefinition;

/**
 * {@link FunctionMetadata} view of a user function definition.
 */
public final class UserFunctionMetadata implements FunctionMetadata {
	private final UserFunctionDefinition definition;
	private final List<FunctionParameterMetadata> parameters;

	public UserFunctionMetadata(UserFunctionDefinition definition) {
		this.definition = definition;
		List<FunctionParameterMetadata> result = new ArrayList<>();
		for (ParameterDefinition parameter : definition.getParameterDefinitions()) {
			result.add(new FunctionParameterMetadata(parameter.getName(), parameter.getType()));
		}
		this.parameters = Collections.unmodifiableList(result);
	}

	public UserFunctionDefinition getDefinition() {
		return definition;
	}

	@Override
	public String getFullName() {
		return definition.getFullName();
	}

	@Override
	public String getUsage() {
		return definition.getUsage();
	}

	@Override
	public String getDescription() {
		return null;
	}

	@Override
	public List<FunctionParameterMetadata> getParameters() {
		return parameters;
	}

	@Override
	public int getMinimumArguments() {
		return parameters.size();
	}

	@Override
	public int getMaximumArguments() {
		return parameters.size();
	}

	@Override
	public List<String> getReturnValueMembers() {
		return Collections.emptyList();
	}

	@Override
	public boolean hasBehavior(FunctionBehavior behavior) {
		return false;
	}
}
