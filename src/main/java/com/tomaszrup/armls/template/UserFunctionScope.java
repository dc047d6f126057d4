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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.armls.json.ObjectValue;

/**
 * Scope of a user function body: only the function's own parameters are
 * visible.
 */
public final class UserFunctionScope extends TemplateScope {
	private final List<ParameterDefinition> parameterDefinitions;

	UserFunctionScope(TemplateScope parent, ObjectValue functionObject, List<ParameterDefinition> parameterDefinitions,
			String functionName) {
		super(parent, functionObject, "'" + functionName + "' (UDF) scope", false);
		this.parameterDefinitions = parameterDefinitions;
	}

	@Override
	public TemplateScopeKind getKind() {
		return TemplateScopeKind.USER_FUNCTION;
	}

	@Override
	public List<ParameterDefinition> getParameterDefinitions() {
		return parameterDefinitions;
	}

	@Override
	public List<VariableDefinition> getVariableDefinitions() {
		return Collections.emptyList();
	}

	@Override
	public List<UserFunctionNamespaceDefinition> getNamespaceDefinitions() {
		return Collections.emptyList();
	}
}
