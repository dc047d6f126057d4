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

import java.util.List;

import com.tomaszrup.armls.json.ObjectValue;

/**
 * A nested deployment evaluated in the parent's scope (the default). Members
 * are shared with the parent; resources are its own.
 */
public final class NestedTemplateOuterScope extends TemplateScope {

	NestedTemplateOuterScope(TemplateScope parent, ObjectValue templateObject, String displayName) {
		super(parent, templateObject, displayName, true);
	}

	@Override
	public TemplateScopeKind getKind() {
		return TemplateScopeKind.NESTED_DEPLOYMENT_OUTER_SCOPE;
	}

	@Override
	public boolean hasUniqueParamsVarsAndFunctions() {
		return false;
	}

	@Override
	public List<ParameterDefinition> getParameterDefinitions() {
		return getParent().getParameterDefinitions();
	}

	@Override
	public List<VariableDefinition> getVariableDefinitions() {
		return getParent().getVariableDefinitions();
	}

	@Override
	public List<UserFunctionNamespaceDefinition> getNamespaceDefinitions() {
		return getParent().getNamespaceDefinitions();
	}
}
