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

/**
 * Well-known property names, function names and resource types of deployment
 * templates. Names compared case-insensitively are stored lowercased.
 */
public final class TemplateKeys {
	private TemplateKeys() {
	}

	public static final String PARAMETERS = "parameters";
	public static final String VARIABLES = "variables";
	public static final String FUNCTIONS = "functions";
	public static final String RESOURCES = "resources";
	public static final String OUTPUTS = "outputs";

	public static final String NAMESPACE = "namespace";
	public static final String MEMBERS = "members";
	public static final String OUTPUT = "output";

	public static final String COPY_LOOP = "copy";
	public static final String LOOP_VAR_NAME = "name";
	public static final String LOOP_VAR_INPUT = "input";

	public static final String PARAMETER_TYPE = "type";
	public static final String PARAMETER_DEFAULT_VALUE = "defaultValue";
	public static final String METADATA = "metadata";
	public static final String DESCRIPTION = "description";
	public static final String VALUE = "value";

	public static final String RESOURCE_NAME = "name";
	public static final String RESOURCE_TYPE = "type";
	public static final String DEPENDS_ON = "dependsOn";
	public static final String PROPERTIES = "properties";
	public static final String TAGS = "tags";
	public static final String DISPLAY_NAME_TAG = "displayName";

	public static final String NESTED_TEMPLATE = "template";
	public static final String EXPRESSION_EVALUATION_OPTIONS = "expressionEvaluationOptions";
	public static final String EXPRESSION_EVALUATION_SCOPE = "scope";
	public static final String INNER_SCOPE = "inner";

	public static final String SUBNETS = "subnets";

	public static final String DEPLOYMENTS_RESOURCE_TYPE = "microsoft.resources/deployments";
	public static final String VIRTUAL_NETWORKS_RESOURCE_TYPE = "microsoft.network/virtualnetworks";

	public static final String CONCAT_FUNCTION = "concat";
	public static final String RESOURCE_ID_FUNCTION = "resourceId";
}
