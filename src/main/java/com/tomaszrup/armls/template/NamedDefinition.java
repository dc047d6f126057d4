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

import com.tomaszrup.armls.json.StringValue;

/**
 * Something an expression can refer to by name: a parameter, a variable, a
 * user function namespace, a user function or a built-in function.
 */
public interface NamedDefinition {

	DefinitionKind getDefinitionKind();

	/**
	 * The JSON string holding the definition's name, or {@code null} for
	 * definitions that do not live in the document (built-in functions).
	 */
	StringValue getNameValue();

	String getName();

	/** Usage text shown in hovers, e.g. {@code contoso.uniqueName(prefix [string]) [string]}. */
	String getUsage();

	/** Kind-specific description, e.g. {@code "iteration variable"}. */
	default String getFriendlyType() {
		return getDefinitionKind().getFriendlyName();
	}

	/** Optional longer description, may be {@code null}. */
	String getDescription();
}
