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

import java.util.List;

/**
 * What the editor knows about a callable function, built-in or user-defined.
 */
public interface FunctionMetadata {

	/** Name as used in calls; includes the namespace for user functions. */
	String getFullName();

	String getUsage();

	String getDescription();

	List<FunctionParameterMetadata> getParameters();

	int getMinimumArguments();

	int getMaximumArguments();

	/** Member names of the returned object, sorted; empty when unknown. */
	List<String> getReturnValueMembers();

	boolean hasBehavior(FunctionBehavior behavior);
}
