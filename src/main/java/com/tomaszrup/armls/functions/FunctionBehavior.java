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

/**
 * Editor behaviors a built-in function opts into through its metadata.
 */
public enum FunctionBehavior {
	/** Arguments are completed with resource types and names, as for {@code resourceId}. */
	USES_RESOURCE_ID_COMPLETIONS("usesResourceIdCompletions");

	private final String metadataName;

	FunctionBehavior(String metadataName) {
		this.metadataName = metadataName;
	}

	public String getMetadataName() {
		return metadataName;
	}

	/** Returns {@code null} for unknown names. */
	public static FunctionBehavior fromMetadataName(String name) {
		for (FunctionBehavior behavior : values()) {
			if (behavior.metadataName.equalsIgnoreCase(name)) {
				return behavior;
			}
		}
		return null;
	}
}
