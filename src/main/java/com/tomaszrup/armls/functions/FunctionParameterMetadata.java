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

public final class FunctionParameterMetadata {
	private static final String VARIADIC_SUFFIX = "...";

	private final String name;
	private final String type;

	public FunctionParameterMetadata(String name, String type) {
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	/** The declared type, or {@code null} when unknown. */
	public String getType() {
		return type;
	}

	public boolean isVariadic() {
		return name.endsWith(VARIADIC_SUFFIX);
	}

	/** Label used in signatures, e.g. {@code prefix [string]}. */
	public String getUsage() {
		return type != null ? name + " [" + type + "]" : name;
	}

	@Override
	public String toString() {
		return getUsage();
	}
}
