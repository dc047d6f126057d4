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
package com.tomaszrup.armls.json;

import com.tomaszrup.armls.language.Span;

/**
 * Base class of the span-aware JSON value tree.
 */
public abstract class JsonValue {
	private final Span span;

	protected JsonValue(Span span) {
		this.span = span;
	}

	public Span getSpan() {
		return span;
	}

	public abstract void accept(JsonVisitor visitor);

	public ObjectValue asObjectValue() {
		return this instanceof ObjectValue ? (ObjectValue) this : null;
	}

	public ArrayValue asArrayValue() {
		return this instanceof ArrayValue ? (ArrayValue) this : null;
	}

	public StringValue asStringValue() {
		return this instanceof StringValue ? (StringValue) this : null;
	}

	public static ObjectValue asObjectValue(JsonValue value) {
		return value != null ? value.asObjectValue() : null;
	}

	public static ArrayValue asArrayValue(JsonValue value) {
		return value != null ? value.asArrayValue() : null;
	}

	public static StringValue asStringValue(JsonValue value) {
		return value != null ? value.asStringValue() : null;
	}
}
