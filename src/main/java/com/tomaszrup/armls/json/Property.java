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
 * A name/value pair inside an {@link ObjectValue}. The value is {@code null}
 * when the document is missing it (for example {@code "name": }).
 */
public final class Property extends JsonValue {
	private final StringValue nameValue;
	private final JsonValue value;

	public Property(Span span, StringValue nameValue, JsonValue value) {
		super(span);
		this.nameValue = nameValue;
		this.value = value;
	}

	public StringValue getNameValue() {
		return nameValue;
	}

	public String getName() {
		return nameValue.getUnquotedValue();
	}

	public JsonValue getValue() {
		return value;
	}

	public boolean hasName(String name) {
		return getName().equalsIgnoreCase(name);
	}

	@Override
	public void accept(JsonVisitor visitor) {
		visitor.visitProperty(this);
	}
}
