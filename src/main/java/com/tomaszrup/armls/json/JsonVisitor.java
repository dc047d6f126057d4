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

/**
 * Walks a JSON value tree. Every method recurses into children by default;
 * subclasses override what they care about and call {@code super} to keep
 * descending.
 */
public abstract class JsonVisitor {

	public void visitObjectValue(ObjectValue value) {
		for (Property property : value.getProperties()) {
			property.accept(this);
		}
	}

	public void visitProperty(Property property) {
		property.getNameValue().accept(this);
		if (property.getValue() != null) {
			property.getValue().accept(this);
		}
	}

	public void visitArrayValue(ArrayValue value) {
		for (JsonValue element : value.getElements()) {
			element.accept(this);
		}
	}

	public void visitStringValue(StringValue value) {
	}

	public void visitNumberValue(NumberValue value) {
	}

	public void visitBooleanValue(BooleanValue value) {
	}

	public void visitNullValue(NullValue value) {
	}
}
