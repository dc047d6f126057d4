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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.armls.language.Span;

/**
 * A JSON object. Property lookup ignores case, and when a name is declared
 * more than once the last declaration wins.
 */
public final class ObjectValue extends JsonValue {
	private final List<Property> properties;

	public ObjectValue(Span span, List<Property> properties) {
		super(span);
		this.properties = Collections.unmodifiableList(properties);
	}

	public List<Property> getProperties() {
		return properties;
	}

	public Property getProperty(String name) {
		for (int i = properties.size() - 1; i >= 0; i--) {
			Property property = properties.get(i);
			if (property.hasName(name)) {
				return property;
			}
		}
		return null;
	}

	public boolean hasProperty(String name) {
		return getProperty(name) != null;
	}

	public JsonValue getPropertyValue(String name) {
		Property property = getProperty(name);
		return property != null ? property.getValue() : null;
	}

	/**
	 * Follows a stack of property names from this object. The last element is
	 * the outermost name, so {@code ["b", "a"]} returns the value of
	 * {@code this.a.b}. Returns {@code null} as soon as a link is missing or is
	 * not an object.
	 */
	public JsonValue getPropertyValueFromStack(List<String> namesStack) {
		JsonValue current = this;
		for (int i = namesStack.size() - 1; i >= 0; i--) {
			ObjectValue object = JsonValue.asObjectValue(current);
			if (object == null) {
				return null;
			}
			current = object.getPropertyValue(namesStack.get(i));
		}
		return current;
	}

	/**
	 * Property names in declaration order, with their original casing. A name
	 * declared more than once is listed once, as its last declaration.
	 */
	public List<String> getPropertyNames() {
		List<String> names = new ArrayList<>();
		for (int i = 0; i < properties.size(); i++) {
			String name = properties.get(i).getName();
			if (!isRedeclaredAfter(name, i)) {
				names.add(name);
			}
		}
		return names;
	}

	private boolean isRedeclaredAfter(String name, int index) {
		for (int i = index + 1; i < properties.size(); i++) {
			if (properties.get(i).hasName(name)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public void accept(JsonVisitor visitor) {
		visitor.visitObjectValue(this);
	}
}
