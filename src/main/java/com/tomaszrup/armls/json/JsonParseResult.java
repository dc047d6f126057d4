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

import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;

/**
 * Result of parsing a JSON document: the significant tokens (whitespace and
 * comments excluded), the comment tokens, and the root value.
 */
public final class JsonParseResult {
	private final String text;
	private final List<JsonToken> tokens;
	private final List<JsonToken> commentTokens;
	private final JsonValue value;

	JsonParseResult(String text, List<JsonToken> tokens, List<JsonToken> commentTokens, JsonValue value) {
		this.text = text;
		this.tokens = Collections.unmodifiableList(tokens);
		this.commentTokens = Collections.unmodifiableList(commentTokens);
		this.value = value;
	}

	public String getText() {
		return text;
	}

	public List<JsonToken> getTokens() {
		return tokens;
	}

	public List<JsonToken> getCommentTokens() {
		return commentTokens;
	}

	/** The root value, or {@code null} for an empty document. */
	public JsonValue getValue() {
		return value;
	}

	/**
	 * Returns the token containing the character index
	 * ({@code start <= index <= endIndex}), or the last token when the index
	 * is right after it. Returns {@code null} on whitespace or comments.
	 */
	public JsonToken getTokenAtCharacterIndex(int characterIndex) {
		if (characterIndex < 0) {
			throw new IllegalArgumentException("characterIndex cannot be negative: " + characterIndex);
		}
		if (tokens.isEmpty()) {
			return null;
		}
		JsonToken lastToken = tokens.get(tokens.size() - 1);
		if (lastToken.getSpan().getAfterEndIndex() == characterIndex) {
			return lastToken;
		}
		int low = 0;
		int high = tokens.size() - 1;
		while (low <= high) {
			int mid = (low + high) >>> 1;
			Span span = tokens.get(mid).getSpan();
			if (characterIndex < span.getStartIndex()) {
				high = mid - 1;
			} else if (span.getEndIndex() < characterIndex) {
				low = mid + 1;
			} else {
				return tokens.get(mid);
			}
		}
		return null;
	}

	/**
	 * Returns the innermost value whose span contains the index.
	 */
	public JsonValue getValueAtCharacterIndex(int characterIndex, ContainsBehavior behavior) {
		JsonValue result = null;
		JsonValue current = value;
		while (current != null && current.getSpan().contains(characterIndex, behavior)) {
			result = current;
			current = findChildContaining(current, characterIndex, behavior);
		}
		return result;
	}

	private static JsonValue findChildContaining(JsonValue parent, int characterIndex, ContainsBehavior behavior) {
		for (JsonValue child : getChildren(parent)) {
			if (child.getSpan().contains(characterIndex, behavior)) {
				return child;
			}
		}
		return null;
	}

	/**
	 * Finds the string value whose span is exactly the given token span.
	 */
	public StringValue getStringValueForToken(JsonToken token) {
		if (token == null || token.getType() != JsonTokenType.QUOTED_STRING) {
			return null;
		}
		JsonValue found = getValueAtCharacterIndex(token.getSpan().getStartIndex(), ContainsBehavior.STRICT);
		StringValue stringValue = JsonValue.asStringValue(found);
		if (stringValue != null && stringValue.getSpan().equals(token.getSpan())) {
			return stringValue;
		}
		return null;
	}

	/**
	 * Returns the chain of ancestors of {@code target}, root first, not
	 * including {@code target} itself. Returns {@code null} if the target is
	 * not part of this tree.
	 */
	public List<JsonValue> getLineage(JsonValue target) {
		if (value == null || target == null) {
			return null;
		}
		List<JsonValue> lineage = new ArrayList<>();
		return findLineage(value, target, lineage) ? lineage : null;
	}

	private static boolean findLineage(JsonValue current, JsonValue target, List<JsonValue> lineage) {
		if (current == target) {
			return true;
		}
		if (!current.getSpan().contains(target.getSpan().getStartIndex(), ContainsBehavior.STRICT)) {
			return false;
		}
		lineage.add(current);
		for (JsonValue child : getChildren(current)) {
			if (findLineage(child, target, lineage)) {
				return true;
			}
		}
		lineage.remove(lineage.size() - 1);
		return false;
	}

	static List<JsonValue> getChildren(JsonValue parent) {
		if (parent instanceof ObjectValue) {
			return new ArrayList<JsonValue>(((ObjectValue) parent).getProperties());
		}
		if (parent instanceof ArrayValue) {
			return ((ArrayValue) parent).getElements();
		}
		if (parent instanceof Property) {
			Property property = (Property) parent;
			List<JsonValue> children = new ArrayList<>();
			children.add(property.getNameValue());
			if (property.getValue() != null) {
				children.add(property.getValue());
			}
			return children;
		}
		return Collections.emptyList();
	}
}
