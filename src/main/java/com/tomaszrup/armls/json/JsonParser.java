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
import java.util.List;

import com.tomaszrup.armls.language.Span;

/**
 * Tolerant recursive-descent parser building a {@link JsonValue} tree with
 * spans. Malformed input yields a best-effort tree; nothing is thrown.
 */
public final class JsonParser {
	private final List<JsonToken> tokens;
	private int index;

	private JsonParser(List<JsonToken> tokens) {
		this.tokens = tokens;
	}

	public static JsonParseResult parse(String text) {
		List<JsonToken> allTokens = JsonTokenizer.tokenize(text);
		List<JsonToken> tokens = new ArrayList<>();
		List<JsonToken> commentTokens = new ArrayList<>();
		for (JsonToken token : allTokens) {
			if (token.getType() == JsonTokenType.COMMENT) {
				commentTokens.add(token);
			} else if (token.getType() != JsonTokenType.WHITESPACE) {
				tokens.add(token);
			}
		}
		JsonParser parser = new JsonParser(tokens);
		JsonValue value = parser.parseValue();
		return new JsonParseResult(text, tokens, commentTokens, value);
	}

	private JsonToken current() {
		return index < tokens.size() ? tokens.get(index) : null;
	}

	private void advance() {
		index++;
	}

	private JsonValue parseValue() {
		JsonToken token = current();
		if (token == null) {
			return null;
		}
		switch (token.getType()) {
			case QUOTED_STRING:
				advance();
				return new StringValue(token.getSpan(), token.getText());
			case NUMBER:
				advance();
				return new NumberValue(token.getSpan(), token.getText());
			case BOOLEAN:
				advance();
				return new BooleanValue(token.getSpan(), "true".equals(token.getText()));
			case NULL:
				advance();
				return new NullValue(token.getSpan());
			case LEFT_CURLY_BRACKET:
				return parseObject();
			case LEFT_SQUARE_BRACKET:
				return parseArray();
			default:
				return null;
		}
	}

	private ObjectValue parseObject() {
		Span objectSpan = current().getSpan();
		List<Property> properties = new ArrayList<>();
		advance();

		Span propertySpan = null;
		StringValue propertyName = null;
		boolean foundColon = false;
		JsonToken token;
		while ((token = current()) != null) {
			objectSpan = objectSpan.union(token.getSpan());
			if (token.getType() == JsonTokenType.RIGHT_CURLY_BRACKET) {
				advance();
				break;
			} else if (propertyName == null) {
				if (token.getType() == JsonTokenType.QUOTED_STRING) {
					propertySpan = token.getSpan();
					propertyName = new StringValue(token.getSpan(), token.getText());
				}
				advance();
			} else if (!foundColon) {
				propertySpan = propertySpan.union(token.getSpan());
				if (token.getType() == JsonTokenType.COLON) {
					foundColon = true;
					advance();
				} else {
					propertyName = null;
				}
			} else {
				JsonValue propertyValue = parseValue();
				if (propertyValue != null) {
					propertySpan = propertySpan.union(propertyValue.getSpan());
					objectSpan = objectSpan.union(propertyValue.getSpan());
				}
				properties.add(new Property(propertySpan, propertyName, propertyValue));
				propertySpan = null;
				propertyName = null;
				foundColon = false;
			}
		}
		if (propertyName != null) {
			properties.add(new Property(propertySpan, propertyName, null));
		}
		return new ObjectValue(objectSpan, properties);
	}

	private ArrayValue parseArray() {
		Span span = current().getSpan();
		List<JsonValue> elements = new ArrayList<>();
		advance();

		boolean expectElement = true;
		JsonToken token;
		while ((token = current()) != null) {
			span = span.union(token.getSpan());
			if (token.getType() == JsonTokenType.RIGHT_SQUARE_BRACKET) {
				advance();
				break;
			} else if (expectElement) {
				JsonValue element = parseValue();
				if (element != null) {
					span = span.union(element.getSpan());
					elements.add(element);
					expectElement = false;
				} else {
					advance();
				}
			} else {
				if (token.getType() == JsonTokenType.COMMA) {
					expectElement = true;
				}
				advance();
			}
		}
		return new ArrayValue(span, elements);
	}
}
