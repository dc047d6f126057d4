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

/**
 * Splits JSON document text into {@link JsonToken}s. Tolerates the
 * relaxations deployment templates use in practice: single-quoted strings,
 * {@code //} and {@code /* *}{@code /} comments, and unterminated strings
 * (which absorb the rest of the input). Never throws on malformed input;
 * unknown characters become {@link JsonTokenType#UNRECOGNIZED} tokens.
 */
public final class JsonTokenizer {
	private final String text;
	private int pos;

	private JsonTokenizer(String text) {
		this.text = text;
	}

	/**
	 * Tokenizes the whole text, including whitespace and comment tokens.
	 */
	public static List<JsonToken> tokenize(String text) {
		JsonTokenizer tokenizer = new JsonTokenizer(text);
		List<JsonToken> tokens = new ArrayList<>();
		JsonToken token;
		while ((token = tokenizer.next()) != null) {
			tokens.add(token);
		}
		return tokens;
	}

	private JsonToken next() {
		if (pos >= text.length()) {
			return null;
		}
		int start = pos;
		char c = text.charAt(pos);
		switch (c) {
			case '{':
				return single(JsonTokenType.LEFT_CURLY_BRACKET);
			case '}':
				return single(JsonTokenType.RIGHT_CURLY_BRACKET);
			case '[':
				return single(JsonTokenType.LEFT_SQUARE_BRACKET);
			case ']':
				return single(JsonTokenType.RIGHT_SQUARE_BRACKET);
			case ',':
				return single(JsonTokenType.COMMA);
			case ':':
				return single(JsonTokenType.COLON);
			case '"':
			case '\'':
				readQuotedString(c);
				return token(JsonTokenType.QUOTED_STRING, start);
			case '/':
				return readCommentOrSlash(start);
			default:
				break;
		}
		if (Character.isWhitespace(c)) {
			while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
				pos++;
			}
			return token(JsonTokenType.WHITESPACE, start);
		}
		if (c == '-' || isDigit(c)) {
			readNumber();
			return token(JsonTokenType.NUMBER, start);
		}
		if (Character.isLetter(c)) {
			while (pos < text.length() && (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '_')) {
				pos++;
			}
			String word = text.substring(start, pos);
			if ("true".equals(word) || "false".equals(word)) {
				return new JsonToken(JsonTokenType.BOOLEAN, start, word);
			}
			if ("null".equals(word)) {
				return new JsonToken(JsonTokenType.NULL, start, word);
			}
			return new JsonToken(JsonTokenType.LITERAL, start, word);
		}
		return single(JsonTokenType.UNRECOGNIZED);
	}

	private JsonToken single(JsonTokenType type) {
		int start = pos++;
		return token(type, start);
	}

	private JsonToken token(JsonTokenType type, int start) {
		return new JsonToken(type, start, text.substring(start, pos));
	}

	private void readQuotedString(char quote) {
		pos++;
		boolean escaped = false;
		while (pos < text.length()) {
			char c = text.charAt(pos++);
			if (escaped) {
				escaped = false;
			} else if (c == '\\') {
				escaped = true;
			} else if (c == quote) {
				return;
			}
		}
	}

	private JsonToken readCommentOrSlash(int start) {
		pos++;
		if (pos < text.length() && text.charAt(pos) == '/') {
			while (pos < text.length() && text.charAt(pos) != '\n' && text.charAt(pos) != '\r') {
				pos++;
			}
			return token(JsonTokenType.COMMENT, start);
		}
		if (pos < text.length() && text.charAt(pos) == '*') {
			pos++;
			int end = text.indexOf("*/", pos);
			pos = end < 0 ? text.length() : end + 2;
			return token(JsonTokenType.COMMENT, start);
		}
		return token(JsonTokenType.LITERAL, start);
	}

	private void readNumber() {
		if (text.charAt(pos) == '-') {
			pos++;
		}
		skipDigits();
		if (pos < text.length() && text.charAt(pos) == '.') {
			pos++;
			skipDigits();
		}
		if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
			pos++;
			if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
				pos++;
			}
			skipDigits();
		}
	}

	private void skipDigits() {
		while (pos < text.length() && isDigit(text.charAt(pos))) {
			pos++;
		}
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}
}
