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
package com.tomaszrup.armls.expressions;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only tokenizer over the interior of a quoted JSON string. The
 * surrounding quotes are not tokenized, but token indexes still count the
 * opening quote, so the first token starts at index 1.
 *
 * <p>Inside the expression, single-quoted strings use {@code ''} as an
 * escaped quote, while double-quoted strings use JSON backslash escapes.
 * Strings without a closing quote absorb the rest of the input.</p>
 */
public final class Tokenizer {
	private final String text;
	private final int endIndex;
	private int position;
	private Token current;

	private Tokenizer(String text, int startIndex, int endIndex) {
		this.text = text;
		this.position = startIndex;
		this.endIndex = endIndex;
	}

	/**
	 * Creates a tokenizer for the given quoted string, as it is written in
	 * the document (including its quotes).
	 */
	public static Tokenizer fromString(String quotedString) {
		if (quotedString == null || quotedString.isEmpty()) {
			throw new IllegalArgumentException("quotedString must contain at least the opening quote");
		}
		char quote = quotedString.charAt(0);
		int endIndex = quotedString.length();
		if (endIndex >= 2 && quotedString.charAt(endIndex - 1) == quote) {
			endIndex--;
		}
		return new Tokenizer(quotedString, 1, endIndex);
	}

	/**
	 * Returns every token of the string, whitespace included.
	 */
	public static List<Token> tokenize(String quotedString) {
		Tokenizer tokenizer = fromString(quotedString);
		List<Token> tokens = new ArrayList<>();
		Token token;
		while ((token = tokenizer.readToken()) != null) {
			tokens.add(token);
		}
		return tokens;
	}

	public Token getCurrent() {
		return current;
	}

	public boolean hasCurrent() {
		return current != null;
	}

	/**
	 * Moves to the next non-whitespace token.
	 *
	 * @return whether a token was read before skipping whitespace
	 */
	public boolean next() {
		boolean result = readToken() != null;
		while (current != null && current.getType() == TokenType.WHITESPACE) {
			readToken();
		}
		return result;
	}

	Token readToken() {
		current = null;
		if (position >= endIndex) {
			return null;
		}
		int start = position;
		char c = text.charAt(position);
		switch (c) {
			case '(':
				return single(TokenType.LEFT_PARENTHESIS);
			case ')':
				return single(TokenType.RIGHT_PARENTHESIS);
			case '[':
				return single(TokenType.LEFT_SQUARE_BRACKET);
			case ']':
				return single(TokenType.RIGHT_SQUARE_BRACKET);
			case ',':
				return single(TokenType.COMMA);
			case '.':
				return single(TokenType.PERIOD);
			case ' ':
			case '\t':
			case '\r':
			case '\n':
				while (position < endIndex && isWhitespace(text.charAt(position))) {
					position++;
				}
				return createToken(TokenType.WHITESPACE, start);
			case '"':
				return createStringToken(start, readDoubleQuotedString());
			case '\'':
				return createStringToken(start, readSingleQuotedString());
			default:
				break;
		}
		if (c == '-' || isDigit(c)) {
			readNumber();
			return createToken(TokenType.NUMBER, start);
		}
		position++;
		if (isLetter(c)) {
			while (position < endIndex && isLetter(text.charAt(position))) {
				position++;
			}
		}
		while (position < endIndex && isLiteralPart(text.charAt(position))) {
			position++;
		}
		return createToken(TokenType.LITERAL, start);
	}

	private Token single(TokenType type) {
		int start = position++;
		return createToken(type, start);
	}

	private Token createToken(TokenType type, int start) {
		current = new Token(type, start, text.substring(start, position));
		return current;
	}

	private Token createStringToken(int start, boolean terminated) {
		current = new Token(TokenType.QUOTED_STRING, start, text.substring(start, position), terminated);
		return current;
	}

	/** @return whether the closing quote was found */
	private boolean readDoubleQuotedString() {
		position++;
		boolean escaped = false;
		while (position < endIndex) {
			char c = text.charAt(position++);
			if (escaped) {
				escaped = false;
			} else if (c == '\\') {
				escaped = true;
			} else if (c == '"') {
				return true;
			}
		}
		return false;
	}

	/** @return whether the closing quote was found; {@code ''} is an escaped quote */
	private boolean readSingleQuotedString() {
		position++;
		while (position < endIndex) {
			char c = text.charAt(position++);
			if (c == '\'') {
				if (position < endIndex && text.charAt(position) == '\'') {
					position++;
				} else {
					return true;
				}
			}
		}
		return false;
	}

	private void readNumber() {
		if (text.charAt(position) == '-') {
			position++;
		}
		skipDigits();
		if (position < endIndex && text.charAt(position) == '.') {
			position++;
			skipDigits();
		}
		if (position < endIndex && (text.charAt(position) == 'e' || text.charAt(position) == 'E')) {
			position++;
			if (position < endIndex && (text.charAt(position) == '+' || text.charAt(position) == '-')) {
				position++;
			}
			skipDigits();
		}
	}

	private void skipDigits() {
		while (position < endIndex && isDigit(text.charAt(position))) {
			position++;
		}
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\n';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isLiteralPart(char c) {
		return isLetter(c) || isDigit(c) || c == '_';
	}
}
