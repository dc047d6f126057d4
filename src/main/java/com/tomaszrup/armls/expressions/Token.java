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

import java.util.Objects;

import com.tomaszrup.armls.language.Span;

/**
 * A token of an expression string. Spans are relative to the start of the
 * quoted JSON string, so index 0 is the opening quote.
 */
public final class Token {
	private final TokenType type;
	private final Span span;
	private final String text;
	private final boolean terminated;

	public Token(TokenType type, int startIndex, String text) {
		this(type, startIndex, text, true);
	}

	/**
	 * @param terminated {@code false} for a quoted string that runs to the end
	 *                   of the input without its closing quote
	 */
	public Token(TokenType type, int startIndex, String text, boolean terminated) {
		this.type = Objects.requireNonNull(type, "type");
		this.text = Objects.requireNonNull(text, "text");
		this.span = new Span(startIndex, text.length());
		this.terminated = terminated;
	}

	public TokenType getType() {
		return type;
	}

	public Span getSpan() {
		return span;
	}

	public String getText() {
		return text;
	}

	public int getLength() {
		return text.length();
	}

	public boolean isTerminated() {
		return terminated;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Token)) {
			return false;
		}
		Token other = (Token) obj;
		return type == other.type && span.equals(other.span) && text.equals(other.text)
				&& terminated == other.terminated;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, span, text);
	}

	@Override
	public String toString() {
		return text;
	}
}
