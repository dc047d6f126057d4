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
 * A JSON string, kept exactly as written (quotes and escapes included).
 */
public final class StringValue extends JsonValue {
	private final String quotedValue;

	public StringValue(Span span, String quotedValue) {
		super(span);
		this.quotedValue = quotedValue;
	}

	public String getQuotedValue() {
		return quotedValue;
	}

	/**
	 * The string without its surrounding quotes. A missing closing quote is
	 * tolerated.
	 */
	public String getUnquotedValue() {
		return quotedValue.substring(1, 1 + getUnquotedSpan().getLength());
	}

	public Span getUnquotedSpan() {
		Span span = getSpan();
		int length = quotedValue.length();
		boolean closed = length >= 2 && quotedValue.charAt(length - 1) == quotedValue.charAt(0);
		return new Span(span.getStartIndex() + 1, closed ? length - 2 : length - 1);
	}

	@Override
	public void accept(JsonVisitor visitor) {
		visitor.visitStringValue(this);
	}

	@Override
	public String toString() {
		return getUnquotedValue();
	}
}
