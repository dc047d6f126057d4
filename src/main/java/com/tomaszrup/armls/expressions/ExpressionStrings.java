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

/**
 * Small helpers over the unquoted text of JSON strings and over expression
 * source text.
 */
public final class ExpressionStrings {
	private ExpressionStrings() {
	}

	/**
	 * Whether an unquoted JSON string value is a bracketed expression:
	 * {@code [...]}, but not the {@code [[} escape.
	 */
	public static boolean isExpression(String unquotedValue) {
		return unquotedValue != null
				&& unquotedValue.length() >= 2
				&& unquotedValue.charAt(0) == '['
				&& unquotedValue.charAt(unquotedValue.length() - 1) == ']'
				&& unquotedValue.charAt(1) != '[';
	}

	/**
	 * Converts an unquoted JSON string value to expression source text: the
	 * brackets of an expression are removed, a plain string becomes a
	 * single-quoted string literal.
	 */
	public static String jsonStringToExpression(String unquotedValue) {
		if (isExpression(unquotedValue)) {
			return unquotedValue.substring(1, unquotedValue.length() - 1);
		}
		return "'" + unquotedValue + "'";
	}

	public static boolean isSingleQuoted(String text) {
		return text.length() >= 2 && text.charAt(0) == '\'' && text.charAt(text.length() - 1) == '\'';
	}

	public static String removeSingleQuotes(String text) {
		return isSingleQuoted(text) ? text.substring(1, text.length() - 1) : text;
	}
}
