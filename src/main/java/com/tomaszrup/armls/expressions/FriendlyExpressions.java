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

import java.util.regex.Pattern;

/**
 * Readable renderings of expressions for labels, e.g.
 * {@code [concat(variables('a'), '/', parameters('b'))]} becomes
 * {@code ${a}/${b}}.
 */
public final class FriendlyExpressions {
	private static final Pattern PARAM_OR_VAR_INTERPOLATION = Pattern.compile("^\\$\\{[^{}]+\\}$");
	private static final Pattern PARAM_OR_VAR_CALL = Pattern.compile("\\b(variables|parameters)\\b\\('([^']+)'\\)",
			Pattern.CASE_INSENSITIVE);

	private FriendlyExpressions() {
	}

	/**
	 * Renders an unquoted JSON string value; plain strings are returned
	 * unchanged.
	 */
	public static String fromJsonString(String unquotedValue) {
		if (ExpressionStrings.isExpression(unquotedValue)) {
			return fromBracketedExpression("\"" + unquotedValue + "\"");
		}
		return unquotedValue;
	}

	/**
	 * Renders expression source text without the surrounding brackets.
	 */
	public static String fromExpression(String expression) {
		if (ExpressionStrings.isSingleQuoted(expression)) {
			return ExpressionStrings.removeSingleQuotes(expression);
		}
		return fromBracketedExpression("\"[" + expression + "]\"");
	}

	private static String fromBracketedExpression(String quotedBracketedString) {
		ParseResult result = Parser.parse(quotedBracketedString);
		if (result.getExpression() != null && result.getIssues().isEmpty()) {
			String friendly = result.getExpression().format();
			if (ExpressionStrings.isSingleQuoted(friendly)) {
				return ExpressionStrings.removeSingleQuotes(friendly);
			}
			if (PARAM_OR_VAR_INTERPOLATION.matcher(friendly).matches()) {
				return friendly;
			}
			return "[" + friendly + "]";
		}
		String unquoted = quotedBracketedString.substring(1, quotedBracketedString.length() - 1);
		return PARAM_OR_VAR_CALL.matcher(unquoted).replaceAll("\\${$2}");
	}
}
