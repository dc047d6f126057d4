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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.armls.language.Issue;

/**
 * Result of parsing one quoted JSON string. Never mutated after creation.
 */
public final class ParseResult {
	private final Token leftSquareBracketToken;
	private final ExpressionValue expression;
	private final Token rightSquareBracketToken;
	private final List<Issue> issues;

	ParseResult(Token leftSquareBracketToken, ExpressionValue expression, Token rightSquareBracketToken,
			List<Issue> issues) {
		this.leftSquareBracketToken = leftSquareBracketToken;
		this.expression = expression;
		this.rightSquareBracketToken = rightSquareBracketToken;
		this.issues = Collections.unmodifiableList(issues);
	}

	public Token getLeftSquareBracketToken() {
		return leftSquareBracketToken;
	}

	/**
	 * The parsed expression; for a string that is not an expression this is a
	 * {@link StringLiteral} spanning the whole string. May be {@code null} for
	 * an empty expression such as {@code "[]"}.
	 */
	public ExpressionValue getExpression() {
		return expression;
	}

	public Token getRightSquareBracketToken() {
		return rightSquareBracketToken;
	}

	public List<Issue> getIssues() {
		return issues;
	}

	public boolean isExpression() {
		return leftSquareBracketToken != null;
	}

	/**
	 * Returns the narrowest value containing the character index. Function
	 * calls descend into the argument containing the index, array accesses
	 * into their source or index, and property accesses into their source
	 * only, so a cursor on a property name resolves to the access itself.
	 */
	public ExpressionValue getValueAtCharacterIndex(int characterIndex) {
		ExpressionValue current = expression;
		if (current == null || !current.contains(characterIndex)) {
			return null;
		}
		while (true) {
			ExpressionValue next = null;
			if (current instanceof FunctionCall) {
				for (ExpressionValue argument : ((FunctionCall) current).getArgumentExpressions()) {
					if (argument != null && argument.contains(characterIndex)) {
						next = argument;
						break;
					}
				}
			} else if (current instanceof ArrayAccess) {
				ArrayAccess arrayAccess = (ArrayAccess) current;
				if (arrayAccess.getSource().contains(characterIndex)) {
					next = arrayAccess.getSource();
				} else if (arrayAccess.getIndexValue() != null && arrayAccess.getIndexValue().contains(characterIndex)) {
					next = arrayAccess.getIndexValue();
				}
			} else if (current instanceof PropertyAccess) {
				PropertyAccess propertyAccess = (PropertyAccess) current;
				if (propertyAccess.getSource().contains(characterIndex)) {
					next = propertyAccess.getSource();
				}
			}
			if (next == null) {
				return current;
			}
			current = next;
		}
	}
}
