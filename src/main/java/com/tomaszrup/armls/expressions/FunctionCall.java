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
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.TemplateKeys;

/**
 * A call to a built-in function ({@code name(...)}) or to a user-defined one
 * ({@code namespace.name(...)}). Missing arguments, as in
 * {@code concat('a', , 'b')}, are kept as {@code null} entries so argument
 * positions stay stable.
 */
public final class FunctionCall extends ExpressionValue {
	private static final Pattern PROPERTY_INDEX = Pattern.compile("[\\]})]\\.[a-zA-Z0-9]");

	private final Token namespaceToken;
	private final Token periodToken;
	private final Token nameToken;
	private final Token leftParenthesisToken;
	private final List<Token> commaTokens;
	private final List<ExpressionValue> argumentExpressions;
	private final Token rightParenthesisToken;

	public FunctionCall(Token namespaceToken, Token periodToken, Token nameToken, Token leftParenthesisToken,
			List<Token> commaTokens, List<ExpressionValue> argumentExpressions, Token rightParenthesisToken) {
		if (namespaceToken == null && nameToken == null) {
			throw new IllegalArgumentException("A function call needs a namespace or a name");
		}
		if (namespaceToken != null && periodToken == null) {
			throw new IllegalArgumentException("A namespaced function call needs a period");
		}
		this.namespaceToken = namespaceToken;
		this.periodToken = periodToken;
		this.nameToken = nameToken;
		this.leftParenthesisToken = leftParenthesisToken;
		this.commaTokens = Collections.unmodifiableList(new ArrayList<>(commaTokens));
		this.argumentExpressions = Collections.unmodifiableList(new ArrayList<>(argumentExpressions));
		this.rightParenthesisToken = rightParenthesisToken;
		for (ExpressionValue argument : this.argumentExpressions) {
			adopt(this, argument);
		}
	}

	public Token getNamespaceToken() {
		return namespaceToken;
	}

	public Token getPeriodToken() {
		return periodToken;
	}

	public Token getNameToken() {
		return nameToken;
	}

	public Token getLeftParenthesisToken() {
		return leftParenthesisToken;
	}

	public Token getRightParenthesisToken() {
		return rightParenthesisToken;
	}

	public List<Token> getCommaTokens() {
		return commaTokens;
	}

	/** Argument expressions; a {@code null} entry is a missing argument. */
	public List<ExpressionValue> getArgumentExpressions() {
		return argumentExpressions;
	}

	public String getNamespace() {
		return namespaceToken != null ? namespaceToken.getText() : null;
	}

	public String getName() {
		return nameToken != null ? nameToken.getText() : null;
	}

	public String getFullName() {
		String name = nameToken != null ? nameToken.getText() : "";
		if (namespaceToken != null) {
			return namespaceToken.getText() + "." + name;
		}
		return name;
	}

	/**
	 * The span covering namespace, period and name, whichever exist.
	 */
	public Span getFullNameSpan() {
		Span result = Span.union(namespaceToken != null ? namespaceToken.getSpan() : null,
				periodToken != null ? periodToken.getSpan() : null);
		return Span.union(result, nameToken != null ? nameToken.getSpan() : null);
	}

	public Span getArgumentListSpan() {
		if (leftParenthesisToken == null) {
			return null;
		}
		Span result = leftParenthesisToken.getSpan();
		if (rightParenthesisToken != null) {
			return result.union(rightParenthesisToken.getSpan());
		}
		for (int i = argumentExpressions.size() - 1; i >= 0; i--) {
			ExpressionValue argument = argumentExpressions.get(i);
			if (argument != null) {
				result = result.union(argument.getSpan());
				break;
			}
		}
		if (!commaTokens.isEmpty()) {
			result = result.union(commaTokens.get(commaTokens.size() - 1).getSpan());
		}
		return result;
	}

	public boolean isUserFunction() {
		return namespaceToken != null;
	}

	public boolean isCallToBuiltinWithName(String functionName) {
		return doesNameMatch(null, functionName);
	}

	public boolean doesNameMatch(String namespaceName, String name) {
		if (nameToken == null || name == null || name.isEmpty()) {
			return false;
		}
		String expectedNamespace = namespaceName != null ? namespaceName : "";
		String actualNamespace = namespaceToken != null ? namespaceToken.getText() : "";
		return actualNamespace.equalsIgnoreCase(expectedNamespace) && nameToken.getText().equalsIgnoreCase(name);
	}

	@Override
	public Span getSpan() {
		return getFullNameSpan().union(getArgumentListSpan());
	}

	@Override
	public boolean contains(int characterIndex) {
		return getSpan().contains(characterIndex,
				rightParenthesisToken != null ? ContainsBehavior.STRICT : ContainsBehavior.EXTENDED);
	}

	@Override
	public void accept(ExpressionVisitor visitor) {
		visitor.visitFunctionCall(this);
	}

	@Override
	public String toString() {
		List<String> arguments = new ArrayList<>();
		for (ExpressionValue argument : argumentExpressions) {
			arguments.add(argument != null ? argument.toString() : "");
		}
		return render(arguments);
	}

	@Override
	public String format() {
		switch (getFullName().toLowerCase(Locale.ROOT)) {
			case TemplateKeys.CONCAT_FUNCTION:
				return coalesceConcatArguments();
			case TemplateKeys.PARAMETERS:
			case TemplateKeys.VARIABLES:
				if (argumentExpressions.size() == 1 && argumentExpressions.get(0) instanceof StringLiteral) {
					return "${" + ((StringLiteral) argumentExpressions.get(0)).getUnquotedValue() + "}";
				}
				break;
			default:
				break;
		}
		List<String> arguments = new ArrayList<>();
		for (ExpressionValue argument : argumentExpressions) {
			arguments.add(argument != null ? argument.format() : " ");
		}
		return render(arguments);
	}

	private String render(List<String> arguments) {
		StringBuilder result = new StringBuilder(getFullName());
		if (leftParenthesisToken != null) {
			result.append('(');
		}
		result.append(String.join(", ", arguments));
		if (rightParenthesisToken != null) {
			result.append(')');
		}
		return result.toString();
	}

	private String coalesceConcatArguments() {
		if (argumentExpressions.size() < 2) {
			ExpressionValue only = argumentExpressions.isEmpty() ? null : argumentExpressions.get(0);
			return only != null ? only.format() : "";
		}
		List<String> coalesced = new ArrayList<>();
		for (ExpressionValue argument : argumentExpressions) {
			String current = argument != null ? argument.format() : "";
			if (!coalesced.isEmpty()) {
				String previous = coalesced.get(coalesced.size() - 1);
				if (isStringLike(previous) && isStringLike(current) && !PROPERTY_INDEX.matcher(previous).find()) {
					coalesced.set(coalesced.size() - 1,
							"'" + ExpressionStrings.removeSingleQuotes(previous)
									+ ExpressionStrings.removeSingleQuotes(current) + "'");
					continue;
				}
			}
			coalesced.add(current);
		}
		if (coalesced.size() < 2) {
			return coalesced.get(0);
		}
		return "concat(" + String.join(", ", coalesced) + ")";
	}

	// ${name} is treated as a string, which it usually is
	private static boolean isStringLike(String expression) {
		return ExpressionStrings.isSingleQuoted(expression) || expression.startsWith("${");
	}
}
