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

import com.tomaszrup.armls.language.Issue;
import com.tomaszrup.armls.language.Span;

/**
 * Recursive-descent parser for the bracketed expressions embedded in JSON
 * strings:
 *
 * <pre>
 * expr           := primary (propertyAccess | arrayAccess)*
 * primary        := functionCall | string | number
 * functionCall   := (namespace '.')? name '(' (expr (',' expr)*)? ')'
 * propertyAccess := '.' name?
 * arrayAccess    := '[' expr? ']'
 * </pre>
 *
 * Parsing never fails: malformed input yields a partial tree plus issues.
 */
public final class Parser {
	static final String EXPECTED_LITERAL = "Expected a literal value.";
	static final String EXPECTED_END_OF_STRING = "Expected the end of the string.";
	static final String NOTHING_AFTER_CLOSING_BRACKET = "Nothing should exist after the closing ']' except for whitespace.";
	static final String EXPECTED_RIGHT_SQUARE_BRACKET = "Expected a right square bracket (']').";
	static final String EXPECTED_FUNCTION_OR_PROPERTY = "Expected a function or property expression.";
	static final String MISSING_END_QUOTE = "A constant string is missing an end quote.";
	static final String MUST_START_WITH_FUNCTION = "Template language expressions must start with a function.";
	static final String EXPECTED_USER_FUNCTION_NAME = "Expected user-defined function name.";
	static final String MISSING_ARGUMENT_LIST = "Missing function argument list.";
	static final String EXPECTED_ARGUMENT = "Expected a constant string, function, or property expression.";
	static final String EXPECTED_COMMA = "Expected a comma (',').";
	static final String EXPECTED_RIGHT_PARENTHESIS = "Expected a right parenthesis (')').";

	private final Tokenizer tokenizer;
	private final List<Issue> issues = new ArrayList<>();

	private Parser(Tokenizer tokenizer) {
		this.tokenizer = tokenizer;
	}

	/**
	 * Parses a JSON string as written in the document, quotes included. Strings
	 * that do not start with {@code [}, or that start with the {@code [[}
	 * escape, parse to a single {@link StringLiteral}.
	 */
	public static ParseResult parse(String quotedString) {
		if (quotedString == null || quotedString.isEmpty()) {
			throw new IllegalArgumentException("quotedString must contain at least the opening quote");
		}
		if (quotedString.length() >= 3 && quotedString.startsWith("[[", 1)) {
			return wholeString(quotedString);
		}
		Parser parser = new Parser(Tokenizer.fromString(quotedString));
		parser.tokenizer.next();
		Token leftSquareBracket = parser.current();
		if (leftSquareBracket == null || leftSquareBracket.getType() != TokenType.LEFT_SQUARE_BRACKET) {
			return wholeString(quotedString);
		}
		return parser.parseBracketedExpression(quotedString, leftSquareBracket);
	}

	private static ParseResult wholeString(String quotedString) {
		boolean terminated = quotedString.length() > 1
				&& quotedString.charAt(quotedString.length() - 1) == quotedString.charAt(0);
		StringLiteral literal = new StringLiteral(new Token(TokenType.QUOTED_STRING, 0, quotedString, terminated));
		return new ParseResult(null, literal, null, new ArrayList<>());
	}

	private ParseResult parseBracketedExpression(String quotedString, Token leftSquareBracket) {
		tokenizer.next();
		while (current() != null && !isCurrent(TokenType.LITERAL) && !isCurrent(TokenType.RIGHT_SQUARE_BRACKET)) {
			addIssue(current().getSpan(), EXPECTED_LITERAL);
			tokenizer.next();
		}

		ExpressionValue expression = parseExpression();

		Token rightSquareBracket = null;
		while (current() != null) {
			if (isCurrent(TokenType.RIGHT_SQUARE_BRACKET)) {
				rightSquareBracket = current();
				tokenizer.next();
				break;
			}
			addIssue(current().getSpan(), EXPECTED_END_OF_STRING);
			tokenizer.next();
		}

		if (rightSquareBracket != null) {
			while (current() != null) {
				addIssue(current().getSpan(), NOTHING_AFTER_CLOSING_BRACKET);
				tokenizer.next();
			}
		} else {
			addIssue(new Span(quotedString.length() - 1, 1), EXPECTED_RIGHT_SQUARE_BRACKET);
		}

		if (expression == null) {
			Span errorSpan = leftSquareBracket.getSpan();
			if (rightSquareBracket != null) {
				errorSpan = errorSpan.union(rightSquareBracket.getSpan());
			}
			addIssue(errorSpan, EXPECTED_FUNCTION_OR_PROPERTY);
		}
		return new ParseResult(leftSquareBracket, expression, rightSquareBracket, issues);
	}

	private ExpressionValue parseExpression() {
		Token token = current();
		if (token == null) {
			return null;
		}
		ExpressionValue expression = null;
		switch (token.getType()) {
			case LITERAL:
				expression = parseFunctionCall();
				break;
			case QUOTED_STRING:
				StringLiteral literal = new StringLiteral(token);
				if (!literal.hasCloseQuote()) {
					addIssue(token.getSpan(), MISSING_END_QUOTE);
				}
				expression = literal;
				tokenizer.next();
				break;
			case NUMBER:
				expression = new NumberLiteral(token);
				tokenizer.next();
				break;
			case RIGHT_SQUARE_BRACKET:
			case COMMA:
				break;
			default:
				addIssue(token.getSpan(), MUST_START_WITH_FUNCTION);
				tokenizer.next();
				break;
		}
		if (expression == null) {
			return null;
		}

		while (current() != null) {
			if (isCurrent(TokenType.PERIOD)) {
				expression = parsePropertyAccess(expression);
			} else if (isCurrent(TokenType.LEFT_SQUARE_BRACKET)) {
				Token leftSquareBracket = current();
				tokenizer.next();
				ExpressionValue index = parseExpression();
				Token rightSquareBracket = null;
				if (isCurrent(TokenType.RIGHT_SQUARE_BRACKET)) {
					rightSquareBracket = current();
					tokenizer.next();
				}
				expression = new ArrayAccess(expression, leftSquareBracket, index, rightSquareBracket);
			} else {
				break;
			}
		}
		return expression;
	}

	private PropertyAccess parsePropertyAccess(ExpressionValue source) {
		Token periodToken = current();
		tokenizer.next();
		Token nameToken = null;
		Token token = current();
		if (token == null) {
			addIssue(periodToken.getSpan(), EXPECTED_LITERAL);
		} else if (token.getType() == TokenType.LITERAL) {
			nameToken = token;
			tokenizer.next();
		} else {
			addIssue(token.getSpan(), EXPECTED_LITERAL);
			if (token.getType() != TokenType.RIGHT_PARENTHESIS
					&& token.getType() != TokenType.RIGHT_SQUARE_BRACKET
					&& token.getType() != TokenType.COMMA) {
				tokenizer.next();
			}
		}
		// Built even without a name so the access can be completed
		return new PropertyAccess(source, periodToken, nameToken);
	}

	private FunctionCall parseFunctionCall() {
		Token namespaceToken = null;
		Token periodToken = null;
		Token nameToken = null;

		Token firstToken = current();
		tokenizer.next();
		if (isCurrent(TokenType.PERIOD)) {
			periodToken = current();
			namespaceToken = firstToken;
			tokenizer.next();
			if (isCurrent(TokenType.LITERAL)) {
				nameToken = current();
				tokenizer.next();
			} else {
				addIssue(periodToken.getSpan(), EXPECTED_USER_FUNCTION_NAME);
			}
		} else {
			nameToken = firstToken;
		}
		Span fullNameSpan = nameToken != null ? Span.union(nameToken.getSpan(),
				namespaceToken != null ? namespaceToken.getSpan() : null) : namespaceToken.getSpan();

		Token leftParenthesis = null;
		if (current() == null) {
			addIssue(fullNameSpan, MISSING_ARGUMENT_LIST);
		}
		while (current() != null) {
			if (isCurrent(TokenType.LEFT_PARENTHESIS)) {
				leftParenthesis = current();
				tokenizer.next();
				break;
			} else if (isCurrent(TokenType.RIGHT_SQUARE_BRACKET)) {
				addIssue(fullNameSpan, MISSING_ARGUMENT_LIST);
				break;
			} else {
				addIssue(current().getSpan(), EXPECTED_END_OF_STRING);
				tokenizer.next();
			}
		}

		List<Token> commaTokens = new ArrayList<>();
		List<ExpressionValue> arguments = new ArrayList<>();
		if (current() != null) {
			boolean expectingArgument = true;
			while (current() != null) {
				if (isCurrent(TokenType.RIGHT_PARENTHESIS) || isCurrent(TokenType.RIGHT_SQUARE_BRACKET)) {
					break;
				} else if (expectingArgument) {
					ExpressionValue argument = parseExpression();
					if (argument == null && isCurrent(TokenType.COMMA)) {
						addIssue(current().getSpan(), EXPECTED_ARGUMENT);
					}
					arguments.add(argument);
					expectingArgument = false;
				} else if (isCurrent(TokenType.COMMA)) {
					expectingArgument = true;
					commaTokens.add(current());
					tokenizer.next();
				} else {
					addIssue(current().getSpan(), EXPECTED_COMMA);
					tokenizer.next();
				}
			}

			if (expectingArgument && leftParenthesis != null && !arguments.isEmpty()) {
				// trailing comma: fn(a, )
				arguments.add(null);
				Span errorSpan = current() != null ? current().getSpan()
						: commaTokens.get(commaTokens.size() - 1).getSpan();
				addIssue(errorSpan, EXPECTED_ARGUMENT);
			}
		} else if (leftParenthesis != null) {
			addIssue(leftParenthesis.getSpan(), EXPECTED_RIGHT_PARENTHESIS);
		}

		Token rightParenthesis = null;
		if (isCurrent(TokenType.RIGHT_PARENTHESIS)) {
			rightParenthesis = current();
			tokenizer.next();
		} else if (isCurrent(TokenType.RIGHT_SQUARE_BRACKET) && leftParenthesis != null) {
			addIssue(current().getSpan(), EXPECTED_RIGHT_PARENTHESIS);
		}

		return new FunctionCall(namespaceToken, periodToken, nameToken, leftParenthesis, commaTokens, arguments,
				rightParenthesis);
	}

	private Token current() {
		return tokenizer.getCurrent();
	}

	private boolean isCurrent(TokenType type) {
		Token token = tokenizer.getCurrent();
		return token != null && token.getType() == type;
	}

	private void addIssue(Span span, String message) {
		issues.add(new Issue(span, message));
	}
}
