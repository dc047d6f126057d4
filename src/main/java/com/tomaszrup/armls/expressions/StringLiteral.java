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

import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.TemplateKeys;

/**
 * A string value: either a whole JSON string that is not an expression, or a
 * single-quoted string inside an expression.
 */
public final class StringLiteral extends ExpressionValue {
	private final Token token;

	public StringLiteral(Token token) {
		this.token = token;
	}

	public Token getToken() {
		return token;
	}

	@Override
	public Span getSpan() {
		return token.getSpan();
	}

	public String getQuotedValue() {
		return token.getText();
	}

	public boolean hasCloseQuote() {
		return token.isTerminated();
	}

	/**
	 * The text between the quotes, without unescaping.
	 */
	public String getUnquotedValue() {
		String text = token.getText();
		return text.substring(1, hasCloseQuote() ? text.length() - 1 : text.length());
	}

	public Span getUnquotedSpan() {
		return new Span(getSpan().getStartIndex() + 1, getUnquotedValue().length());
	}

	@Override
	public boolean contains(int characterIndex) {
		return getSpan().contains(characterIndex, ContainsBehavior.EXTENDED);
	}

	public boolean isParametersArgument() {
		return isBuiltinFunctionArgument(TemplateKeys.PARAMETERS);
	}

	public boolean isVariablesArgument() {
		return isBuiltinFunctionArgument(TemplateKeys.VARIABLES);
	}

	/**
	 * Returns the function call this string is a direct argument of, if any.
	 */
	public FunctionCall getFunctionCallParentOfArgument() {
		return getParent() instanceof FunctionCall ? (FunctionCall) getParent() : null;
	}

	private boolean isBuiltinFunctionArgument(String functionName) {
		FunctionCall call = getFunctionCallParentOfArgument();
		return call != null
				&& call.isCallToBuiltinWithName(functionName)
				&& !call.getArgumentExpressions().isEmpty()
				&& call.getArgumentExpressions().get(0) == this;
	}

	@Override
	public void accept(ExpressionVisitor visitor) {
		visitor.visitString(this);
	}

	@Override
	public String toString() {
		return token.getText();
	}
}
