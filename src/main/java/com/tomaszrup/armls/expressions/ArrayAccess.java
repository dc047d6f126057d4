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

import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;

/**
 * {@code source[index]}. Both the index and the closing bracket may be
 * missing.
 */
public final class ArrayAccess extends ExpressionValue {
	private final ExpressionValue source;
	private final Token leftSquareBracketToken;
	private final ExpressionValue indexValue;
	private final Token rightSquareBracketToken;

	public ArrayAccess(ExpressionValue source, Token leftSquareBracketToken, ExpressionValue indexValue,
			Token rightSquareBracketToken) {
		this.source = Objects.requireNonNull(source, "source");
		this.leftSquareBracketToken = Objects.requireNonNull(leftSquareBracketToken, "leftSquareBracketToken");
		this.indexValue = indexValue;
		this.rightSquareBracketToken = rightSquareBracketToken;
		adopt(this, source);
		adopt(this, indexValue);
	}

	public ExpressionValue getSource() {
		return source;
	}

	public Token getLeftSquareBracketToken() {
		return leftSquareBracketToken;
	}

	public ExpressionValue getIndexValue() {
		return indexValue;
	}

	public Token getRightSquareBracketToken() {
		return rightSquareBracketToken;
	}

	@Override
	public Span getSpan() {
		Span result = source.getSpan();
		if (rightSquareBracketToken != null) {
			return result.union(rightSquareBracketToken.getSpan());
		}
		if (indexValue != null) {
			return result.union(indexValue.getSpan());
		}
		return result.union(leftSquareBracketToken.getSpan());
	}

	@Override
	public boolean contains(int characterIndex) {
		return getSpan().contains(characterIndex,
				rightSquareBracketToken != null ? ContainsBehavior.STRICT : ContainsBehavior.EXTENDED);
	}

	@Override
	public void accept(ExpressionVisitor visitor) {
		visitor.visitArrayAccess(this);
	}

	@Override
	public String toString() {
		return source + "[" + (indexValue != null ? indexValue.toString() : "")
				+ (rightSquareBracketToken != null ? "]" : "");
	}

	@Override
	public String format() {
		return source.format() + "[" + (indexValue != null ? indexValue.format() : "")
				+ (rightSquareBracketToken != null ? "]" : "");
	}
}
