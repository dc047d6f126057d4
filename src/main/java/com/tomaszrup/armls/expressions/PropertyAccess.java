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
import java.util.Objects;

import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;

/**
 * {@code source.name}. The name token may be missing while the user is still
 * typing; the access is modeled anyway so it can be completed.
 */
public final class PropertyAccess extends ExpressionValue {
	private final ExpressionValue source;
	private final Token periodToken;
	private final Token nameToken;

	public PropertyAccess(ExpressionValue source, Token periodToken, Token nameToken) {
		this.source = Objects.requireNonNull(source, "source");
		this.periodToken = Objects.requireNonNull(periodToken, "periodToken");
		this.nameToken = nameToken;
		adopt(this, source);
	}

	public ExpressionValue getSource() {
		return source;
	}

	public Token getPeriodToken() {
		return periodToken;
	}

	public Token getNameToken() {
		return nameToken;
	}

	/**
	 * Names of the property accesses this one is built on, nearest first. For
	 * {@code f().a.b.c} called on the {@code .c} access this is
	 * {@code ["b", "a"]}.
	 */
	public List<String> getSourcesNameStack() {
		List<String> result = new ArrayList<>();
		ExpressionValue current = source;
		while (current instanceof PropertyAccess && ((PropertyAccess) current).nameToken != null) {
			PropertyAccess access = (PropertyAccess) current;
			result.add(access.nameToken.getText());
			current = access.source;
		}
		return result;
	}

	/**
	 * The function call at the root of the access chain, if the chain starts
	 * with one.
	 */
	public FunctionCall getFunctionSource() {
		ExpressionValue current = source;
		while (current instanceof PropertyAccess) {
			current = ((PropertyAccess) current).source;
		}
		return current instanceof FunctionCall ? (FunctionCall) current : null;
	}

	@Override
	public Span getSpan() {
		return source.getSpan().union(nameToken != null ? nameToken.getSpan() : periodToken.getSpan());
	}

	@Override
	public boolean contains(int characterIndex) {
		return getSpan().contains(characterIndex, ContainsBehavior.EXTENDED);
	}

	@Override
	public void accept(ExpressionVisitor visitor) {
		visitor.visitPropertyAccess(this);
	}

	@Override
	public String toString() {
		return source + "." + (nameToken != null ? nameToken.getText() : "");
	}

	@Override
	public String format() {
		return source.format() + "." + (nameToken != null ? nameToken.getText() : "");
	}
}
