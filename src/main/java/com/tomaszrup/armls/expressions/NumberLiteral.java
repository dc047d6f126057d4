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

public final class NumberLiteral extends ExpressionValue {
	private final Token token;

	public NumberLiteral(Token token) {
		this.token = token;
	}

	public Token getToken() {
		return token;
	}

	@Override
	public Span getSpan() {
		return token.getSpan();
	}

	@Override
	public boolean contains(int characterIndex) {
		return getSpan().contains(characterIndex, ContainsBehavior.EXTENDED);
	}

	@Override
	public void accept(ExpressionVisitor visitor) {
		visitor.visitNumber(this);
	}

	@Override
	public String toString() {
		return token.getText();
	}
}
