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

import com.tomaszrup.armls.language.Span;

/**
 * Base class of the expression tree nodes. Spans are relative to the quoted
 * JSON string that contains the expression.
 */
public abstract class ExpressionValue {
	private ExpressionValue parent;

	public ExpressionValue getParent() {
		return parent;
	}

	void setParent(ExpressionValue parent) {
		if (this.parent != null) {
			throw new IllegalStateException("Parent of " + this + " has already been set");
		}
		this.parent = parent;
	}

	public abstract Span getSpan();

	/**
	 * Whether the character index belongs to this value. Unless a closing
	 * token ends the value, the index right after the value counts too, so
	 * that completion works while the user is still typing.
	 */
	public abstract boolean contains(int characterIndex);

	public abstract void accept(ExpressionVisitor visitor);

	/**
	 * Renders the value in a readable form: adjacent {@code concat} strings are
	 * merged and {@code parameters('x')}/{@code variables('x')} become
	 * {@code ${x}}.
	 */
	public String format() {
		return toString();
	}

	static void adopt(ExpressionValue parent, ExpressionValue child) {
		if (child != null) {
			child.setParent(parent);
		}
	}
}
