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
 * Walks an expression tree. Every method visits the children of its node by
 * default, so subclasses override only the node kinds they care about and
 * call {@code super} to keep descending.
 */
public abstract class ExpressionVisitor {

	public void visitString(StringLiteral value) {
	}

	public void visitNumber(NumberLiteral value) {
	}

	public void visitFunctionCall(FunctionCall value) {
		for (ExpressionValue argument : value.getArgumentExpressions()) {
			if (argument != null) {
				argument.accept(this);
			}
		}
	}

	public void visitPropertyAccess(PropertyAccess value) {
		value.getSource().accept(this);
	}

	public void visitArrayAccess(ArrayAccess value) {
		value.getSource().accept(this);
		if (value.getIndexValue() != null) {
			value.getIndexValue().accept(this);
		}
	}
}
