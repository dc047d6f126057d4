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
package com.tomaszrup.armls.language;

import java.util.Objects;

/**
 * A non-fatal problem found while tokenizing or parsing. Issues are attached
 * to parse results and never thrown.
 */
public final class Issue {
	private final Span span;
	private final String message;

	public Issue(Span span, String message) {
		this.span = Objects.requireNonNull(span, "span");
		this.message = Objects.requireNonNull(message, "message");
	}

	public Span getSpan() {
		return span;
	}

	public String getMessage() {
		return message;
	}

	public Issue translate(int movement) {
		return new Issue(span.translate(movement), message);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Issue)) {
			return false;
		}
		Issue other = (Issue) obj;
		return span.equals(other.span) && message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(span, message);
	}

	@Override
	public String toString() {
		return span + ": " + message;
	}
}
