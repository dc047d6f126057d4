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
 * A half-open character range {@code [startIndex, startIndex + length)} over
 * a flat text buffer. Spans are immutable; every operation returns a new
 * instance.
 */
public final class Span {
	private final int startIndex;
	private final int length;

	public Span(int startIndex, int length) {
		if (startIndex < 0) {
			throw new IllegalArgumentException("startIndex cannot be negative: " + startIndex);
		}
		if (length < 0) {
			throw new IllegalArgumentException("length cannot be negative: " + length);
		}
		this.startIndex = startIndex;
		this.length = length;
	}

	public static Span fromStartAndAfterEnd(int startIndex, int afterEndIndex) {
		return new Span(startIndex, afterEndIndex - startIndex);
	}

	/**
	 * Returns the minimal span covering both arguments. Either may be
	 * {@code null}, in which case the other one is returned.
	 */
	public static Span union(Span left, Span right) {
		if (left == null) {
			return right;
		}
		if (right == null) {
			return left;
		}
		return left.union(right);
	}

	public int getStartIndex() {
		return startIndex;
	}

	public int getLength() {
		return length;
	}

	/**
	 * Index of the last character in the span. For an empty span this is the
	 * start index.
	 */
	public int getEndIndex() {
		return length > 0 ? startIndex + length - 1 : startIndex;
	}

	public int getAfterEndIndex() {
		return startIndex + length;
	}

	public boolean isEmpty() {
		return length == 0;
	}

	public boolean contains(int index, ContainsBehavior behavior) {
		switch (behavior) {
			case STRICT:
				return startIndex <= index && index <= getEndIndex();
			case EXTENDED:
				return startIndex <= index && index <= getAfterEndIndex();
			case ENCLOSED:
				return startIndex + 1 <= index && index <= getEndIndex();
			default:
				throw new IllegalArgumentException("Unknown contains behavior: " + behavior);
		}
	}

	public Span union(Span other) {
		if (other == null) {
			return this;
		}
		int start = Math.min(startIndex, other.startIndex);
		int afterEnd = Math.max(getAfterEndIndex(), other.getAfterEndIndex());
		return fromStartAndAfterEnd(start, afterEnd);
	}

	/**
	 * Returns the overlap of the two spans, or {@code null} when they do not
	 * touch.
	 */
	public Span intersect(Span other) {
		if (other == null) {
			return null;
		}
		int start = Math.max(startIndex, other.startIndex);
		int afterEnd = Math.min(getAfterEndIndex(), other.getAfterEndIndex());
		if (start > afterEnd) {
			return null;
		}
		return fromStartAndAfterEnd(start, afterEnd);
	}

	public Span translate(int movement) {
		return movement == 0 ? this : new Span(startIndex + movement, length);
	}

	public Span extendLeft(int extension) {
		return new Span(startIndex - extension, length + extension);
	}

	public Span extendRight(int extension) {
		return new Span(startIndex, length + extension);
	}

	public String getText(String text) {
		return text.substring(startIndex, getAfterEndIndex());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Span)) {
			return false;
		}
		Span other = (Span) obj;
		return startIndex == other.startIndex && length == other.length;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startIndex, length);
	}

	@Override
	public String toString() {
		return "[" + startIndex + ", " + getAfterEndIndex() + ")";
	}
}
