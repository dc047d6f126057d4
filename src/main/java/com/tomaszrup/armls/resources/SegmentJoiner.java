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
package com.tomaszrup.armls.resources;

import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.armls.expressions.ExpressionStrings;

/**
 * Joins name segments with {@code '/'} into a single expression, merging
 * adjacent string literals so that {@code ['a', 'b']} becomes {@code 'a/b'}
 * instead of {@code concat('a', '/', 'b')}.
 */
final class SegmentJoiner {
	private static final String SEPARATOR = "'/'";

	private SegmentJoiner() {
	}

	static String join(List<String> segments) {
		List<String> parts = new ArrayList<>();
		for (String segment : segments) {
			if (!parts.isEmpty()) {
				add(parts, SEPARATOR);
			}
			add(parts, segment);
		}
		if (parts.isEmpty()) {
			return "";
		}
		if (parts.size() == 1) {
			return parts.get(0);
		}
		return "concat(" + String.join(", ", parts) + ")";
	}

	private static void add(List<String> parts, String part) {
		int last = parts.size() - 1;
		if (last >= 0 && ExpressionStrings.isSingleQuoted(parts.get(last)) && ExpressionStrings.isSingleQuoted(part)) {
			parts.set(last, "'" + ExpressionStrings.removeSingleQuotes(parts.get(last))
					+ ExpressionStrings.removeSingleQuotes(part) + "'");
		} else {
			parts.add(part);
		}
	}
}
