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
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import com.tomaszrup.armls.expressions.ExpressionStrings;

/**
 * Links resources declared at the same level as their parent, e.g.
 * {@code {name: 'a/b', type: 'Microsoft.X/Y/Z'}} next to
 * {@code {name: 'a', type: 'Microsoft.X/Y'}}.
 *
 * <p>Parents are tried in declaration order and a child is taken out of the
 * candidate pool once linked, so the first matching parent wins.</p>
 */
final class DecoupledChildMatcher {
	private DecoupledChildMatcher() {
	}

	/**
	 * @return the number of links created
	 */
	static int linkDecoupledChildren(List<ResourceInfo> infos) {
		List<ResourceInfo> pool = new ArrayList<>();
		for (ResourceInfo info : infos) {
			if (info.getParent() == null) {
				pool.add(info);
			}
		}

		int linked = 0;
		for (ResourceInfo parent : infos) {
			Iterator<ResourceInfo> candidates = pool.iterator();
			while (candidates.hasNext()) {
				ResourceInfo child = candidates.next();
				if (child != parent && areDecoupledChildAndParent(child, parent)) {
					child.setParent(parent, true);
					candidates.remove();
					linked++;
				}
			}
		}
		return linked;
	}

	static boolean areDecoupledChildAndParent(ResourceInfo child, ResourceInfo parent) {
		if (!isRootOrDecoupled(child) || !isRootOrDecoupled(parent)) {
			return false;
		}
		List<String> childTypes = child.getTypeSegments();
		List<String> childNames = child.getNameSegments();
		List<String> parentTypes = parent.getTypeSegments();
		List<String> parentNames = parent.getNameSegments();
		if (childTypes.isEmpty() || childNames.isEmpty() || parentTypes.isEmpty() || parentNames.isEmpty()) {
			return false;
		}
		if (childTypes.size() != parentTypes.size() + 1
				|| childNames.size() != parentNames.size() + 1
				|| childTypes.size() != childNames.size()) {
			return false;
		}
		return prefixMatches(childTypes, parentTypes) && prefixMatches(childNames, parentNames);
	}

	private static boolean isRootOrDecoupled(ResourceInfo info) {
		return info.getParent() == null || info.isDecoupledChild();
	}

	private static boolean prefixMatches(List<String> childSegments, List<String> parentSegments) {
		for (int i = 0; i < parentSegments.size(); i++) {
			if (!segmentsAreSame(childSegments.get(i), parentSegments.get(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Case-insensitive; expressions are also compared ignoring whitespace.
	 */
	static boolean segmentsAreSame(String left, String right) {
		if (left.equalsIgnoreCase(right)) {
			return true;
		}
		if (!ExpressionStrings.isSingleQuoted(left) && !ExpressionStrings.isSingleQuoted(right)) {
			return stripWhitespace(left).equals(stripWhitespace(right));
		}
		return false;
	}

	private static String stripWhitespace(String text) {
		return text.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
	}
}
