////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Range;

public class Ranges {
	private Ranges() {
	}

	/**
	 * Range of the characters {@code [startOffset, afterEndOffset)} of
	 * {@code string}.
	 */
	public static Range fromOffsets(String string, int startOffset, int afterEndOffset) {
		if (afterEndOffset < startOffset) {
			throw new IllegalArgumentException("Range end " + afterEndOffset + " is before its start " + startOffset);
		}
		return new Range(Positions.getPosition(string, startOffset), Positions.getPosition(string, afterEndOffset));
	}
}
