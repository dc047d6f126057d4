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
package com.tomaszrup.armls.completion;

import java.util.Collections;
import java.util.List;

/**
 * Result of a completion request. {@code triggerSuggest} asks the client to
 * request completions again at the same position, e.g. after it inserted
 * the closing brace of a new object.
 */
public final class Completions {
	private static final Completions EMPTY = new Completions(Collections.<CompletionItem>emptyList(), false);

	private final List<CompletionItem> items;
	private final boolean triggerSuggest;

	public Completions(List<CompletionItem> items, boolean triggerSuggest) {
		this.items = Collections.unmodifiableList(items);
		this.triggerSuggest = triggerSuggest;
	}

	public static Completions of(List<CompletionItem> items) {
		return new Completions(items, false);
	}

	public static Completions empty() {
		return EMPTY;
	}

	public static Completions retrigger() {
		return new Completions(Collections.<CompletionItem>emptyList(), true);
	}

	public List<CompletionItem> getItems() {
		return items;
	}

	public boolean isTriggerSuggest() {
		return triggerSuggest;
	}
}
