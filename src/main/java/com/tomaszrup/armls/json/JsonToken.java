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
package com.tomaszrup.armls.json;

import com.tomaszrup.armls.language.Span;

/**
 * A single lexical token of a JSON document, with its absolute span.
 */
public final class JsonToken {
	private final JsonTokenType type;
	private final Span span;
	private final String text;

	public JsonToken(JsonTokenType type, int startIndex, String text) {
		this.type = type;
		this.span = new Span(startIndex, text.length());
		this.text = text;
	}

	public JsonTokenType getType() {
		return type;
	}

	public Span getSpan() {
		return span;
	}

	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return type + " " + span + " " + text;
	}
}
