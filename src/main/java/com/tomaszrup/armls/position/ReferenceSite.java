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
package com.tomaszrup.armls.position;

import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.NamedDefinition;

/**
 * A reference to, or the definition of, a named entity at some position.
 */
public final class ReferenceSite {
	private final ReferenceSiteKind kind;
	private final NamedDefinition definition;
	private final Span unquotedReferenceSpan;

	public ReferenceSite(ReferenceSiteKind kind, NamedDefinition definition, Span unquotedReferenceSpan) {
		this.kind = kind;
		this.definition = definition;
		this.unquotedReferenceSpan = unquotedReferenceSpan;
	}

	public ReferenceSiteKind getKind() {
		return kind;
	}

	public NamedDefinition getDefinition() {
		return definition;
	}

	/**
	 * Document span of the name at the site, without quotes.
	 */
	public Span getUnquotedReferenceSpan() {
		return unquotedReferenceSpan;
	}

	@Override
	public String toString() {
		return kind + " " + definition.getName() + " @ " + unquotedReferenceSpan;
	}
}
