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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import com.tomaszrup.armls.functions.FunctionMetadata;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.ParameterDefinition;
import com.tomaszrup.armls.template.UserFunctionNamespaceDefinition;
import com.tomaszrup.armls.template.VariableDefinition;

/**
 * A completion candidate. {@link #getSpan()} is in document coordinates and
 * is the exact range that {@link #getInsertText()} replaces.
 */
public final class CompletionItem {
	private final String label;
	private final String insertText;
	private final Span span;
	private final CompletionKind kind;
	private final String detail;
	private final String documentation;
	private final String filterText;
	private final CompletionPriority priority;
	private final boolean preselect;
	private final boolean includeSingleQuotes;
	private final boolean includeRightParenthesis;

	private CompletionItem(Builder builder) {
		this.label = Objects.requireNonNull(builder.label, "label");
		this.insertText = builder.insertText != null ? builder.insertText : builder.label;
		this.span = Objects.requireNonNull(builder.span, "span");
		this.kind = Objects.requireNonNull(builder.kind, "kind");
		this.detail = builder.detail;
		this.documentation = builder.documentation;
		this.filterText = builder.filterText;
		this.priority = builder.priority;
		this.preselect = builder.preselect;
		this.includeSingleQuotes = builder.includeSingleQuotes;
		this.includeRightParenthesis = builder.includeRightParenthesis;
	}

	public static Builder builder(String label, Span span, CompletionKind kind) {
		return new Builder(label, span, kind);
	}

	public String getLabel() {
		return label;
	}

	public String getInsertText() {
		return insertText;
	}

	public Span getSpan() {
		return span;
	}

	public CompletionKind getKind() {
		return kind;
	}

	public String getDetail() {
		return detail;
	}

	/** Markdown, or {@code null}. */
	public String getDocumentation() {
		return documentation;
	}

	public String getFilterText() {
		return filterText;
	}

	public CompletionPriority getPriority() {
		return priority;
	}

	public boolean isPreselect() {
		return preselect;
	}

	/** Whether the insert text carries the quotes around a parameter or variable name. */
	public boolean isIncludeSingleQuotes() {
		return includeSingleQuotes;
	}

	/** Whether the insert text closes the {@code parameters(}/{@code variables(} call. */
	public boolean isIncludeRightParenthesis() {
		return includeRightParenthesis;
	}

	// ---- Factories ----

	/**
	 * Only the unqualified name is inserted since the namespace, if any, is
	 * already there. No parentheses are added: typing {@code (} brings up
	 * argument completions.
	 */
	public static CompletionItem fromFunctionMetadata(FunctionMetadata metadata, String unqualifiedName, Span span) {
		boolean builtin = unqualifiedName.equals(metadata.getFullName());
		return builder(metadata.getFullName(), span, builtin ? CompletionKind.FUNCTION : CompletionKind.USER_FUNCTION)
				.insertText(unqualifiedName)
				.detail("(function) " + metadata.getUsage())
				.documentation(metadata.getDescription())
				.build();
	}

	public static CompletionItem fromNamespaceDefinition(UserFunctionNamespaceDefinition namespace, Span span) {
		String label = namespace.getName();
		return builder(label, span, CompletionKind.NAMESPACE)
				.detail("(namespace) " + label)
				.documentation("User-defined namespace")
				.build();
	}

	public static CompletionItem fromPropertyName(String propertyName, Span span) {
		return builder(propertyName, span, CompletionKind.PROPERTY)
				.detail("(property)")
				.build();
	}

	public static CompletionItem fromParameterDefinition(ParameterDefinition parameter, Span span,
			boolean includeSingleQuotes, boolean includeRightParenthesis) {
		return builder("'" + parameter.getName() + "'", span, CompletionKind.PARAMETER)
				.insertText(nameInsertText(parameter.getName(), includeSingleQuotes, includeRightParenthesis))
				.includeSingleQuotes(includeSingleQuotes)
				.includeRightParenthesis(includeRightParenthesis)
				.detail("(parameter)")
				.documentation(parameter.getDescription())
				.build();
	}

	public static CompletionItem fromVariableDefinition(VariableDefinition variable, Span span,
			boolean includeSingleQuotes, boolean includeRightParenthesis) {
		return builder("'" + variable.getName() + "'", span, CompletionKind.VARIABLE)
				.insertText(nameInsertText(variable.getName(), includeSingleQuotes, includeRightParenthesis))
				.includeSingleQuotes(includeSingleQuotes)
				.includeRightParenthesis(includeRightParenthesis)
				.detail("(" + variable.getFriendlyType() + ")")
				.build();
	}

	private static String nameInsertText(String name, boolean includeSingleQuotes, boolean includeRightParenthesis) {
		String text = includeSingleQuotes ? "'" + name + "'" : name;
		return includeRightParenthesis ? text + ")" : text;
	}

	/**
	 * Removes items whose label was already seen (case-insensitive), keeping
	 * the first occurrence and the order.
	 */
	public static List<CompletionItem> dedupeByLabel(List<CompletionItem> items) {
		Set<String> seen = new HashSet<>();
		List<CompletionItem> result = new ArrayList<>();
		for (CompletionItem item : items) {
			if (seen.add(item.getLabel().toLowerCase(Locale.ROOT))) {
				result.add(item);
			}
		}
		return result;
	}

	@Override
	public String toString() {
		return label + " -> " + insertText + " @ " + span;
	}

	public static final class Builder {
		private final String label;
		private final Span span;
		private final CompletionKind kind;
		private String insertText;
		private String detail;
		private String documentation;
		private String filterText;
		private CompletionPriority priority = CompletionPriority.NORMAL;
		private boolean preselect;
		private boolean includeSingleQuotes;
		private boolean includeRightParenthesis;

		private Builder(String label, Span span, CompletionKind kind) {
			this.label = label;
			this.span = span;
			this.kind = kind;
		}

		public Builder insertText(String insertText) {
			this.insertText = insertText;
			return this;
		}

		public Builder detail(String detail) {
			this.detail = detail;
			return this;
		}

		public Builder documentation(String documentation) {
			this.documentation = documentation;
			return this;
		}

		public Builder filterText(String filterText) {
			this.filterText = filterText;
			return this;
		}

		public Builder priority(CompletionPriority priority) {
			this.priority = priority;
			return this;
		}

		public Builder preselect(boolean preselect) {
			this.preselect = preselect;
			return this;
		}

		public Builder includeSingleQuotes(boolean includeSingleQuotes) {
			this.includeSingleQuotes = includeSingleQuotes;
			return this;
		}

		public Builder includeRightParenthesis(boolean includeRightParenthesis) {
			this.includeRightParenthesis = includeRightParenthesis;
			return this;
		}

		public CompletionItem build() {
			return new CompletionItem(this);
		}
	}
}
