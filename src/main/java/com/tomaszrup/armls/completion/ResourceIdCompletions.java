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
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.tomaszrup.armls.expressions.ExpressionValue;
import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.functions.BuiltinFunctionMetadata;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.functions.FunctionBehavior;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.resources.ResourceInfo;

/**
 * Completions for the arguments of {@code resourceId} and similar functions:
 * resource types for the type argument, then the matching resources' name
 * segments for each following argument.
 *
 * <pre>
 * resourceId([subscriptionId], [resourceGroupName], resourceType, name1, name2, ...)
 * </pre>
 */
public final class ResourceIdCompletions {
	/** Optional arguments that may precede the resource type */
	static final int MAX_OPTIONAL_PARAMETERS = 2;

	private static final Pattern RESOURCE_TYPE_LITERAL = Pattern.compile("^'[^'.]+\\.[^'.]+/([^'.]+)(\\.[^'.]+)*'$");
	private static final Pattern WHITESPACE = Pattern.compile("\\s");

	private final FunctionCall functionCall;
	private final String quotedString;
	private final int stringStartIndex;
	private final int documentCharacterIndex;
	private final List<ResourceInfo> resources;

	private ResourceIdCompletions(FunctionCall functionCall, String quotedString, int stringStartIndex,
			int documentCharacterIndex, List<ResourceInfo> resources) {
		this.functionCall = functionCall;
		this.quotedString = quotedString;
		this.stringStartIndex = stringStartIndex;
		this.documentCharacterIndex = documentCharacterIndex;
		this.resources = resources;
	}

	/**
	 * @param argumentIndex index of the argument the cursor is in, or -1
	 * @param quotedString text of the JSON string holding the call, quotes
	 *                     included; argument spans are relative to it
	 * @param stringStartIndex document index of that string
	 */
	public static List<CompletionItem> getCompletions(FunctionCall functionCall, int argumentIndex,
			String quotedString, int stringStartIndex, int documentCharacterIndex, List<ResourceInfo> resources,
			BuiltinFunctions builtinFunctions) {
		if (functionCall.isUserFunction() || functionCall.getName() == null || argumentIndex < 0) {
			return Collections.emptyList();
		}
		BuiltinFunctionMetadata metadata = builtinFunctions.findByName(functionCall.getName());
		if (metadata == null || !metadata.hasBehavior(FunctionBehavior.USES_RESOURCE_ID_COMPLETIONS)) {
			return Collections.emptyList();
		}
		return new ResourceIdCompletions(functionCall, quotedString, stringStartIndex, documentCharacterIndex,
				resources).getCompletions(argumentIndex);
	}

	private List<CompletionItem> getCompletions(int argumentIndexAtCursor) {
		if (argumentIndexAtCursor == 0) {
			// The first argument may be the type or an optional argument, so types are always offered
			return getResourceTypeCompletions(argumentIndexAtCursor);
		}

		int typeArgumentIndex = findArgumentWithResourceType(argumentIndexAtCursor - 1);
		if (typeArgumentIndex < 0) {
			return getResourceTypeCompletions(argumentIndexAtCursor);
		}

		List<ResourceInfo> filtered = filterByType(getArgumentText(typeArgumentIndex));
		int nameSegmentIndex = 0;
		for (int argumentIndex = typeArgumentIndex + 1; argumentIndex < argumentIndexAtCursor; argumentIndex++) {
			String argumentText = getArgumentText(argumentIndex);
			if (argumentText == null) {
				return Collections.emptyList();
			}
			filtered = filterByNameSegment(filtered, argumentText, nameSegmentIndex);
			nameSegmentIndex++;
		}

		Span span = getReplacementSpan(argumentIndexAtCursor);
		List<CompletionItem> result = new ArrayList<>();
		for (ResourceInfo info : filtered) {
			if (nameSegmentIndex < info.getNameSegments().size()) {
				String nameSegment = info.getNameSegments().get(nameSegmentIndex);
				result.add(CompletionItem.builder(nameSegment, span, CompletionKind.RESOURCE_ID_NAME)
						.priority(CompletionPriority.HIGH)
						.preselect(true)
						.build());
			}
		}
		return CompletionItem.dedupeByLabel(result);
	}

	/**
	 * Index of the first argument up to {@code maxIndex} that looks like a
	 * resource type literal or equals the type of a declared resource, or -1.
	 */
	private int findArgumentWithResourceType(int maxIndex) {
		for (int argumentIndex = 0; argumentIndex <= maxIndex; argumentIndex++) {
			String argumentText = getArgumentText(argumentIndex);
			if (argumentText == null) {
				continue;
			}
			if (RESOURCE_TYPE_LITERAL.matcher(argumentText).matches()) {
				return argumentIndex;
			}
			for (ResourceInfo info : resources) {
				if (info.getFullTypeExpression().toLowerCase(Locale.ROOT).equals(argumentText)) {
					return argumentIndex;
				}
			}
		}
		return -1;
	}

	private List<ResourceInfo> filterByType(String typeText) {
		List<ResourceInfo> result = new ArrayList<>();
		for (ResourceInfo info : resources) {
			if (info.getFullTypeExpression().toLowerCase(Locale.ROOT).equals(typeText)) {
				result.add(info);
			}
		}
		return result;
	}

	private static List<ResourceInfo> filterByNameSegment(List<ResourceInfo> infos, String segmentText,
			int segmentIndex) {
		String expected = lowerCaseAndNoWhitespace(segmentText);
		List<ResourceInfo> result = new ArrayList<>();
		for (ResourceInfo info : infos) {
			if (segmentIndex < info.getNameSegments().size()
					&& lowerCaseAndNoWhitespace(info.getNameSegments().get(segmentIndex)).equals(expected)) {
				result.add(info);
			}
		}
		return result;
	}

	private List<CompletionItem> getResourceTypeCompletions(int argumentIndex) {
		if (argumentIndex > MAX_OPTIONAL_PARAMETERS) {
			return Collections.emptyList();
		}
		Span span = getReplacementSpan(argumentIndex);
		List<CompletionItem> result = new ArrayList<>();
		for (ResourceInfo info : resources) {
			result.add(CompletionItem.builder(info.getFullTypeExpression(), span, CompletionKind.RESOURCE_ID_TYPE)
					.priority(CompletionPriority.HIGH)
					.preselect(true)
					.build());
		}
		return CompletionItem.dedupeByLabel(result);
	}

	private Span getReplacementSpan(int argumentIndex) {
		ExpressionValue argument = getArgument(argumentIndex);
		return argument != null
				? argument.getSpan().translate(stringStartIndex)
				: new Span(documentCharacterIndex, 0);
	}

	private ExpressionValue getArgument(int argumentIndex) {
		List<ExpressionValue> arguments = functionCall.getArgumentExpressions();
		return argumentIndex < arguments.size() ? arguments.get(argumentIndex) : null;
	}

	/** Lowercased source text of an argument, {@code null} if missing. */
	private String getArgumentText(int argumentIndex) {
		ExpressionValue argument = getArgument(argumentIndex);
		return argument != null ? argument.getSpan().getText(quotedString).toLowerCase(Locale.ROOT) : null;
	}

	private static String lowerCaseAndNoWhitespace(String text) {
		return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
	}
}
