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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.tomaszrup.armls.expressions.ExpressionStrings;
import com.tomaszrup.armls.expressions.FriendlyExpressions;
import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.resources.ResourceInfo;

/**
 * Completions for entries of a resource's {@code dependsOn} array: a
 * {@code resourceId(...)} reference to every other resource of the scope.
 * The enclosing resource and its descendants are left out, and its parent is
 * offered first.
 */
public final class DependsOnCompletions {
	private DependsOnCompletions() {
	}

	/**
	 * @param resources resource graph of the scope containing the cursor
	 * @param span      the JSON string at the cursor, or an empty span at the
	 *                  cursor
	 */
	public static List<CompletionItem> getCompletions(List<ResourceInfo> resources, Span span,
			int documentCharacterIndex) {
		if (resources.isEmpty()) {
			return Collections.emptyList();
		}
		ResourceInfo currentResource = findClosestEnclosingResource(resources, documentCharacterIndex);
		Set<ResourceInfo> excluded = Collections.newSetFromMap(new IdentityHashMap<ResourceInfo, Boolean>());
		addDescendantsIncludingSelf(currentResource, excluded);

		List<CompletionItem> result = new ArrayList<>();
		for (ResourceInfo resource : resources) {
			if (!excluded.contains(resource)) {
				boolean isParent = currentResource != null && currentResource.getParent() == resource;
				addCompletionsForResource(resource, span, isParent, result);
			}
		}
		return result;
	}

	private static void addCompletionsForResource(ResourceInfo resource, Span span, boolean isParent,
			List<CompletionItem> result) {
		String resourceIdExpression = resource.getResourceIdExpression();
		if (resourceIdExpression == null) {
			return;
		}
		String friendlyName = resource.getFriendlyNameExpression();
		String friendlyType = resource.getFriendlyTypeExpression();
		String insertText = "\"[" + resourceIdExpression + "]\"";
		String documentation = "Inserts this resourceId reference:\n```arm-template\n" + insertText + "\n```\n";
		result.add(CompletionItem.builder(isParent ? "Parent (" + friendlyName + ")" : friendlyName, span,
				CompletionKind.DEPENDS_ON_RESOURCE_ID)
				.insertText(insertText)
				.detail(friendlyType)
				.documentation(documentation)
				// so that typing "parent" finds the parent
				.filterText(isParent ? insertText + " parent" : insertText)
				.priority(isParent ? CompletionPriority.HIGH : CompletionPriority.NORMAL)
				.build());

		String copyName = resource.getCopyName();
		if (copyName != null) {
			String copyNameExpression = ExpressionStrings.jsonStringToExpression(copyName);
			String copyInsertText = ExpressionStrings.isExpression(copyName)
					? "\"[" + copyNameExpression + "]\""
					: "\"" + copyName + "\"";
			String copyDocumentation = "Inserts this COPY element reference:\n```arm-template\n" + copyInsertText
					+ "\n```\nfrom resource `" + friendlyName + "` of type `" + friendlyType + "`";
			result.add(CompletionItem.builder("Loop " + FriendlyExpressions.fromExpression(copyNameExpression), span,
					CompletionKind.DEPENDS_ON_COPY_LOOP)
					.insertText(copyInsertText)
					.detail(friendlyType)
					.documentation(copyDocumentation)
					.filterText(copyInsertText)
					.build());
		}
	}

	/**
	 * Finds a resource whose object encloses the index, then descends into
	 * the child that also encloses it for as long as there is one.
	 */
	static ResourceInfo findClosestEnclosingResource(List<ResourceInfo> resources, int documentCharacterIndex) {
		ResourceInfo match = null;
		for (ResourceInfo resource : resources) {
			if (encloses(resource, documentCharacterIndex)) {
				match = resource;
				break;
			}
		}
		if (match == null) {
			return null;
		}
		boolean descended = true;
		while (descended) {
			descended = false;
			for (ResourceInfo child : match.getChildren()) {
				if (encloses(child, documentCharacterIndex)) {
					match = child;
					descended = true;
					break;
				}
			}
		}
		return match;
	}

	private static boolean encloses(ResourceInfo resource, int documentCharacterIndex) {
		return resource.getResourceObject() != null
				&& resource.getResourceObject().getSpan().contains(documentCharacterIndex, ContainsBehavior.ENCLOSED);
	}

	private static void addDescendantsIncludingSelf(ResourceInfo resource, Set<ResourceInfo> result) {
		if (resource != null && result.add(resource)) {
			for (ResourceInfo child : resource.getChildren()) {
				addDescendantsIncludingSelf(child, result);
			}
		}
	}
}
