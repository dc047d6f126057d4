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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.armls.expressions.ExpressionStrings;
import com.tomaszrup.armls.expressions.ExpressionValue;
import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.expressions.ParseResult;
import com.tomaszrup.armls.expressions.Parser;
import com.tomaszrup.armls.expressions.StringLiteral;
import com.tomaszrup.armls.json.ArrayValue;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.template.TemplateKeys;

/**
 * Builds {@link ResourceInfo}s from the resource objects of a scope.
 *
 * <p>Names and types are split into segments. Children declared in a nested
 * {@code resources} array get their parent's leading segments when they only
 * give the trailing one. Virtual network subnets declared under
 * {@code properties.subnets} become child resources of type
 * {@code Microsoft.Network/virtualNetworks/subnets}. Finally, root resources
 * whose segments extend another resource's segments by one are linked to it
 * as decoupled children.</p>
 */
public final class ResourceGraphBuilder {
	private static final Logger logger = LoggerFactory.getLogger(ResourceGraphBuilder.class);

	static final String SEGMENT_SEPARATOR = "'/'";
	static final String VIRTUAL_NETWORKS_TYPE = "'Microsoft.Network/virtualNetworks'";
	static final String SUBNETS_TYPE = "'subnets'";

	private ResourceGraphBuilder() {
	}

	/**
	 * Returns every resource found, nested ones included, in declaration
	 * order. Objects without a string {@code name} and {@code type} are
	 * skipped together with their nested resources.
	 */
	public static List<ResourceInfo> build(List<ObjectValue> resourceObjects) {
		List<ResourceInfo> infos = new ArrayList<>();
		for (ObjectValue resourceObject : resourceObjects) {
			collect(resourceObject, null, infos);
		}
		int decoupled = DecoupledChildMatcher.linkDecoupledChildren(infos);
		logger.debug("Built resource graph: {} resources, {} decoupled children", infos.size(), decoupled);
		return Collections.unmodifiableList(infos);
	}

	private static void collect(ObjectValue resourceObject, ResourceInfo parent, List<ResourceInfo> infos) {
		StringValue name = JsonValue.asStringValue(resourceObject.getPropertyValue(TemplateKeys.RESOURCE_NAME));
		StringValue type = JsonValue.asStringValue(resourceObject.getPropertyValue(TemplateKeys.RESOURCE_TYPE));
		if (name == null || type == null) {
			return;
		}

		List<String> typeSegments = splitType(type.getUnquotedValue());
		List<String> nameSegments = splitName(name);
		if (parent != null) {
			if (typeSegments.size() <= 1) {
				typeSegments.addAll(0, parent.getTypeSegments());
			}
			if (nameSegments.size() <= 1) {
				nameSegments.addAll(0, parent.getNameSegments());
			}
		}
		ResourceInfo info = new ResourceInfo(nameSegments, typeSegments, resourceObject);
		if (parent != null) {
			info.setParent(parent, false);
		}
		infos.add(info);

		ArrayValue children = JsonValue.asArrayValue(resourceObject.getPropertyValue(TemplateKeys.RESOURCES));
		if (children != null) {
			for (JsonValue child : children.getElements()) {
				ObjectValue childObject = JsonValue.asObjectValue(child);
				if (childObject != null) {
					collect(childObject, info, infos);
				}
			}
		}

		if (type.getUnquotedValue().equalsIgnoreCase(TemplateKeys.VIRTUAL_NETWORKS_RESOURCE_TYPE)) {
			collectSubnets(resourceObject, name, info, infos);
		}
	}

	private static void collectSubnets(ObjectValue vnetObject, StringValue vnetName, ResourceInfo vnet,
			List<ResourceInfo> infos) {
		ObjectValue properties = JsonValue.asObjectValue(vnetObject.getPropertyValue(TemplateKeys.PROPERTIES));
		ArrayValue subnets = properties != null
				? JsonValue.asArrayValue(properties.getPropertyValue(TemplateKeys.SUBNETS))
				: null;
		if (subnets == null) {
			return;
		}
		for (JsonValue element : subnets.getElements()) {
			ObjectValue subnet = JsonValue.asObjectValue(element);
			StringValue subnetName = subnet != null
					? JsonValue.asStringValue(subnet.getPropertyValue(TemplateKeys.RESOURCE_NAME))
					: null;
			if (subnetName == null) {
				continue;
			}
			List<String> nameSegments = new ArrayList<>();
			nameSegments.add(ExpressionStrings.jsonStringToExpression(vnetName.getUnquotedValue()));
			nameSegments.add(ExpressionStrings.jsonStringToExpression(subnetName.getUnquotedValue()));
			List<String> typeSegments = new ArrayList<>();
			typeSegments.add(VIRTUAL_NETWORKS_TYPE);
			typeSegments.add(SUBNETS_TYPE);
			ResourceInfo info = new ResourceInfo(nameSegments, typeSegments, subnet);
			info.setParent(vnet, false);
			infos.add(info);
		}
	}

	/**
	 * {@code Microsoft.Sql/servers/databases} becomes
	 * {@code ['Microsoft.Sql/servers', 'databases']}; an expression stays one
	 * segment.
	 */
	static List<String> splitType(String type) {
		List<String> segments = new ArrayList<>();
		if (ExpressionStrings.isExpression(type)) {
			segments.add(ExpressionStrings.jsonStringToExpression(type));
			return segments;
		}
		String[] parts = type.split("/", -1);
		int first = 0;
		if (parts.length >= 2) {
			segments.add("'" + parts[0] + "/" + parts[1] + "'");
			first = 2;
		}
		for (int i = first; i < parts.length; i++) {
			segments.add("'" + parts[i] + "'");
		}
		return segments;
	}

	/**
	 * Splits a literal name on {@code /}. An expression name is split only
	 * when it is a {@code concat} whose arguments contain {@code '/'}
	 * separators, e.g. {@code [concat(parameters('a'), '/b')]} becomes
	 * {@code [parameters('a'), 'b']}.
	 */
	static List<String> splitName(StringValue name) {
		String unquoted = name.getUnquotedValue();
		List<String> segments = new ArrayList<>();
		if (!ExpressionStrings.isExpression(unquoted)) {
			for (String part : unquoted.split("/", -1)) {
				segments.add("'" + part + "'");
			}
			return segments;
		}
		if (unquoted.indexOf('/') >= 0) {
			List<String> split = splitConcatExpression(name.getQuotedValue());
			if (split != null) {
				return split;
			}
		}
		segments.add(ExpressionStrings.jsonStringToExpression(unquoted));
		return segments;
	}

	private static List<String> splitConcatExpression(String quotedName) {
		ParseResult parseResult = Parser.parse(quotedName);
		if (!parseResult.getIssues().isEmpty() || !(parseResult.getExpression() instanceof FunctionCall)) {
			return null;
		}
		FunctionCall concat = (FunctionCall) parseResult.getExpression();
		if (!concat.isCallToBuiltinWithName(TemplateKeys.CONCAT_FUNCTION)) {
			return null;
		}

		List<String> pieces = new ArrayList<>();
		for (ExpressionValue argument : concat.getArgumentExpressions()) {
			if (argument == null) {
				return null;
			}
			if (argument instanceof StringLiteral && ((StringLiteral) argument).getUnquotedValue().indexOf('/') >= 0) {
				for (String part : splitKeepingSeparator(((StringLiteral) argument).getUnquotedValue())) {
					pieces.add("'" + part + "'");
				}
			} else {
				pieces.add(argument.getSpan().getText(quotedName));
			}
		}

		List<List<String>> groups = new ArrayList<>();
		List<String> group = new ArrayList<>();
		boolean foundSeparator = false;
		for (String piece : pieces) {
			if (SEGMENT_SEPARATOR.equals(piece)) {
				foundSeparator = true;
				groups.add(group);
				group = new ArrayList<>();
			} else {
				group.add(piece);
			}
		}
		groups.add(group);
		if (!foundSeparator) {
			return null;
		}

		List<String> segments = new ArrayList<>();
		for (List<String> g : groups) {
			if (g.isEmpty()) {
				return null;
			}
			segments.add(g.size() == 1 ? g.get(0) : TemplateKeys.CONCAT_FUNCTION + "(" + String.join(", ", g) + ")");
		}
		return segments;
	}

	/**
	 * {@code "a/b/"} becomes {@code ["a", "/", "b", "/"]}.
	 */
	static List<String> splitKeepingSeparator(String text) {
		List<String> result = new ArrayList<>();
		int start = 0;
		int slash;
		while ((slash = text.indexOf('/', start)) >= 0) {
			if (slash > start) {
				result.add(text.substring(start, slash));
			}
			result.add("/");
			start = slash + 1;
		}
		if (start < text.length()) {
			result.add(text.substring(start));
		}
		return result;
	}
}
