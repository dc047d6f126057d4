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

import com.tomaszrup.armls.expressions.ExpressionStrings;
import com.tomaszrup.armls.expressions.FriendlyExpressions;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.template.TemplateKeys;

/**
 * A resource declaration with its name and type split into segments. Each
 * segment is expression source text: either a single-quoted literal such as
 * {@code 'Microsoft.Network/virtualNetworks'} or an expression such as
 * {@code parameters('vnetName')}.
 *
 * <p>Parent/child links are filled in by {@link ResourceGraphBuilder} and
 * not changed afterwards.</p>
 */
public final class ResourceInfo {
	private final List<String> nameSegments;
	private final List<String> typeSegments;
	private final ObjectValue resourceObject;
	private final List<ResourceInfo> children = new ArrayList<>();
	private ResourceInfo parent;
	private boolean decoupledChild;

	ResourceInfo(List<String> nameSegments, List<String> typeSegments, ObjectValue resourceObject) {
		this.nameSegments = Collections.unmodifiableList(new ArrayList<>(nameSegments));
		this.typeSegments = Collections.unmodifiableList(new ArrayList<>(typeSegments));
		this.resourceObject = resourceObject;
	}

	public List<String> getNameSegments() {
		return nameSegments;
	}

	public List<String> getTypeSegments() {
		return typeSegments;
	}

	/** The JSON object the resource was read from. */
	public ObjectValue getResourceObject() {
		return resourceObject;
	}

	public ResourceInfo getParent() {
		return parent;
	}

	public List<ResourceInfo> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * Whether the parent was inferred from the name and type rather than from
	 * nesting.
	 */
	public boolean isDecoupledChild() {
		return decoupledChild;
	}

	void setParent(ResourceInfo parent, boolean decoupled) {
		if (this.parent != null) {
			throw new IllegalStateException("Resource " + this + " already has a parent");
		}
		this.parent = parent;
		this.decoupledChild = decoupled;
		parent.children.add(this);
	}

	/**
	 * Full type as one expression, e.g. {@code 'Microsoft.Sql/servers/databases'}.
	 */
	public String getFullTypeExpression() {
		if (typeSegments.size() > 1) {
			List<String> parts = new ArrayList<>();
			for (String segment : typeSegments) {
				parts.add(ExpressionStrings.removeSingleQuotes(segment));
			}
			return "'" + String.join("/", parts) + "'";
		}
		return typeSegments.isEmpty() ? "" : typeSegments.get(0);
	}

	/**
	 * Full name as one expression, joining the segments with {@code /} and
	 * merging adjacent literals, e.g. {@code concat(parameters('server'), '/db')}.
	 */
	public String getFullNameExpression() {
		return SegmentJoiner.join(nameSegments);
	}

	/**
	 * {@code resourceId(<type>, <name1>, <name2>...)}, or {@code null} for a
	 * resource without segments.
	 */
	public String getResourceIdExpression() {
		if (nameSegments.isEmpty() || typeSegments.isEmpty()) {
			return null;
		}
		return TemplateKeys.RESOURCE_ID_FUNCTION + "(" + getFullTypeExpression() + ", " + String.join(", ", nameSegments)
				+ ")";
	}

	/**
	 * Readable name: the {@code displayName} tag when present, otherwise the
	 * last name segment rendered by {@link FriendlyExpressions}.
	 */
	public String getFriendlyNameExpression() {
		String displayName = getDisplayNameTag();
		if (displayName != null) {
			return displayName;
		}
		return nameSegments.isEmpty() ? "" : FriendlyExpressions.fromExpression(nameSegments.get(nameSegments.size() - 1));
	}

	/** Readable last type segment, e.g. {@code subnets}. */
	public String getFriendlyTypeExpression() {
		return typeSegments.isEmpty() ? "" : FriendlyExpressions.fromExpression(typeSegments.get(typeSegments.size() - 1));
	}

	/** {@code name (type)}, used as completion label. */
	public String getFriendlyLabel() {
		return getFriendlyNameExpression() + " (" + getFriendlyTypeExpression() + ")";
	}

	/** The {@code copy.name} of a resource loop, or {@code null}. */
	public String getCopyName() {
		ObjectValue copy = resourceObject != null
				? JsonValue.asObjectValue(resourceObject.getPropertyValue(TemplateKeys.COPY_LOOP))
				: null;
		StringValue name = copy != null ? JsonValue.asStringValue(copy.getPropertyValue(TemplateKeys.LOOP_VAR_NAME)) : null;
		return name != null ? name.getUnquotedValue() : null;
	}

	private String getDisplayNameTag() {
		if (resourceObject == null) {
			return null;
		}
		ObjectValue tags = JsonValue.asObjectValue(resourceObject.getPropertyValue(TemplateKeys.TAGS));
		StringValue displayName = tags != null
				? JsonValue.asStringValue(tags.getPropertyValue(TemplateKeys.DISPLAY_NAME_TAG))
				: null;
		return displayName != null ? displayName.getUnquotedValue() : null;
	}

	@Override
	public String toString() {
		return getFullNameExpression() + " (" + getFullTypeExpression() + ")";
	}
}
