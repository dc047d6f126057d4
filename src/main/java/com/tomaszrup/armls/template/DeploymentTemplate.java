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
package com.tomaszrup.armls.template;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.armls.expressions.ParseResult;
import com.tomaszrup.armls.expressions.Parser;
import com.tomaszrup.armls.json.JsonParseResult;
import com.tomaszrup.armls.json.JsonParser;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.JsonVisitor;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.Issue;
import com.tomaszrup.armls.resources.ResourceGraphBuilder;
import com.tomaszrup.armls.resources.ResourceInfo;

/**
 * Immutable snapshot of a deployment template document. Each edit produces a
 * new snapshot; expression parse results are computed lazily and cached for
 * the lifetime of the snapshot.
 */
public final class DeploymentTemplate {
	private static final Logger logger = LoggerFactory.getLogger(DeploymentTemplate.class);

	private final URI uri;
	private final String text;
	private final JsonParseResult jsonParseResult;
	private final TopLevelScope topLevelScope;
	private final List<TemplateScope> allScopes;
	private final Map<JsonValue, TemplateScope> scopesByRootObject = new IdentityHashMap<>();
	private final Map<Integer, ParseResult> parseResults = new ConcurrentHashMap<>();
	private List<StringValue> stringValues;

	public DeploymentTemplate(URI uri, String text) {
		this.uri = uri;
		this.text = text;
		this.jsonParseResult = JsonParser.parse(text);
		this.topLevelScope = new TopLevelScope(JsonValue.asObjectValue(jsonParseResult.getValue()));

		List<TemplateScope> scopes = new ArrayList<>();
		collectScopes(topLevelScope, scopes);
		this.allScopes = Collections.unmodifiableList(scopes);
		for (TemplateScope scope : allScopes) {
			if (scope.getRootObject() != null) {
				scopesByRootObject.put(scope.getRootObject(), scope);
			}
		}
		logger.debug("Parsed {}: {} tokens, {} scopes", uri, jsonParseResult.getTokens().size(), allScopes.size());
	}

	private static void collectScopes(TemplateScope scope, List<TemplateScope> result) {
		result.add(scope);
		for (TemplateScope child : scope.getChildScopes()) {
			collectScopes(child, result);
		}
	}

	public URI getUri() {
		return uri;
	}

	public String getText() {
		return text;
	}

	public JsonParseResult getJsonParseResult() {
		return jsonParseResult;
	}

	public ObjectValue getTopLevelValue() {
		return JsonValue.asObjectValue(jsonParseResult.getValue());
	}

	public TemplateScope getTopLevelScope() {
		return topLevelScope;
	}

	/** The top-level scope followed by every nested scope, depth first. */
	public List<TemplateScope> getAllScopes() {
		return allScopes;
	}

	/**
	 * Returns the parsed expression of a JSON string of this document. Results
	 * are cached per string start index.
	 */
	public ParseResult getParseResult(StringValue stringValue) {
		return parseResults.computeIfAbsent(stringValue.getSpan().getStartIndex(),
				start -> Parser.parse(stringValue.getQuotedValue()));
	}

	/**
	 * Every JSON string of the document (property names included), in
	 * document order.
	 */
	public synchronized List<StringValue> getStringValues() {
		if (stringValues == null) {
			List<StringValue> result = new ArrayList<>();
			if (jsonParseResult.getValue() != null) {
				jsonParseResult.getValue().accept(new JsonVisitor() {
					@Override
					public void visitStringValue(StringValue value) {
						result.add(value);
					}
				});
			}
			stringValues = Collections.unmodifiableList(result);
		}
		return stringValues;
	}

	/**
	 * The innermost scope whose root object contains the value.
	 */
	public TemplateScope getScopeForValue(JsonValue value) {
		List<JsonValue> lineage = jsonParseResult.getLineage(value);
		if (lineage != null) {
			for (int i = lineage.size() - 1; i >= 0; i--) {
				TemplateScope scope = scopesByRootObject.get(lineage.get(i));
				if (scope != null) {
					return scope;
				}
			}
		}
		return topLevelScope;
	}

	/**
	 * Expression syntax issues of every string, translated to document
	 * offsets.
	 */
	public List<Issue> getExpressionIssues() {
		List<Issue> issues = new ArrayList<>();
		for (StringValue stringValue : getStringValues()) {
			ParseResult parseResult = getParseResult(stringValue);
			for (Issue issue : parseResult.getIssues()) {
				issues.add(issue.translate(stringValue.getSpan().getStartIndex()));
			}
		}
		return issues;
	}

	/**
	 * Builds the resource forest of a scope. Not cached; callers hold on to
	 * the result for the duration of one request.
	 */
	public List<ResourceInfo> getResourceGraph(TemplateScope scope) {
		return ResourceGraphBuilder.build(scope.getResourceObjects());
	}
}
