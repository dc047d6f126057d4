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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.tomaszrup.armls.completion.CompletionItem;
import com.tomaszrup.armls.completion.Completions;
import com.tomaszrup.armls.completion.DependsOnCompletions;
import com.tomaszrup.armls.completion.ResourceIdCompletions;
import com.tomaszrup.armls.expressions.ExpressionValue;
import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.expressions.ParseResult;
import com.tomaszrup.armls.expressions.PropertyAccess;
import com.tomaszrup.armls.expressions.StringLiteral;
import com.tomaszrup.armls.expressions.Token;
import com.tomaszrup.armls.functions.BuiltinFunctionMetadata;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.functions.FunctionMetadata;
import com.tomaszrup.armls.functions.FunctionParameterMetadata;
import com.tomaszrup.armls.functions.UserFunctionMetadata;
import com.tomaszrup.armls.json.ArrayValue;
import com.tomaszrup.armls.json.JsonParseResult;
import com.tomaszrup.armls.json.JsonToken;
import com.tomaszrup.armls.json.JsonTokenType;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.Property;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.ContainsBehavior;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.template.NamedDefinition;
import com.tomaszrup.armls.template.ParameterDefinition;
import com.tomaszrup.armls.template.TemplateKeys;
import com.tomaszrup.armls.template.TemplateScope;
import com.tomaszrup.armls.template.UserFunctionDefinition;
import com.tomaszrup.armls.template.UserFunctionNamespaceDefinition;
import com.tomaszrup.armls.template.VariableDefinition;

/**
 * A position inside a template snapshot, with everything that can be worked
 * out about it: the JSON string and expression at the position, the scope,
 * and the completions, reference site and signature help there.
 *
 * <p>Spans handed out are document spans. Spans inside an expression are
 * relative to the start of the JSON string (its opening quote) and are
 * translated by {@link #getJsonStringStartIndex()}.</p>
 */
public final class TemplatePositionContext {
	private final DeploymentTemplate template;
	private final BuiltinFunctions builtinFunctions;
	private final int documentCharacterIndex;
	private final JsonToken jsonToken;
	private final StringValue jsonStringValue;

	// set only when the position is on a JSON string
	private final ParseResult parseResult;
	private final int tleCharacterIndex;
	private final ExpressionValue tleValue;
	private final TemplateScope scope;

	private TemplatePositionContext(DeploymentTemplate template, BuiltinFunctions builtinFunctions,
			int documentCharacterIndex) {
		this.template = template;
		this.builtinFunctions = builtinFunctions;
		this.documentCharacterIndex = documentCharacterIndex;

		JsonParseResult jsonParseResult = template.getJsonParseResult();
		this.jsonToken = jsonParseResult.getTokenAtCharacterIndex(documentCharacterIndex);
		this.jsonStringValue = jsonToken != null && jsonToken.getType() == JsonTokenType.QUOTED_STRING
				? jsonParseResult.getStringValueForToken(jsonToken)
				: null;
		if (jsonStringValue != null) {
			this.parseResult = template.getParseResult(jsonStringValue);
			this.tleCharacterIndex = documentCharacterIndex - jsonStringValue.getSpan().getStartIndex();
			this.tleValue = parseResult.getValueAtCharacterIndex(tleCharacterIndex);
			this.scope = template.getScopeForValue(jsonStringValue);
		} else {
			this.parseResult = null;
			this.tleCharacterIndex = -1;
			this.tleValue = null;
			this.scope = null;
		}
	}

	/**
	 * Resolves a document offset. Offsets past the end of the text are
	 * clamped to it.
	 */
	public static TemplatePositionContext fromDocumentCharacterIndex(DeploymentTemplate template,
			BuiltinFunctions builtinFunctions, int documentCharacterIndex) {
		if (documentCharacterIndex < 0) {
			throw new IllegalArgumentException("documentCharacterIndex cannot be negative: " + documentCharacterIndex);
		}
		int index = Math.min(documentCharacterIndex, template.getText().length());
		return new TemplatePositionContext(template, builtinFunctions, index);
	}

	public DeploymentTemplate getTemplate() {
		return template;
	}

	public int getDocumentCharacterIndex() {
		return documentCharacterIndex;
	}

	public JsonToken getJsonToken() {
		return jsonToken;
	}

	/** The JSON string at the position, or {@code null}. */
	public StringValue getJsonStringValue() {
		return jsonStringValue;
	}

	public boolean isInsideJsonString() {
		return jsonStringValue != null;
	}

	/** Whether the position is on a JSON string holding a bracketed expression. */
	public boolean isInsideExpression() {
		return parseResult != null && parseResult.isExpression();
	}

	public int getJsonStringStartIndex() {
		return jsonStringValue != null ? jsonStringValue.getSpan().getStartIndex() : -1;
	}

	/** Parse result of the JSON string at the position, or {@code null}. */
	public ParseResult getParseResult() {
		return parseResult;
	}

	/** Position relative to the start of the JSON string, or -1. */
	public int getTleCharacterIndex() {
		return tleCharacterIndex;
	}

	/** Narrowest expression value at the position, or {@code null}. */
	public ExpressionValue getTleValue() {
		return tleValue;
	}

	/**
	 * The scope whose names are visible at the position.
	 */
	public TemplateScope getScope() {
		if (scope != null) {
			return scope;
		}
		JsonValue value = template.getJsonParseResult().getValueAtCharacterIndex(documentCharacterIndex,
				ContainsBehavior.STRICT);
		return value != null ? template.getScopeForValue(value) : template.getTopLevelScope();
	}

	private Span getEmptySpanAtDocumentCharacterIndex() {
		return new Span(documentCharacterIndex, 0);
	}

	// ---- Completions ----

	/**
	 * @param triggerCharacter the character that triggered the request, or
	 *                         {@code null} when invoked explicitly
	 */
	public Completions getCompletions(String triggerCharacter) {
		List<CompletionItem> completions = new ArrayList<>();
		if (jsonStringValue == null) {
			if (isNewObjectInArray(triggerCharacter)) {
				return Completions.retrigger();
			}
		} else if (tleValue == null || !tleValue.contains(tleCharacterIndex)) {
			if (isInsideSquareBrackets()) {
				Span replaceSpan = getEmptySpanAtDocumentCharacterIndex();
				completions.addAll(getFunctionCompletions(null, replaceSpan));
				completions.addAll(getNamespaceCompletions(replaceSpan));
			}
		} else if (tleValue instanceof FunctionCall) {
			completions.addAll(getFunctionCallCompletions((FunctionCall) tleValue));
		} else if (tleValue instanceof StringLiteral) {
			completions.addAll(getStringLiteralCompletions((StringLiteral) tleValue));
		} else if (tleValue instanceof PropertyAccess) {
			completions.addAll(getPropertyAccessCompletions((PropertyAccess) tleValue));
		}

		completions.addAll(getDependsOnCompletions(triggerCharacter));
		return Completions.of(completions);
	}

	/**
	 * Past the left bracket and not past the right one (if there is one).
	 */
	private boolean isInsideSquareBrackets() {
		Token left = parseResult.getLeftSquareBracketToken();
		Token right = parseResult.getRightSquareBracketToken();
		return left != null
				&& left.getSpan().getAfterEndIndex() <= tleCharacterIndex
				&& (right == null || tleCharacterIndex <= right.getSpan().getStartIndex());
	}

	private List<CompletionItem> getFunctionCallCompletions(FunctionCall call) {
		String namespaceName = call.getNamespace();
		UserFunctionNamespaceDefinition namespace = namespaceName != null
				? getScope().getFunctionNamespaceDefinition(namespaceName)
				: null;

		// the token being completed; null means insert at the position
		Token tokenToComplete;
		boolean completeNamespaces;
		boolean completeBuiltinFunctions;
		boolean completeUserFunctions;

		if (call.getNameToken() != null
				&& call.getNameToken().getSpan().contains(tleCharacterIndex, ContainsBehavior.EXTENDED)) {
			// "namespace.func|tion", "name|space" or "func|tion"
			tokenToComplete = call.getNameToken();
			completeUserFunctions = namespace != null;
			completeNamespaces = namespace == null;
			completeBuiltinFunctions = namespace == null;
		} else if (namespaceName != null && call.getPeriodToken() != null
				&& call.getPeriodToken().getSpan().getAfterEndIndex() == tleCharacterIndex) {
			// "namespace.|function"
			if (namespace == null) {
				return Collections.emptyList();
			}
			Token nameToken = call.getNameToken();
			// "namespace.| function": the name is further right, nothing to replace
			tokenToComplete = nameToken != null
					&& nameToken.getSpan().contains(tleCharacterIndex, ContainsBehavior.EXTENDED) ? nameToken : null;
			completeUserFunctions = true;
			completeNamespaces = false;
			completeBuiltinFunctions = false;
		} else if (call.getNamespaceToken() != null && call.getPeriodToken() != null
				&& call.getNamespaceToken().getSpan().contains(tleCharacterIndex, ContainsBehavior.EXTENDED)) {
			// "name|space.function"
			tokenToComplete = call.getNamespaceToken();
			completeUserFunctions = false;
			completeNamespaces = true;
			completeBuiltinFunctions = true;
		} else if (call.isCallToBuiltinWithName(TemplateKeys.PARAMETERS) && call.getArgumentExpressions().isEmpty()
				&& isInsideArgumentList(call)) {
			// "parameters(|)"
			return getParameterCompletions(call);
		} else if (call.isCallToBuiltinWithName(TemplateKeys.VARIABLES) && call.getArgumentExpressions().isEmpty()
				&& isInsideArgumentList(call)) {
			return getVariableCompletions(call);
		} else {
			// "function |()", "function(|)", ...: a new call may start here
			tokenToComplete = null;
			completeUserFunctions = false;
			completeNamespaces = true;
			completeBuiltinFunctions = true;
		}

		Span replaceSpan;
		if (tokenToComplete != null) {
			int tokenStart = tokenToComplete.getSpan().getStartIndex();
			replaceSpan = new Span(getJsonStringStartIndex() + tokenStart, tleCharacterIndex - tokenStart);
		} else {
			replaceSpan = getEmptySpanAtDocumentCharacterIndex();
		}

		List<CompletionItem> completions = new ArrayList<>();
		if (completeUserFunctions && namespace != null) {
			completions.addAll(getFunctionCompletions(namespace, replaceSpan));
		}
		if (completeBuiltinFunctions) {
			completions.addAll(getFunctionCompletions(null, replaceSpan));
		}
		if (completeNamespaces) {
			completions.addAll(getNamespaceCompletions(replaceSpan));
		}
		completions.addAll(getResourceIdCompletions(call));
		return completions;
	}

	/** Between the parentheses of {@code call}, or past its unclosed left one. */
	private boolean isInsideArgumentList(FunctionCall call) {
		Integer argumentIndex = getFunctionCallArgumentIndex(call);
		Token rightParenthesis = call.getRightParenthesisToken();
		return argumentIndex != null && argumentIndex >= 0
				&& (rightParenthesis == null || tleCharacterIndex <= rightParenthesis.getSpan().getStartIndex());
	}

	private List<CompletionItem> getStringLiteralCompletions(StringLiteral string) {
		if (string.isParametersArgument()) {
			return getParameterCompletions(string);
		}
		if (string.isVariablesArgument()) {
			return getVariableCompletions(string);
		}
		FunctionCall call = string.getFunctionCallParentOfArgument();
		if (call != null) {
			return getResourceIdCompletions(call);
		}
		return Collections.emptyList();
	}

	private List<CompletionItem> getResourceIdCompletions(FunctionCall call) {
		Integer argumentIndex = getFunctionCallArgumentIndex(call);
		if (argumentIndex == null || argumentIndex < 0) {
			return Collections.emptyList();
		}
		return ResourceIdCompletions.getCompletions(call, argumentIndex, jsonStringValue.getQuotedValue(),
				getJsonStringStartIndex(), documentCharacterIndex, template.getResourceGraph(getScope()),
				builtinFunctions);
	}

	/**
	 * {@code f().a.b.|}: members of a built-in's result, or the property names
	 * found by following {@code a.b} through the literal value of a variable
	 * or a parameter's default value.
	 */
	private List<CompletionItem> getPropertyAccessCompletions(PropertyAccess access) {
		FunctionCall functionSource = access.getFunctionSource();
		if (functionSource == null) {
			return Collections.emptyList();
		}

		String propertyPrefix = "";
		Span replaceSpan = getEmptySpanAtDocumentCharacterIndex();
		Token nameToken = access.getNameToken();
		if (nameToken != null) {
			replaceSpan = nameToken.getSpan().translate(getJsonStringStartIndex());
			int prefixLength = Math.max(0, Math.min(nameToken.getLength(),
					tleCharacterIndex - nameToken.getSpan().getStartIndex()));
			propertyPrefix = nameToken.getText().substring(0, prefixLength).toLowerCase(Locale.ROOT);
		}

		TemplateScope currentScope = getScope();
		VariableDefinition variable = currentScope.getVariableDefinitionFromFunctionCall(functionSource);
		ParameterDefinition parameter = currentScope.getParameterDefinitionFromFunctionCall(functionSource);
		List<String> sourcesNameStack = access.getSourcesNameStack();
		if (variable != null) {
			ObjectValue value = JsonValue.asObjectValue(variable.getValue());
			if (value != null) {
				return getDeepPropertyAccessCompletions(propertyPrefix, value, sourcesNameStack, replaceSpan);
			}
		} else if (parameter != null) {
			ObjectValue defaultValue = JsonValue.asObjectValue(parameter.getDefaultValue());
			if (defaultValue != null) {
				return getDeepPropertyAccessCompletions(propertyPrefix, defaultValue, sourcesNameStack, replaceSpan);
			}
		} else if (sourcesNameStack.isEmpty() && !functionSource.isUserFunction() && functionSource.getName() != null) {
			// only one level of access on other built-ins: resourceGroup().location
			BuiltinFunctionMetadata metadata = builtinFunctions.findByName(functionSource.getName());
			if (metadata != null) {
				List<CompletionItem> result = new ArrayList<>();
				for (String member : metadata.getReturnValueMembers()) {
					if (member.toLowerCase(Locale.ROOT).startsWith(propertyPrefix)) {
						result.add(CompletionItem.fromPropertyName(member, replaceSpan));
					}
				}
				return result;
			}
		}
		return Collections.emptyList();
	}

	private static List<CompletionItem> getDeepPropertyAccessCompletions(String propertyPrefix, ObjectValue root,
			List<String> sourcesNameStack, Span replaceSpan) {
		ObjectValue source = JsonValue.asObjectValue(root.getPropertyValueFromStack(sourcesNameStack));
		if (source == null) {
			return Collections.emptyList();
		}
		List<CompletionItem> result = new ArrayList<>();
		for (String propertyName : source.getPropertyNames()) {
			if (propertyName.toLowerCase(Locale.ROOT).startsWith(propertyPrefix)) {
				result.add(CompletionItem.fromPropertyName(propertyName, replaceSpan));
			}
		}
		return result;
	}

	/**
	 * Built-in functions, or the members of a namespace.
	 */
	private List<CompletionItem> getFunctionCompletions(UserFunctionNamespaceDefinition namespace, Span replaceSpan) {
		List<CompletionItem> result = new ArrayList<>();
		if (namespace != null) {
			for (UserFunctionDefinition member : namespace.getMembers()) {
				result.add(CompletionItem.fromFunctionMetadata(new UserFunctionMetadata(member), member.getName(),
						replaceSpan));
			}
		} else {
			for (BuiltinFunctionMetadata function : builtinFunctions.getAll()) {
				result.add(CompletionItem.fromFunctionMetadata(function, function.getName(), replaceSpan));
			}
		}
		return result;
	}

	private List<CompletionItem> getNamespaceCompletions(Span replaceSpan) {
		List<CompletionItem> result = new ArrayList<>();
		for (UserFunctionNamespaceDefinition namespace : getScope().getNamespaceDefinitions()) {
			result.add(CompletionItem.fromNamespaceDefinition(namespace, replaceSpan));
		}
		return result;
	}

	private List<CompletionItem> getParameterCompletions(ExpressionValue value) {
		ReplaceSpanInfo replaceInfo = getParameterOrVariableNameReplaceInfo(value);
		List<CompletionItem> result = new ArrayList<>();
		if (replaceInfo != null) {
			for (ParameterDefinition parameter : getScope().getParameterDefinitions()) {
				result.add(CompletionItem.fromParameterDefinition(parameter, replaceInfo.replaceSpan,
						replaceInfo.includeSingleQuotes, replaceInfo.includeRightParenthesis));
			}
		}
		return result;
	}

	private List<CompletionItem> getVariableCompletions(ExpressionValue value) {
		ReplaceSpanInfo replaceInfo = getParameterOrVariableNameReplaceInfo(value);
		List<CompletionItem> result = new ArrayList<>();
		if (replaceInfo != null) {
			for (VariableDefinition variable : getScope().getVariableDefinitions()) {
				result.add(CompletionItem.fromVariableDefinition(variable, replaceInfo.replaceSpan,
						replaceInfo.includeSingleQuotes, replaceInfo.includeRightParenthesis));
			}
		}
		return result;
	}

	private static final class ReplaceSpanInfo {
		final Span replaceSpan;
		final boolean includeSingleQuotes;
		final boolean includeRightParenthesis;

		ReplaceSpanInfo(Span replaceSpan, boolean includeRightParenthesis) {
			this.replaceSpan = replaceSpan;
			this.includeSingleQuotes = true;
			this.includeRightParenthesis = includeRightParenthesis;
		}
	}

	/**
	 * Replacement for a parameter or variable name. The whole quoted argument
	 * is replaced, closing parenthesis included, so that the cursor ends up
	 * after the call. Returns {@code null} when the position is after the
	 * string argument.
	 *
	 * @param value the string argument, or the {@code parameters(|)} call when
	 *              there is no argument yet
	 */
	private ReplaceSpanInfo getParameterOrVariableNameReplaceInfo(ExpressionValue value) {
		int stringStart = getJsonStringStartIndex();
		if (value instanceof FunctionCall) {
			Token rightParenthesis = ((FunctionCall) value).getRightParenthesisToken();
			if (rightParenthesis != null) {
				return new ReplaceSpanInfo(new Span(documentCharacterIndex,
						rightParenthesis.getSpan().getStartIndex() - tleCharacterIndex + 1), true);
			}
			return new ReplaceSpanInfo(getEmptySpanAtDocumentCharacterIndex(), true);
		}

		StringLiteral string = (StringLiteral) value;
		Span stringSpan = string.getSpan();
		int argumentStart = stringSpan.getStartIndex();
		FunctionCall call = string.getFunctionCallParentOfArgument();
		String quotedValue = string.getQuotedValue();

		if (tleCharacterIndex <= argumentStart) {
			// "parameters(|'existing text'": insert only, the existing text is kept
			return new ReplaceSpanInfo(new Span(documentCharacterIndex, 0), false);
		}
		if (tleCharacterIndex > stringSpan.getEndIndex()) {
			return null;
		}
		if (tleCharacterIndex - argumentStart == 1 && quotedValue.startsWith("''")) {
			// "resourceId('|''Microsoft.Network/virtualNetworks'": the editor closed the quote just typed,
			// which reads as an escaped quote. Only those two quotes are replaced.
			return new ReplaceSpanInfo(new Span(stringStart + argumentStart, 2), false);
		}

		// An unterminated argument may have swallowed the rest of the expression: stop at ')' or ']'
		int rightParenthesisIndex = quotedValue.indexOf(')');
		int rightSquareBracketIndex = quotedValue.indexOf(']');
		Span replaceSpan;
		boolean includeRightParenthesis;
		if (rightParenthesisIndex >= 0) {
			replaceSpan = new Span(argumentStart, rightParenthesisIndex + 1);
			includeRightParenthesis = true;
		} else if (rightSquareBracketIndex >= 0) {
			replaceSpan = new Span(argumentStart, rightSquareBracketIndex);
			includeRightParenthesis = true;
		} else if (call != null && call.getRightParenthesisToken() != null && call.getArgumentExpressions().size() == 1) {
			replaceSpan = Span.fromStartAndAfterEnd(argumentStart,
					call.getRightParenthesisToken().getSpan().getAfterEndIndex());
			includeRightParenthesis = true;
		} else {
			replaceSpan = stringSpan;
			includeRightParenthesis = call != null && call.getArgumentExpressions().size() <= 1;
		}
		return new ReplaceSpanInfo(replaceSpan.translate(stringStart), includeRightParenthesis);
	}

	// ---- dependsOn ----

	private List<CompletionItem> getDependsOnCompletions(String triggerCharacter) {
		if (triggerCharacter != null && !"\"".equals(triggerCharacter)) {
			return Collections.emptyList();
		}
		if (parseResult != null && parseResult.isExpression()) {
			return Collections.emptyList();
		}
		List<JsonValue> parents = getInsertionParents();
		if (parents.size() < 2 || !(parents.get(0) instanceof ArrayValue) || !(parents.get(1) instanceof Property)
				|| !((Property) parents.get(1)).hasName(TemplateKeys.DEPENDS_ON)) {
			return Collections.emptyList();
		}
		Span span = jsonToken != null && jsonToken.getType() == JsonTokenType.QUOTED_STRING
				? jsonToken.getSpan()
				: getEmptySpanAtDocumentCharacterIndex();
		return DependsOnCompletions.getCompletions(template.getResourceGraph(getScope()), span,
				documentCharacterIndex);
	}

	/**
	 * The object or array a new JSON item would be added to at the position
	 * (for a position inside a string: the one holding the string), followed
	 * by its ancestors, nearest first. Empty inside comments or other values.
	 */
	List<JsonValue> getInsertionParents() {
		JsonValue insertionParent = getInsertionParent(documentCharacterIndex);
		if (insertionParent == null && jsonStringValue != null) {
			insertionParent = getInsertionParent(jsonStringValue.getSpan().getStartIndex());
		}
		if (insertionParent == null) {
			return Collections.emptyList();
		}
		List<JsonValue> lineage = template.getJsonParseResult().getLineage(insertionParent);
		List<JsonValue> parents = new ArrayList<>();
		parents.add(insertionParent);
		if (lineage != null) {
			for (int i = lineage.size() - 1; i >= 0; i--) {
				parents.add(lineage.get(i));
			}
		}
		return parents;
	}

	private JsonValue getInsertionParent(int index) {
		JsonParseResult jsonParseResult = template.getJsonParseResult();
		JsonValue enclosing = jsonParseResult.getValueAtCharacterIndex(index, ContainsBehavior.ENCLOSED);
		if (!(enclosing instanceof ObjectValue) && !(enclosing instanceof ArrayValue)) {
			return null;
		}
		for (JsonToken comment : jsonParseResult.getCommentTokens()) {
			if (comment.getSpan().contains(index, ContainsBehavior.ENCLOSED)) {
				return null;
			}
		}
		return enclosing;
	}

	/**
	 * {@code "resources": [ {|} ]} right after the user typed the brace: the
	 * client should ask again so that object-level completions show up.
	 */
	private boolean isNewObjectInArray(String triggerCharacter) {
		if (!"{".equals(triggerCharacter)) {
			return false;
		}
		List<JsonValue> parents = getInsertionParents();
		return parents.size() >= 3
				&& parents.get(0) instanceof ObjectValue
				&& ((ObjectValue) parents.get(0)).getProperties().isEmpty()
				&& parents.get(1) instanceof ArrayValue
				&& parents.get(2) instanceof Property;
	}

	// ---- References ----

	/**
	 * The named entity referenced at the position: a namespace or function
	 * name, or the string argument of {@code parameters()}/{@code variables()}.
	 * With {@code includeDefinition}, a position on the name of a definition
	 * also counts.
	 */
	public ReferenceSite getReferenceSite(boolean includeDefinition) {
		if (jsonStringValue == null) {
			return null;
		}
		TemplateScope currentScope = getScope();
		int stringStart = getJsonStringStartIndex();

		if (tleValue instanceof FunctionCall) {
			FunctionCall call = (FunctionCall) tleValue;
			Token namespaceToken = call.getNamespaceToken();
			Token nameToken = call.getNameToken();
			if (namespaceToken != null && namespaceToken.getSpan().contains(tleCharacterIndex, ContainsBehavior.STRICT)) {
				UserFunctionNamespaceDefinition namespace = currentScope.getFunctionNamespaceDefinition(call.getNamespace());
				if (namespace != null) {
					return new ReferenceSite(ReferenceSiteKind.REFERENCE, namespace,
							namespaceToken.getSpan().translate(stringStart));
				}
			} else if (nameToken != null && nameToken.getSpan().contains(tleCharacterIndex, ContainsBehavior.STRICT)) {
				Span span = nameToken.getSpan().translate(stringStart);
				NamedDefinition definition = namespaceToken != null
						? currentScope.getUserFunctionDefinition(call.getNamespace(), call.getName())
						: builtinFunctions.findByName(call.getName());
				if (definition != null) {
					return new ReferenceSite(ReferenceSiteKind.REFERENCE, definition, span);
				}
			}
		}

		if (tleValue instanceof StringLiteral) {
			StringLiteral string = (StringLiteral) tleValue;
			NamedDefinition definition = null;
			if (string.isParametersArgument()) {
				definition = currentScope.getParameterDefinition(string.getUnquotedValue());
			} else if (string.isVariablesArgument()) {
				definition = currentScope.getVariableDefinition(string.getUnquotedValue());
			}
			if (definition != null) {
				return new ReferenceSite(ReferenceSiteKind.REFERENCE, definition,
						string.getUnquotedSpan().translate(stringStart));
			}
		}

		if (includeDefinition) {
			NamedDefinition definition = getDefinitionAtSite();
			if (definition != null) {
				return new ReferenceSite(ReferenceSiteKind.DEFINITION, definition,
						definition.getNameValue().getUnquotedSpan());
			}
		}
		return null;
	}

	/**
	 * The definition whose name is the JSON string at the position.
	 */
	private NamedDefinition getDefinitionAtSite() {
		String name = jsonStringValue.getUnquotedValue();
		TemplateScope currentScope = getScope();

		ParameterDefinition parameter = currentScope.getParameterDefinition(name);
		if (parameter != null && parameter.getNameValue() == jsonStringValue) {
			return parameter;
		}
		VariableDefinition variable = currentScope.getVariableDefinition(name);
		if (variable != null && variable.getNameValue() == jsonStringValue) {
			return variable;
		}
		UserFunctionNamespaceDefinition namespace = currentScope.getFunctionNamespaceDefinition(name);
		if (namespace != null && namespace.getNameValue() == jsonStringValue) {
			return namespace;
		}
		for (UserFunctionNamespaceDefinition ns : currentScope.getNamespaceDefinitions()) {
			UserFunctionDefinition function = currentScope.getUserFunctionDefinition(ns.getName(), name);
			if (function != null && function.getNameValue() == jsonStringValue) {
				return function;
			}
		}
		return null;
	}

	/**
	 * Spans of all references to the entity at the position, its definition
	 * first. {@code null} when there is no such entity.
	 */
	public List<Span> getReferences() {
		ReferenceSite site = getReferenceSite(true);
		if (site == null) {
			return null;
		}
		return FindReferencesVisitor.findReferences(template, site.getDefinition(), builtinFunctions);
	}

	// ---- Signature help ----

	public FunctionSignatureHelp getSignatureHelp() {
		FunctionCall call = getEnclosingFunctionCall();
		if (call == null || call.getName() == null) {
			return null;
		}
		FunctionMetadata metadata;
		if (call.isUserFunction()) {
			UserFunctionDefinition definition = getScope().getUserFunctionDefinition(call.getNamespace(), call.getName());
			metadata = definition != null ? new UserFunctionMetadata(definition) : null;
		} else {
			metadata = builtinFunctions.findByName(call.getName());
		}
		if (metadata == null) {
			return null;
		}

		int argumentIndex = getFunctionCallArgumentIndex(call);
		List<FunctionParameterMetadata> parameters = metadata.getParameters();
		if (!parameters.isEmpty() && parameters.size() <= argumentIndex
				&& parameters.get(parameters.size() - 1).isVariadic()) {
			argumentIndex = parameters.size() - 1;
		}
		return new FunctionSignatureHelp(argumentIndex, metadata);
	}

	/**
	 * The expression value at the position if it is a call, else its parent
	 * if that is a call.
	 */
	private FunctionCall getEnclosingFunctionCall() {
		if (tleValue instanceof FunctionCall) {
			return (FunctionCall) tleValue;
		}
		if (tleValue != null && tleValue.getParent() instanceof FunctionCall) {
			return (FunctionCall) tleValue.getParent();
		}
		return null;
	}

	/**
	 * Index of the argument of {@code call} at the position: the number of
	 * commas before it. -1 when the position is not past the left
	 * parenthesis, {@code null} when not inside an expression value.
	 */
	public Integer getFunctionCallArgumentIndex(FunctionCall call) {
		if (tleValue == null || call == null) {
			return null;
		}
		Token leftParenthesis = call.getLeftParenthesisToken();
		if (leftParenthesis == null || tleCharacterIndex <= leftParenthesis.getSpan().getEndIndex()) {
			return -1;
		}
		int argumentIndex = 0;
		for (Token comma : call.getCommaTokens()) {
			if (comma.getSpan().getStartIndex() < tleCharacterIndex) {
				argumentIndex++;
			}
		}
		return argumentIndex;
	}
}
