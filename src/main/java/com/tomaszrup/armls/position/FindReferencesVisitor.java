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
import java.util.List;
import java.util.Locale;

import com.tomaszrup.armls.expressions.ExpressionValue;
import com.tomaszrup.armls.expressions.ExpressionVisitor;
import com.tomaszrup.armls.expressions.FunctionCall;
import com.tomaszrup.armls.expressions.ParseResult;
import com.tomaszrup.armls.expressions.StringLiteral;
import com.tomaszrup.armls.functions.BuiltinFunctionMetadata;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.template.NamedDefinition;
import com.tomaszrup.armls.template.TemplateKeys;
import com.tomaszrup.armls.template.TemplateScope;

/**
 * Collects the spans of every reference to one definition within an
 * expression. A reference counts only when it resolves to that very
 * definition in the scope of the expression, so equally named definitions
 * of other scopes are not matched.
 */
public class FindReferencesVisitor extends ExpressionVisitor {
	private final NamedDefinition definition;
	private final BuiltinFunctions builtinFunctions;
	private final TemplateScope scope;
	private final int stringStartIndex;
	private final List<Span> references;

	FindReferencesVisitor(NamedDefinition definition, BuiltinFunctions builtinFunctions, TemplateScope scope,
			int stringStartIndex, List<Span> references) {
		this.definition = definition;
		this.builtinFunctions = builtinFunctions;
		this.scope = scope;
		this.stringStartIndex = stringStartIndex;
		this.references = references;
	}

	/**
	 * Finds all references in the template, preceded by the definition's own
	 * name span when it lives in the document. Spans are document spans
	 * without quotes.
	 */
	public static List<Span> findReferences(DeploymentTemplate template, NamedDefinition definition,
			BuiltinFunctions builtinFunctions) {
		List<Span> result = new ArrayList<>();
		if (definition.getNameValue() != null) {
			result.add(definition.getNameValue().getUnquotedSpan());
		}
		for (StringValue stringValue : template.getStringValues()) {
			ParseResult parseResult = template.getParseResult(stringValue);
			ExpressionValue expression = parseResult.getExpression();
			if (expression == null || !parseResult.isExpression()) {
				continue;
			}
			TemplateScope scope = template.getScopeForValue(stringValue);
			expression.accept(new FindReferencesVisitor(definition, builtinFunctions, scope,
					stringValue.getSpan().getStartIndex(), result));
		}
		return result;
	}

	@Override
	public void visitFunctionCall(FunctionCall call) {
		switch (definition.getDefinitionKind()) {
			case USER_FUNCTION:
				if (call.getNameToken() != null && call.getNamespaceToken() != null
						&& scope.getUserFunctionDefinition(call.getNamespace(), call.getName()) == definition) {
					add(call.getNameToken().getSpan());
				}
				break;
			case NAMESPACE:
				if (call.getNamespaceToken() != null
						&& scope.getFunctionNamespaceDefinition(call.getNamespace()) == definition) {
					add(call.getNamespaceToken().getSpan());
				}
				break;
			case BUILTIN_FUNCTION:
				if (call.getNameToken() != null && call.getNamespaceToken() == null) {
					BuiltinFunctionMetadata metadata = builtinFunctions.findByName(call.getName());
					// catalogues may be reloaded, so names are compared rather than instances
					if (metadata != null
							&& metadata.getLowerCaseName().equals(definition.getName().toLowerCase(Locale.ROOT))) {
						add(call.getNameToken().getSpan());
					}
				}
				break;
			case PARAMETER:
				StringLiteral parameterName = getSingleStringArgument(call, TemplateKeys.PARAMETERS);
				if (parameterName != null
						&& scope.getParameterDefinition(parameterName.getUnquotedValue()) == definition) {
					add(parameterName.getUnquotedSpan());
				}
				break;
			case VARIABLE:
				StringLiteral variableName = getSingleStringArgument(call, TemplateKeys.VARIABLES);
				if (variableName != null
						&& scope.getVariableDefinition(variableName.getUnquotedValue()) == definition) {
					add(variableName.getUnquotedSpan());
				}
				break;
			default:
				throw new IllegalStateException("Unknown definition kind " + definition.getDefinitionKind());
		}
		super.visitFunctionCall(call);
	}

	private static StringLiteral getSingleStringArgument(FunctionCall call, String builtinName) {
		if (call.isCallToBuiltinWithName(builtinName) && call.getArgumentExpressions().size() == 1
				&& call.getArgumentExpressions().get(0) instanceof StringLiteral) {
			return (StringLiteral) call.getArgumentExpressions().get(0);
		}
		return null;
	}

	private void add(Span expressionSpan) {
		references.add(expressionSpan.translate(stringStartIndex));
	}
}
