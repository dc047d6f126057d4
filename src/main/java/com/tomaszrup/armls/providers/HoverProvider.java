////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.armls.providers;

import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;

import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.expressions.ExpressionStrings;
import com.tomaszrup.armls.json.ArrayValue;
import com.tomaszrup.armls.json.BooleanValue;
import com.tomaszrup.armls.json.JsonValue;
import com.tomaszrup.armls.json.NumberValue;
import com.tomaszrup.armls.json.ObjectValue;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.position.ReferenceSite;
import com.tomaszrup.armls.position.TemplatePositionContext;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.template.NamedDefinition;
import com.tomaszrup.armls.template.ParameterDefinition;
import com.tomaszrup.armls.template.UserFunctionDefinition;
import com.tomaszrup.armls.template.VariableDefinition;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;

public class HoverProvider {
	private static final String CODE_BLOCK_LANGUAGE = "arm-template";

	private final DeploymentTemplate template;
	private final BuiltinFunctions builtinFunctions;

	public HoverProvider(DeploymentTemplate template, BuiltinFunctions builtinFunctions) {
		this.template = template;
		this.builtinFunctions = builtinFunctions;
	}

	public CompletableFuture<Hover> provideHover(Position position) {
		TemplatePositionContext positionContext = ArmLanguageServerUtils.createPositionContext(template,
				builtinFunctions, position);
		if (positionContext == null) {
			return CompletableFuture.completedFuture(null);
		}
		ReferenceSite site = positionContext.getReferenceSite(true);
		if (site == null) {
			return CompletableFuture.completedFuture(null);
		}

		NamedDefinition definition = site.getDefinition();
		StringBuilder contentsBuilder = new StringBuilder();
		contentsBuilder.append("```").append(CODE_BLOCK_LANGUAGE).append("\n");
		contentsBuilder.append(getContent(definition));
		contentsBuilder.append("\n```");
		String documentation = getDocumentation(definition);
		if (documentation != null) {
			contentsBuilder.append("\n\n---\n\n");
			contentsBuilder.append(documentation);
		}

		Hover hover = new Hover();
		hover.setContents(new MarkupContent(MarkupKind.MARKDOWN, contentsBuilder.toString()));
		hover.setRange(ArmLanguageServerUtils.spanToRange(template.getText(), site.getUnquotedReferenceSpan()));
		return CompletableFuture.completedFuture(hover);
	}

	private String getContent(NamedDefinition definition) {
		switch (definition.getDefinitionKind()) {
			case PARAMETER: {
				ParameterDefinition parameter = (ParameterDefinition) definition;
				String type = parameter.getType() != null ? " [" + parameter.getType() + "]" : "";
				return "(parameter) " + parameter.getName() + type;
			}
			case USER_FUNCTION:
				return "(user function) " + ((UserFunctionDefinition) definition).getUsage(true);
			case BUILTIN_FUNCTION:
				return "(function) " + definition.getUsage();
			default:
				return "(" + definition.getFriendlyType() + ") " + definition.getName();
		}
	}

	private String getDocumentation(NamedDefinition definition) {
		switch (definition.getDefinitionKind()) {
			case PARAMETER: {
				ParameterDefinition parameter = (ParameterDefinition) definition;
				JsonValue defaultValue = parameter.getDefaultValue();
				if (defaultValue == null) {
					return parameter.getDescription();
				}
				String defaultText = "Default value: `" + defaultValue.getSpan().getText(template.getText()) + "`";
				return parameter.getDescription() != null ? parameter.getDescription() + "\n\n" + defaultText
						: defaultText;
			}
			case VARIABLE: {
				VariableDefinition variable = (VariableDefinition) definition;
				return variable.getValue() != null ? "Value: " + getValueKind(variable.getValue()) : null;
			}
			default:
				return definition.getDescription();
		}
	}

	private static String getValueKind(JsonValue value) {
		if (value instanceof ObjectValue) {
			return "object";
		} else if (value instanceof ArrayValue) {
			return "array";
		} else if (value instanceof StringValue) {
			return ExpressionStrings.isExpression(((StringValue) value).getUnquotedValue()) ? "expression" : "string";
		} else if (value instanceof NumberValue) {
			return "number";
		} else if (value instanceof BooleanValue) {
			return "boolean";
		}
		return "null";
	}
}
