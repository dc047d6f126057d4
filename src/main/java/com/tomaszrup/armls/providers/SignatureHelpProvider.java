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
package com.tomaszrup.armls.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.ParameterInformation;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.SignatureHelp;
import org.eclipse.lsp4j.SignatureInformation;

import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.functions.FunctionMetadata;
import com.tomaszrup.armls.functions.FunctionParameterMetadata;
import com.tomaszrup.armls.position.FunctionSignatureHelp;
import com.tomaszrup.armls.position.TemplatePositionContext;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;

public class SignatureHelpProvider {
	private final DeploymentTemplate template;
	private final BuiltinFunctions builtinFunctions;

	public SignatureHelpProvider(DeploymentTemplate template, BuiltinFunctions builtinFunctions) {
		this.template = template;
		this.builtinFunctions = builtinFunctions;
	}

	public CompletableFuture<SignatureHelp> provideSignatureHelp(Position position) {
		TemplatePositionContext positionContext = ArmLanguageServerUtils.createPositionContext(template,
				builtinFunctions, position);
		FunctionSignatureHelp functionSignatureHelp = positionContext != null ? positionContext.getSignatureHelp()
				: null;
		if (functionSignatureHelp == null) {
			return CompletableFuture.completedFuture(null);
		}

		FunctionMetadata metadata = functionSignatureHelp.getFunctionMetadata();
		List<ParameterInformation> parameters = new ArrayList<>();
		for (FunctionParameterMetadata parameter : metadata.getParameters()) {
			parameters.add(new ParameterInformation(parameter.getUsage()));
		}
		SignatureInformation signature = new SignatureInformation(metadata.getUsage());
		if (metadata.getDescription() != null) {
			signature.setDocumentation(new MarkupContent(MarkupKind.MARKDOWN, metadata.getDescription()));
		}
		signature.setParameters(parameters);

		SignatureHelp signatureHelp = new SignatureHelp();
		signatureHelp.setSignatures(Collections.singletonList(signature));
		signatureHelp.setActiveSignature(0);
		if (functionSignatureHelp.getActiveParameterIndex() >= 0) {
			signatureHelp.setActiveParameter(functionSignatureHelp.getActiveParameterIndex());
		}
		return CompletableFuture.completedFuture(signatureHelp);
	}
}
