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
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.PublishDiagnosticsParams;

import com.tomaszrup.armls.language.Issue;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;

/**
 * Expression syntax errors of a template as LSP diagnostics.
 */
public class DiagnosticsProvider {
	private final DeploymentTemplate template;

	public DiagnosticsProvider(DeploymentTemplate template) {
		this.template = template;
	}

	public PublishDiagnosticsParams provideDiagnostics() {
		List<Diagnostic> diagnostics = new ArrayList<>();
		for (Issue issue : template.getExpressionIssues()) {
			diagnostics.add(ArmLanguageServerUtils.issueToDiagnostic(template.getText(), issue));
		}
		return new PublishDiagnosticsParams(template.getUri().toString(), diagnostics);
	}
}
