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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PrepareRenameDefaultBehavior;
import org.eclipse.lsp4j.PrepareRenameResult;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either3;

import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.position.ReferenceSite;
import com.tomaszrup.armls.position.TemplatePositionContext;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;

/**
 * Renames a parameter, variable, user function or user function namespace,
 * at its definition and at every reference in the template. Built-in
 * functions are not renamable.
 */
public class RenameProvider {
	private final DeploymentTemplate template;
	private final BuiltinFunctions builtinFunctions;

	public RenameProvider(DeploymentTemplate template, BuiltinFunctions builtinFunctions) {
		this.template = template;
		this.builtinFunctions = builtinFunctions;
	}

	public CompletableFuture<Either3<Range, PrepareRenameResult, PrepareRenameDefaultBehavior>> providePrepareRename(
			Position position) {
		ReferenceSite site = getRenamableSite(ArmLanguageServerUtils.createPositionContext(template,
				builtinFunctions, position));
		if (site == null) {
			return CompletableFuture.completedFuture(null);
		}
		Range range = ArmLanguageServerUtils.spanToRange(template.getText(), site.getUnquotedReferenceSpan());
		PrepareRenameResult result = new PrepareRenameResult(range, site.getDefinition().getName());
		return CompletableFuture.completedFuture(Either3.forSecond(result));
	}

	public CompletableFuture<WorkspaceEdit> provideRename(Position position, String newName) {
		if (!isValidName(newName)) {
			return CompletableFuture.completedFuture(null);
		}
		TemplatePositionContext positionContext = ArmLanguageServerUtils.createPositionContext(template,
				builtinFunctions, position);
		if (getRenamableSite(positionContext) == null) {
			return CompletableFuture.completedFuture(null);
		}

		List<TextEdit> edits = new ArrayList<>();
		for (Span span : positionContext.getReferences()) {
			edits.add(new TextEdit(ArmLanguageServerUtils.spanToRange(template.getText(), span), newName));
		}
		Map<String, List<TextEdit>> changes = new HashMap<>();
		changes.put(template.getUri().toString(), edits);
		return CompletableFuture.completedFuture(new WorkspaceEdit(changes));
	}

	private static ReferenceSite getRenamableSite(TemplatePositionContext positionContext) {
		ReferenceSite site = positionContext != null ? positionContext.getReferenceSite(true) : null;
		if (site == null || site.getDefinition().getNameValue() == null) {
			return null;
		}
		return site;
	}

	/**
	 * Names are written inside JSON strings and single-quoted expression
	 * strings, so quotes and backslashes are not allowed.
	 */
	static boolean isValidName(String name) {
		if (name == null || name.trim().isEmpty()) {
			return false;
		}
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c == '\'' || c == '"' || c == '\\' || Character.isISOControl(c)) {
				return false;
			}
		}
		return true;
	}
}
