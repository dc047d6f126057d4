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
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.CompletionContext;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.armls.completion.Completions;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.position.TemplatePositionContext;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;

public class CompletionProvider {
	private static final Logger logger = LoggerFactory.getLogger(CompletionProvider.class);

	private final DeploymentTemplate template;
	private final BuiltinFunctions builtinFunctions;

	public CompletionProvider(DeploymentTemplate template, BuiltinFunctions builtinFunctions) {
		this.template = template;
		this.builtinFunctions = builtinFunctions;
	}

	/**
	 * When the engine asks for the list to be requested again (a brace was
	 * just typed in an array), an empty incomplete list is returned so that
	 * the client re-queries on the next keystroke.
	 */
	public CompletableFuture<Either<List<CompletionItem>, CompletionList>> provideCompletion(Position position,
			CompletionContext context) {
		TemplatePositionContext positionContext = ArmLanguageServerUtils.createPositionContext(template,
				builtinFunctions, position);
		if (positionContext == null) {
			return CompletableFuture.completedFuture(Either.forRight(new CompletionList()));
		}
		String triggerCharacter = context != null ? context.getTriggerCharacter() : null;
		Completions completions = positionContext.getCompletions(triggerCharacter);

		List<CompletionItem> items = new ArrayList<>();
		for (com.tomaszrup.armls.completion.CompletionItem item : completions.getItems()) {
			items.add(toLspCompletionItem(item));
		}
		logger.debug("{} completion items at {}:{} (trigger {})", items.size(), position.getLine(),
				position.getCharacter(), triggerCharacter);
		return CompletableFuture.completedFuture(Either.forRight(new CompletionList(completions.isTriggerSuggest(), items)));
	}

	private CompletionItem toLspCompletionItem(com.tomaszrup.armls.completion.CompletionItem item) {
		CompletionItem result = new CompletionItem(item.getLabel());
		result.setKind(ArmLanguageServerUtils.completionKindToCompletionItemKind(item.getKind()));
		result.setTextEdit(Either.forLeft(new TextEdit(
				ArmLanguageServerUtils.spanToRange(template.getText(), item.getSpan()), item.getInsertText())));
		result.setSortText(item.getPriority().getSortPrefix() + item.getLabel());
		if (item.getFilterText() != null) {
			result.setFilterText(item.getFilterText());
		}
		if (item.isPreselect()) {
			result.setPreselect(true);
		}
		result.setDetail(item.getDetail());
		if (item.getDocumentation() != null) {
			result.setDocumentation(new MarkupContent(MarkupKind.MARKDOWN, item.getDocumentation()));
		}
		return result;
	}
}
