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
package com.tomaszrup.armls;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.PrepareRenameDefaultBehavior;
import org.eclipse.lsp4j.PrepareRenameParams;
import org.eclipse.lsp4j.PrepareRenameResult;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.RenameParams;
import org.eclipse.lsp4j.SignatureHelp;
import org.eclipse.lsp4j.SignatureHelpParams;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.jsonrpc.messages.Either3;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.providers.CompletionProvider;
import com.tomaszrup.armls.providers.DefinitionProvider;
import com.tomaszrup.armls.providers.DiagnosticsProvider;
import com.tomaszrup.armls.providers.DocumentHighlightProvider;
import com.tomaszrup.armls.providers.HoverProvider;
import com.tomaszrup.armls.providers.ReferenceProvider;
import com.tomaszrup.armls.providers.RenameProvider;
import com.tomaszrup.armls.providers.SignatureHelpProvider;
import com.tomaszrup.armls.resources.ResourceInfo;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.template.TemplateScope;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;
import com.tomaszrup.armls.util.FileContentsTracker;
import com.tomaszrup.armls.util.MdcDocumentContext;

/**
 * Thin facade implementing the LSP {@link TextDocumentService},
 * {@link WorkspaceService}, and {@link LanguageClientAware} interfaces.
 *
 * <p>Every open document is parsed into an immutable
 * {@link DeploymentTemplate} snapshot, which is kept until the text changes.
 * Requests build a provider over the current snapshot.</p>
 */
public class ArmTemplateServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(ArmTemplateServices.class);

	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final ConcurrentHashMap<URI, DeploymentTemplate> templates = new ConcurrentHashMap<>();
	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();
	private final LspRequestGuard requestGuard = new LspRequestGuard();
	private volatile BuiltinFunctions builtinFunctions;

	public ArmTemplateServices(BuiltinFunctions builtinFunctions) {
		this.builtinFunctions = builtinFunctions;
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	public BuiltinFunctions getBuiltinFunctions() {
		return builtinFunctions;
	}

	public void setBuiltinFunctions(BuiltinFunctions builtinFunctions) {
		this.builtinFunctions = builtinFunctions;
	}

	/**
	 * The snapshot of an open document, parsed again only when its text has
	 * changed since the last call. {@code null} for documents that are not
	 * open.
	 */
	public DeploymentTemplate getTemplate(URI uri) {
		String contents = fileContentsTracker.getContents(uri);
		if (contents == null) {
			templates.remove(uri);
			return null;
		}
		return templates.compute(uri, (key, existing) -> {
			if (existing != null && existing.getText().equals(contents)) {
				return existing;
			}
			logger.debug("Parsing template snapshot ({} characters)", contents.length());
			return new DeploymentTemplate(key, contents);
		});
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		fileContentsTracker.didOpen(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		MdcDocumentContext.setDocument(uri);
		try {
			logger.debug("Opened {}", uri);
			publishDiagnostics(uri);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		fileContentsTracker.didChange(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		MdcDocumentContext.setDocument(uri);
		try {
			publishDiagnostics(uri);
		} finally {
			MdcDocumentContext.clear();
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		fileContentsTracker.didClose(params);
		URI uri = URI.create(params.getTextDocument().getUri());
		templates.remove(uri);
		LanguageClient client = languageClient.get();
		if (client != null) {
			client.publishDiagnostics(new PublishDiagnosticsParams(uri.toString(), new ArrayList<>()));
		}
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// contents are tracked through didChange
	}

	private void publishDiagnostics(URI uri) {
		LanguageClient client = languageClient.get();
		DeploymentTemplate template = getTemplate(uri);
		if (client == null || template == null) {
			return;
		}
		PublishDiagnosticsParams diagnostics = new DiagnosticsProvider(template).provideDiagnostics();
		diagnostics.setVersion(fileContentsTracker.getVersion(uri));
		logger.debug("Publishing {} diagnostics", diagnostics.getDiagnostics().size());
		client.publishDiagnostics(diagnostics);
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		// only open documents are analyzed
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		InitializationOptionsParser.applySettings(params.getSettings());
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("completion", uri,
				template -> new CompletionProvider(template, builtinFunctions)
						.provideCompletion(params.getPosition(), params.getContext()),
				Either.forRight(new CompletionList()));
	}

	@Override
	public CompletableFuture<Hover> hover(HoverParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("hover", uri,
				template -> new HoverProvider(template, builtinFunctions).provideHover(params.getPosition()),
				null);
	}

	@Override
	public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(
			DefinitionParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("definition", uri,
				template -> new DefinitionProvider(template, builtinFunctions)
						.provideDefinition(params.getPosition())
						.thenApply(Either::<List<? extends Location>, List<? extends LocationLink>>forLeft),
				Either.forLeft(Collections.emptyList()));
	}

	@Override
	public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		boolean includeDeclaration = params.getContext() == null || params.getContext().isIncludeDeclaration();
		return withTemplate("references", uri,
				template -> new ReferenceProvider(template, builtinFunctions)
						.provideReferences(params.getPosition(), includeDeclaration),
				Collections.emptyList());
	}

	@Override
	public CompletableFuture<List<? extends DocumentHighlight>> documentHighlight(DocumentHighlightParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("documentHighlight", uri,
				template -> new DocumentHighlightProvider(template, builtinFunctions)
						.provideDocumentHighlights(params.getPosition()),
				Collections.emptyList());
	}

	@Override
	public CompletableFuture<Either3<Range, PrepareRenameResult, PrepareRenameDefaultBehavior>> prepareRename(
			PrepareRenameParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("prepareRename", uri,
				template -> new RenameProvider(template, builtinFunctions).providePrepareRename(params.getPosition()),
				null);
	}

	@Override
	public CompletableFuture<WorkspaceEdit> rename(RenameParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("rename", uri,
				template -> new RenameProvider(template, builtinFunctions)
						.provideRename(params.getPosition(), params.getNewName()),
				null);
	}

	@Override
	public CompletableFuture<SignatureHelp> signatureHelp(SignatureHelpParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return withTemplate("signatureHelp", uri,
				template -> new SignatureHelpProvider(template, builtinFunctions)
						.provideSignatureHelp(params.getPosition()),
				null);
	}

	// --- Custom requests ---

	/**
	 * The resources of the top-level scope and of every nested template
	 * scope, each as a tree of root resources.
	 */
	public CompletableFuture<List<ResourceGraphNode>> getResourceGraph(ResourceGraphParams params) {
		if (params == null || params.getUri() == null) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		URI uri = URI.create(params.getUri());
		return withTemplate("getResourceGraph", uri, template -> {
			List<ResourceGraphNode> roots = new ArrayList<>();
			for (TemplateScope scope : template.getAllScopes()) {
				for (ResourceInfo info : template.getResourceGraph(scope)) {
					if (info.getParent() == null) {
						roots.add(toResourceGraphNode(template, info));
					}
				}
			}
			return CompletableFuture.completedFuture(roots);
		}, Collections.emptyList());
	}

	private static ResourceGraphNode toResourceGraphNode(DeploymentTemplate template, ResourceInfo info) {
		ResourceGraphNode node = new ResourceGraphNode();
		node.setLabel(info.getFriendlyLabel());
		node.setNameExpression(info.getFullNameExpression());
		node.setTypeExpression(info.getFullTypeExpression());
		node.setResourceIdExpression(info.getResourceIdExpression());
		node.setDecoupledChild(info.isDecoupledChild());
		node.setRange(ArmLanguageServerUtils.spanToRange(template.getText(), info.getResourceObject().getSpan()));
		List<ResourceGraphNode> children = new ArrayList<>();
		for (ResourceInfo child : info.getChildren()) {
			children.add(toResourceGraphNode(template, child));
		}
		node.setChildren(children);
		return node;
	}

	private <T> CompletableFuture<T> withTemplate(String requestName, URI uri,
			Function<DeploymentTemplate, CompletableFuture<T>> requestCall, T fallbackValue) {
		MdcDocumentContext.setDocument(uri);
		try {
			return requestGuard.failSoftRequest(requestName, uri, () -> {
				DeploymentTemplate template = getTemplate(uri);
				if (template == null) {
					logger.debug("{} requested for a document that is not open", requestName);
					return CompletableFuture.completedFuture(fallbackValue);
				}
				return requestCall.apply(template);
			}, fallbackValue);
		} finally {
			MdcDocumentContext.clear();
		}
	}
}
