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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Level;

import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.RenameOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.SignatureHelpOptions;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.armls.functions.BuiltinFunctions;

public class ArmLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(ArmLanguageServer.class);

    static final String SERVER_NAME = "ARM Template Language Server";
    static final int DEFAULT_PORT = 5008;

    /** Characters that open a new completion context inside an expression or a dependsOn array. */
    static final List<String> COMPLETION_TRIGGER_CHARACTERS = Arrays.asList("[", "(", ".", "'", ",", "\"", "{");
    static final List<String> SIGNATURE_HELP_TRIGGER_CHARACTERS = Arrays.asList("(", ",");

    public static void main(String[] args) throws IOException {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}",
                        thread.getName(), throwable.getMessage(), throwable));

        // Suppress noisy "Unmatched cancel notification for request id" warnings
        // from LSP4J's RemoteEndpoint.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("{} listening on port {} (localhost only)", SERVER_NAME, port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("{} starting in stdio mode.", SERVER_NAME);
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // Redirect System.out to System.err to avoid corrupting the communication channel
        System.setOut(new PrintStream(System.err));

        ArmLanguageServer server = new ArmLanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final ArmTemplateServices armTemplateServices;

    public ArmLanguageServer() {
        this(BuiltinFunctions.loadBundled());
    }

    public ArmLanguageServer(BuiltinFunctions builtinFunctions) {
        this.armTemplateServices = new ArmTemplateServices(builtinFunctions);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        if (options != null && options.functionMetadataPath != null) {
            BuiltinFunctions functions = BuiltinFunctions.load(options.functionMetadataPath);
            logger.info("Loaded {} functions from {}", functions.getAll().size(), options.functionMetadataPath);
            armTemplateServices.setBuiltinFunctions(functions);
        }

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setCompletionProvider(new CompletionOptions(false, COMPLETION_TRIGGER_CHARACTERS));
        SignatureHelpOptions signatureHelpOptions = new SignatureHelpOptions();
        signatureHelpOptions.setTriggerCharacters(SIGNATURE_HELP_TRIGGER_CHARACTERS);
        serverCapabilities.setSignatureHelpProvider(signatureHelpOptions);
        serverCapabilities.setHoverProvider(true);
        serverCapabilities.setDefinitionProvider(true);
        serverCapabilities.setReferencesProvider(true);
        serverCapabilities.setDocumentHighlightProvider(true);
        RenameOptions renameOptions = new RenameOptions();
        renameOptions.setPrepareProvider(true);
        serverCapabilities.setRenameProvider(renameOptions);

        InitializeResult initializeResult = new InitializeResult(serverCapabilities);
        initializeResult.setServerInfo(new ServerInfo(SERVER_NAME, Protocol.VERSION));
        return CompletableFuture.completedFuture(initializeResult);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    /**
     * Custom LSP request: the resource hierarchy of an open template.
     *
     * @param params a JSON object with a {@code uri} string field
     * @return root resources with their children, or an empty list
     */
    @JsonRequest(Protocol.REQUEST_GET_RESOURCE_GRAPH)
    public CompletableFuture<List<ResourceGraphNode>> getResourceGraph(ResourceGraphParams params) {
        return armTemplateServices.getResourceGraph(params);
    }

    /**
     * Custom LSP request: the version of the custom protocol spoken by this
     * server, so that the extension can detect a mismatch.
     */
    @JsonRequest(Protocol.REQUEST_GET_PROTOCOL_VERSION)
    public CompletableFuture<String> getProtocolVersion() {
        return CompletableFuture.completedFuture(Protocol.VERSION);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return armTemplateServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return armTemplateServices;
    }

    @Override
    public void connect(LanguageClient client) {
        armTemplateServices.connect(client);
    }
}
