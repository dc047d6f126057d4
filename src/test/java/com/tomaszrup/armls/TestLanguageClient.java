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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.armls;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.eclipse.lsp4j.MessageActionItem;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.ShowMessageRequestParams;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * {@link LanguageClient} for tests. Published diagnostics are recorded in
 * order and can also be forwarded to a callback.
 *
 * <pre>{@code
 * TestLanguageClient client = new TestLanguageClient();
 * services.connect(client);
 * services.didOpen(...);
 * PublishDiagnosticsParams last = client.getLastDiagnostics();
 * }</pre>
 */
public class TestLanguageClient implements LanguageClient {

    private final Consumer<PublishDiagnosticsParams> diagnosticsConsumer;
    private final List<PublishDiagnosticsParams> publishedDiagnostics =
            Collections.synchronizedList(new ArrayList<>());

    public TestLanguageClient() {
        this(null);
    }

    /**
     * @param diagnosticsConsumer invoked on each {@code publishDiagnostics}
     *                            notification, or {@code null}
     */
    public TestLanguageClient(Consumer<PublishDiagnosticsParams> diagnosticsConsumer) {
        this.diagnosticsConsumer = diagnosticsConsumer;
    }

    public List<PublishDiagnosticsParams> getPublishedDiagnostics() {
        return publishedDiagnostics;
    }

    /** The most recent notification, or {@code null} when there was none. */
    public PublishDiagnosticsParams getLastDiagnostics() {
        synchronized (publishedDiagnostics) {
            return publishedDiagnostics.isEmpty() ? null
                    : publishedDiagnostics.get(publishedDiagnostics.size() - 1);
        }
    }

    @Override
    public void telemetryEvent(Object object) {
    }

    @Override
    public CompletableFuture<MessageActionItem> showMessageRequest(ShowMessageRequestParams requestParams) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void showMessage(MessageParams messageParams) {
    }

    @Override
    public void publishDiagnostics(PublishDiagnosticsParams diagnostics) {
        publishedDiagnostics.add(diagnostics);
        if (diagnosticsConsumer != null) {
            diagnosticsConsumer.accept(diagnostics);
        }
    }

    @Override
    public void logMessage(MessageParams message) {
    }
}
