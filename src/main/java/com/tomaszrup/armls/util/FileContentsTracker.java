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
package com.tomaszrup.armls.util;

import java.net.URI;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;

/**
 * Thread-safe tracker for the text and version of the templates open in the
 * editor.
 *
 * <p>Only open documents are tracked: a template that is not open has no
 * contents here, and requests for it yield empty results.</p>
 */
public class FileContentsTracker {
	private static final Logger logger = LoggerFactory.getLogger(FileContentsTracker.class);

	private static final class OpenDocument {
		final String text;
		final Integer version;

		OpenDocument(String text, Integer version) {
			this.text = text;
			this.version = version;
		}
	}

	private final ConcurrentHashMap<URI, OpenDocument> openDocuments = new ConcurrentHashMap<>();

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openDocuments.put(uri, new OpenDocument(params.getTextDocument().getText(),
				params.getTextDocument().getVersion()));
	}

	/**
	 * Applies the content changes in order, atomically with respect to other
	 * notifications for the same document. A change without a range replaces
	 * the whole text.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		Integer version = params.getTextDocument().getVersion();
		openDocuments.compute(uri, (key, current) -> {
			String text = current != null ? current.text : null;
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				text = applyChange(key, text, change);
			}
			return new OpenDocument(text, version);
		});
	}

	private static String applyChange(URI uri, String text, TextDocumentContentChangeEvent change) {
		Range range = change.getRange();
		if (text == null || range == null) {
			return change.getText();
		}
		int start = Positions.getOffset(text, range.getStart());
		int end = Positions.getOffset(text, range.getEnd());
		if (start < 0 || end < start) {
			// out of sync with the client
			logger.warn("Invalid change range {} for {}, replacing the whole document", range,
					MdcDocumentContext.getLabel(uri));
			return change.getText();
		}
		return text.substring(0, start) + change.getText() + text.substring(end);
	}

	public void didClose(DidCloseTextDocumentParams params) {
		openDocuments.remove(URI.create(params.getTextDocument().getUri()));
	}

	/** The text of an open document, or {@code null}. */
	public String getContents(URI uri) {
		OpenDocument document = openDocuments.get(uri);
		return document != null ? document.text : null;
	}

	/** The client's version of an open document, or {@code null} when unknown. */
	public Integer getVersion(URI uri) {
		OpenDocument document = openDocuments.get(uri);
		return document != null ? document.version : null;
	}
}
