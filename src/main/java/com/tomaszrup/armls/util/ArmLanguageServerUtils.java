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
package com.tomaszrup.armls.util;

import java.net.URI;

import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.armls.completion.CompletionKind;
import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.language.Issue;
import com.tomaszrup.armls.language.Span;
import com.tomaszrup.armls.position.TemplatePositionContext;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.lsp.utils.Ranges;

public class ArmLanguageServerUtils {
	public static final String DIAGNOSTIC_SOURCE = "arm-template";

	private ArmLanguageServerUtils() {
	}

	public static Range spanToRange(String text, Span span) {
		return Ranges.fromOffsets(text, span.getStartIndex(), span.getAfterEndIndex());
	}

	public static Location spanToLocation(URI uri, String text, Span span) {
		return new Location(uri.toString(), spanToRange(text, span));
	}

	/**
	 * Resolves an LSP position in the template, or returns {@code null} when
	 * the position is not inside the document.
	 */
	public static TemplatePositionContext createPositionContext(DeploymentTemplate template,
			BuiltinFunctions builtinFunctions, Position position) {
		int offset = Positions.getOffset(template.getText(), position);
		if (offset < 0) {
			return null;
		}
		return TemplatePositionContext.fromDocumentCharacterIndex(template, builtinFunctions, offset);
	}

	public static Diagnostic issueToDiagnostic(String text, Issue issue) {
		Diagnostic diagnostic = new Diagnostic();
		diagnostic.setRange(spanToRange(text, issue.getSpan()));
		diagnostic.setMessage(issue.getMessage());
		diagnostic.setSeverity(DiagnosticSeverity.Error);
		diagnostic.setSource(DIAGNOSTIC_SOURCE);
		return diagnostic;
	}

	public static CompletionItemKind completionKindToCompletionItemKind(CompletionKind kind) {
		switch (kind) {
			case FUNCTION:
			case USER_FUNCTION:
				return CompletionItemKind.Function;
			case NAMESPACE:
				return CompletionItemKind.Module;
			case PARAMETER:
			case VARIABLE:
				return CompletionItemKind.Variable;
			case PROPERTY:
				return CompletionItemKind.Property;
			case RESOURCE_ID_TYPE:
				return CompletionItemKind.Class;
			case RESOURCE_ID_NAME:
			case DEPENDS_ON_RESOURCE_ID:
				return CompletionItemKind.Reference;
			case DEPENDS_ON_COPY_LOOP:
				return CompletionItemKind.Snippet;
			default:
				return CompletionItemKind.Text;
		}
	}
}
