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

import java.util.List;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.ReferenceContext;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.armls.functions.BuiltinFunctions;

class ArmTemplateServicesReferenceTests {
	private static BuiltinFunctions builtinFunctions;

	private ArmTemplateServices services;
	private String text;

	@BeforeAll
	static void setupAll() {
		builtinFunctions = BuiltinFunctions.loadBundled();
	}

	@BeforeEach
	void setup() {
		services = new ArmTemplateServices(builtinFunctions);
		services.connect(new TestLanguageClient());
		text = TestTemplateHelper.sampleTemplate();
		TestTemplateHelper.open(services, TestTemplateHelper.URI_TEMPLATE, text);
	}

	@AfterEach
	void tearDown() {
		services = null;
		text = null;
	}

	private List<? extends Location> referencesAt(Position position, boolean includeDeclaration) throws Exception {
		TextDocumentIdentifier textDocument = new TextDocumentIdentifier(TestTemplateHelper.URI_TEMPLATE);
		ReferenceParams params = new ReferenceParams(textDocument, position, new ReferenceContext(includeDeclaration));
		return services.references(params).get();
	}

	@Test
	void testParameterReferencesIncludingDeclaration() throws Exception {
		List<? extends Location> locations = referencesAt(TestTemplateHelper.positionOf(text, "\"sku\"", 2), true);

		Assertions.assertEquals(3, locations.size());
		Assertions.assertEquals(TestTemplateHelper.positionOf(text, "\"sku\"", 1), locations.get(0).getRange().getStart());
		for (Location location : locations) {
			Assertions.assertEquals(TestTemplateHelper.URI_TEMPLATE, location.getUri());
		}
	}

	@Test
	void testParameterReferencesWithoutDeclaration() throws Exception {
		List<? extends Location> locations = referencesAt(TestTemplateHelper.positionOf(text, "'sku'", 1), false);
		Assertions.assertEquals(2, locations.size());
		Assertions.assertEquals(TestTemplateHelper.positionOf(text, "'sku'", 1), locations.get(0).getRange().getStart());
	}

	@Test
	void testBuiltinFunctionReferences() throws Exception {
		List<? extends Location> locations = referencesAt(TestTemplateHelper.positionOf(text, "resourceId(", 0), true);
		Assertions.assertEquals(1, locations.size());
	}

	@Test
	void testNoReferencesOnPlainString() throws Exception {
		Assertions.assertTrue(referencesAt(TestTemplateHelper.positionOf(text, "\"plan\"", 2), true).isEmpty());
	}
}
