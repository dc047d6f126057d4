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

import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentItem;

import com.tomaszrup.lsp.utils.Positions;

/**
 * Helpers shared by the {@code ArmTemplateServices*Tests} classes.
 */
public final class TestTemplateHelper {
    public static final String LANGUAGE_ARM_TEMPLATE = "arm-template";
    public static final String URI_TEMPLATE = "file:///templates/azuredeploy.json";

    private TestTemplateHelper() {
    }

    public static void open(ArmTemplateServices services, String uri, String text) {
        TextDocumentItem textDocumentItem = new TextDocumentItem(uri, LANGUAGE_ARM_TEMPLATE, 1, text);
        services.didOpen(new DidOpenTextDocumentParams(textDocumentItem));
    }

    /**
     * Position of the first occurrence of {@code needle} in {@code text},
     * moved by {@code delta} characters.
     *
     * @throws IllegalArgumentException when {@code needle} does not occur
     */
    public static Position positionOf(String text, String needle, int delta) {
        int index = text.indexOf(needle);
        if (index < 0) {
            throw new IllegalArgumentException("Text does not contain " + needle);
        }
        return Positions.getPosition(text, index + delta);
    }

    /**
     * A template with a parameter used twice and a variable used once, and two
     * resources of which the second depends on the first.
     */
    public static String sampleTemplate() {
        StringBuilder contents = new StringBuilder();
        contents.append("{\n");
        contents.append("  \"parameters\": {\n");
        contents.append("    \"sku\": { \"type\": \"string\", \"defaultValue\": \"Standard\",");
        contents.append(" \"metadata\": { \"description\": \"Plan SKU\" } }\n");
        contents.append("  },\n");
        contents.append("  \"variables\": {\n");
        contents.append("    \"prefix\": \"[concat('app-', parameters('sku'))]\"\n");
        contents.append("  },\n");
        contents.append("  \"resources\": [\n");
        contents.append("    { \"type\": \"Microsoft.Web/serverfarms\", \"name\": \"plan\" },\n");
        contents.append("    { \"type\": \"Microsoft.Web/sites\", \"name\": \"[variables('prefix')]\",\n");
        contents.append("      \"dependsOn\": [ \"[resourceId('Microsoft.Web/serverfarms', 'plan')]\" ] }\n");
        contents.append("  ],\n");
        contents.append("  \"outputs\": { \"o\": { \"type\": \"string\", \"value\": \"[parameters('sku')]\" } }\n");
        contents.append("}");
        return contents.toString();
    }
}
