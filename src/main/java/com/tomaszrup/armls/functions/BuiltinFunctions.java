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
package com.tomaszrup.armls.functions;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Catalogue of the built-in expression functions, read from an
 * {@code ExpressionMetadata.json} file:
 *
 * <pre>
 * {"functionSignatures": [
 *     {"name": "resourceId", "expectedUsage": "resourceId(...)", "description": "...",
 *      "minimumArguments": 2, "maximumArguments": 99,
 *      "returnValueMembers": [{"name": "id"}], "behaviors": ["usesResourceIdCompletions"]}
 * ]}
 * </pre>
 *
 * <p>A file that cannot be read or parsed yields an empty catalogue and a
 * warning; it never stops the server.</p>
 */
public class BuiltinFunctions {

    private static final Logger logger = LoggerFactory.getLogger(BuiltinFunctions.class);

    /** Classpath location of the catalogue bundled with the server. */
    public static final String BUNDLED_METADATA_RESOURCE = "/ExpressionMetadata.json";

    private static final Gson GSON = new Gson();

    private final List<BuiltinFunctionMetadata> functions;
    private final Map<String, BuiltinFunctionMetadata> functionsByLowerCaseName = new HashMap<>();

    public BuiltinFunctions(List<BuiltinFunctionMetadata> functions) {
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        for (BuiltinFunctionMetadata function : this.functions) {
            functionsByLowerCaseName.putIfAbsent(function.getLowerCaseName(), function);
        }
    }

    // ---- Serialized model ----

    static class MetadataContract {
        List<FunctionSignatureContract> functionSignatures;
    }

    static class FunctionSignatureContract {
        String name;
        String expectedUsage;
        String description;
        Integer minimumArguments;
        Integer maximumArguments;
        List<ReturnValueMemberContract> returnValueMembers;
        List<String> behaviors;
    }

    static class ReturnValueMemberContract {
        String name;
    }

    // ---- Loading ----

    /**
     * Loads the catalogue bundled with the server.
     */
    public static BuiltinFunctions loadBundled() {
        try (InputStream stream = BuiltinFunctions.class.getResourceAsStream(BUNDLED_METADATA_RESOURCE)) {
            if (stream == null) {
                logger.warn("Bundled function metadata {} not found", BUNDLED_METADATA_RESOURCE);
                return empty();
            }
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                return fromReader(reader, BUNDLED_METADATA_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to read bundled function metadata: {}", e.getMessage());
            return empty();
        }
    }

    /**
     * Loads a catalogue from a file in {@code ExpressionMetadata.json} format.
     */
    public static BuiltinFunctions load(Path metadataFile) {
        try (Reader reader = Files.newBufferedReader(metadataFile, StandardCharsets.UTF_8)) {
            return fromReader(reader, metadataFile.toString());
        } catch (IOException e) {
            logger.warn("Failed to read function metadata {}: {}", metadataFile, e.getMessage());
            return empty();
        }
    }

    public static BuiltinFunctions fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return empty();
        }
        try {
            return fromContract(GSON.fromJson(json, MetadataContract.class));
        } catch (JsonParseException e) {
            logger.warn("Invalid function metadata: {}", e.getMessage());
            return empty();
        }
    }

    public static BuiltinFunctions empty() {
        return new BuiltinFunctions(Collections.<BuiltinFunctionMetadata>emptyList());
    }

    private static BuiltinFunctions fromReader(Reader reader, String source) {
        try {
            BuiltinFunctions result = fromContract(GSON.fromJson(reader, MetadataContract.class));
            logger.info("Loaded {} built-in function signatures from {}", result.getAll().size(), source);
            return result;
        } catch (JsonParseException e) {
            logger.warn("Invalid function metadata in {}: {}", source, e.getMessage());
            return empty();
        }
    }

    private static BuiltinFunctions fromContract(MetadataContract contract) {
        List<BuiltinFunctionMetadata> result = new ArrayList<>();
        if (contract == null || contract.functionSignatures == null) {
            return new BuiltinFunctions(result);
        }
        for (FunctionSignatureContract signature : contract.functionSignatures) {
            if (signature == null || signature.name == null) {
                continue;
            }
            List<String> members = new ArrayList<>();
            if (signature.returnValueMembers != null) {
                for (ReturnValueMemberContract member : signature.returnValueMembers) {
                    if (member != null && member.name != null) {
                        members.add(member.name);
                    }
                }
            }
            Set<FunctionBehavior> behaviors = EnumSet.noneOf(FunctionBehavior.class);
            if (signature.behaviors != null) {
                for (String behaviorName : signature.behaviors) {
                    FunctionBehavior behavior = FunctionBehavior.fromMetadataName(behaviorName);
                    if (behavior != null) {
                        behaviors.add(behavior);
                    } else {
                        logger.debug("Ignoring unknown behavior {} of function {}", behaviorName, signature.name);
                    }
                }
            }
            result.add(new BuiltinFunctionMetadata(
                    signature.name,
                    signature.expectedUsage,
                    signature.description,
                    signature.minimumArguments != null ? signature.minimumArguments : 0,
                    signature.maximumArguments != null ? signature.maximumArguments : Integer.MAX_VALUE,
                    members,
                    behaviors));
        }
        return new BuiltinFunctions(result);
    }

    // ---- Queries ----

    public List<BuiltinFunctionMetadata> getAll() {
        return functions;
    }

    /**
     * Case-insensitive lookup; {@code null} when there is no such function.
     */
    public BuiltinFunctionMetadata findByName(String name) {
        if (name == null) {
            return null;
        }
        return functionsByLowerCaseName.get(name.toLowerCase(Locale.ROOT));
    }

    public List<BuiltinFunctionMetadata> filterByPrefix(String prefix) {
        String lowerCasePrefix = prefix.toLowerCase(Locale.ROOT);
        List<BuiltinFunctionMetadata> result = new ArrayList<>();
        for (BuiltinFunctionMetadata function : functions) {
            if (function.getLowerCaseName().startsWith(lowerCasePrefix)) {
                result.add(function);
            }
        }
        return result;
    }
}
