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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;

import com.tomaszrup.armls.functions.BuiltinFunctions;
import com.tomaszrup.armls.json.StringValue;
import com.tomaszrup.armls.position.ReferenceSite;
import com.tomaszrup.armls.position.TemplatePositionContext;
import com.tomaszrup.armls.template.DeploymentTemplate;
import com.tomaszrup.armls.util.ArmLanguageServerUtils;

public class DefinitionProvider {
	private final DeploymentTemplate template;
	private final BuiltinFunctions builtinFunctions;

	public DefinitionProvider(DeploymentTemplate template, BuiltinFunctions builtinFunctions) {
		this.template = template;
		this.builtinFunctions = builtinFunctions;
	}

	/**
	 * The name of the parameter, variable, namespace or user function
	 * referenced at the position. Built-in functions have no location.
	 */
	public CompletableFuture<List<? extends Location>> provideDefinition(Position position) {
		TemplatePositionContext positionContext = ArmLanguageServerUtils.createPositionContext(template,
				builtinFunctions, position);
		if (positionContext == null) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		ReferenceSite site = positionContext.getReferenceSite(false);
		if (site == null) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		StringValue nameValue = site.getDefinition().getNameValue();
		if (nameValue == null) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		Location location = ArmLanguageServerUtils.spanToLocation(template.getUri(), template.getText(),
				nameValue.getUnquotedSpan());
		return CompletableFuture.completedFuture(Collections.singletonList(location));
	}
}
