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
package com.tomaszrup.armls;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Range;

/**
 * One resource of the {@code armTemplate/getResourceGraph} response, with
 * its child resources nested below it.
 */
public class ResourceGraphNode {

    /** Friendly label, {@code name (type)}. */
    private String label;

    /** Full name as an expression, e.g. {@code concat(parameters('vnet'), '/default')}. */
    private String nameExpression;

    private String typeExpression;

    /** {@code resourceId(...)} expression, or {@code null} when it cannot be built. */
    private String resourceIdExpression;

    /** Whether the parent was inferred from the name and type rather than from nesting. */
    private boolean decoupledChild;

    /** Range of the resource declaration object. */
    private Range range;

    private List<ResourceGraphNode> children = new ArrayList<>();

    public ResourceGraphNode() {
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getNameExpression() {
        return nameExpression;
    }

    public void setNameExpression(String nameExpression) {
        this.nameExpression = nameExpression;
    }

    public String getTypeExpression() {
        return typeExpression;
    }

    public void setTypeExpression(String typeExpression) {
        this.typeExpression = typeExpression;
    }

    public String getResourceIdExpression() {
        return resourceIdExpression;
    }

    public void setResourceIdExpression(String resourceIdExpression) {
        this.resourceIdExpression = resourceIdExpression;
    }

    public boolean isDecoupledChild() {
        return decoupledChild;
    }

    public void setDecoupledChild(boolean decoupledChild) {
        this.decoupledChild = decoupledChild;
    }

    public Range getRange() {
        return range;
    }

    public void setRange(Range range) {
        this.range = range;
    }

    public List<ResourceGraphNode> getChildren() {
        return children;
    }

    public void setChildren(List<ResourceGraphNode> children) {
        this.children = children;
    }
}
