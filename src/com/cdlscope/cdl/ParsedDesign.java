/*
 * Copyright (c) 2026, CDLScope Authors.
 * All rights reserved.
 *
 * This file is part of CDLScope.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.cdlscope.cdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Everything read from one CDL file: the subcircuit definitions, the instances
 * keyed by name, the normalized nets keyed by their original name and the
 * issues that did not stop the parse.
 */
public class ParsedDesign {

    private final String name;

    private final Map<String, SubcircuitDefinition> subcircuits;

    private final Map<String, CellInstance> instances;

    private final Map<String, NetInfo> nets;

    private final List<ParseIssue> issues;

    public ParsedDesign(String name, Map<String, SubcircuitDefinition> subcircuits,
            Map<String, CellInstance> instances, Map<String, NetInfo> nets, List<ParseIssue> issues) {
        this.name = name;
        this.subcircuits = Collections.unmodifiableMap(new LinkedHashMap<>(subcircuits));
        this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
        this.nets = Collections.unmodifiableMap(new LinkedHashMap<>(nets));
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    /**
     * @return The design name, the base name of the parsed file
     */
    public String getName() {
        return name;
    }

    public Map<String, SubcircuitDefinition> getSubcircuits() {
        return subcircuits;
    }

    public Map<String, CellInstance> getInstances() {
        return instances;
    }

    /**
     * @return Normalized net information keyed by the original net name
     */
    public Map<String, NetInfo> getNets() {
        return nets;
    }

    public List<ParseIssue> getIssues() {
        return issues;
    }

    public List<ParseIssue> getWarnings() {
        List<ParseIssue> warnings = new ArrayList<>();
        for (ParseIssue issue : issues) {
            if (!issue.isError()) warnings.add(issue);
        }
        return warnings;
    }

    @Nullable
    public SubcircuitDefinition getSubcircuitDefinition(String cellType) {
        return subcircuits.get(cellType);
    }

    @Nullable
    public CellInstance getInstance(String instanceName) {
        return instances.get(instanceName);
    }

    public List<CellInstance> getInstancesByType(String cellType) {
        List<CellInstance> result = new ArrayList<>();
        for (CellInstance inst : instances.values()) {
            if (inst.getCellType().equals(cellType)) result.add(inst);
        }
        return result;
    }

    /**
     * @param originalName A net name as written in the file
     * @return Its normalization, or null if no instance uses that name
     */
    @Nullable
    public NetInfo getNet(String originalName) {
        return nets.get(originalName);
    }

    public List<NetInfo> getNetsByType(NetType type) {
        List<NetInfo> result = new ArrayList<>();
        for (NetInfo net : nets.values()) {
            if (net.getType() == type) result.add(net);
        }
        return result;
    }

    public int getSubcircuitCount() {
        return subcircuits.size();
    }

    public int getInstanceCount() {
        return instances.size();
    }

    public int getNetCount() {
        return nets.size();
    }

    @Override
    public String toString() {
        return "ParsedDesign(" + name + ", subcircuits=" + subcircuits.size() + ", instances="
                + instances.size() + ", nets=" + nets.size() + ")";
    }
}
