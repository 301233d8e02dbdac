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

package com.cdlscope.netlist;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import com.cdlscope.cdl.CellInstance;
import com.cdlscope.cdl.NetInfo;
import com.cdlscope.cdl.NetNormalizer;
import com.cdlscope.cdl.ParsedDesign;
import com.cdlscope.cdl.PinDirectionMap;
import com.cdlscope.cdl.SubcircuitDefinition;
import com.cdlscope.util.MessageGenerator;
import com.cdlscope.util.Params;

/**
 * Populates a {@link Netlist} from a parsed CDL design.
 * <ul>
 * <li>Each instance becomes a cell, with one pin {@code <instance>.<port>} per
 * connection. Pin directions come from a {@link PinDirectionMap}.</li>
 * <li>Each distinct normalized net name becomes a net, so {@code VDD} and
 * {@code VDD!} are the same net.</li>
 * <li>The ports of the top cell become design ports. The top cell is the last
 * definition that no instance instantiates.</li>
 * </ul>
 */
public class NetlistBuilder {

    private PinDirectionMap pinDirections = PinDirectionMap.empty();

    private SequentialCellConfig sequentialCells = SequentialCellConfig.getDefault();

    private NetNormalizer normalizer = new NetNormalizer();

    private boolean excludeSupplyNets;

    private List<String> violations = new ArrayList<>();

    public NetlistBuilder setPinDirections(PinDirectionMap pinDirections) {
        this.pinDirections = pinDirections;
        return this;
    }

    public NetlistBuilder setSequentialCellConfig(SequentialCellConfig sequentialCells) {
        this.sequentialCells = sequentialCells;
        return this;
    }

    /**
     * @param normalizer Normalizer for top-level port names that no instance uses
     */
    public NetlistBuilder setNetNormalizer(NetNormalizer normalizer) {
        this.normalizer = normalizer;
        return this;
    }

    /**
     * When set, pins and ports on power and ground nets are left floating and
     * those nets are not created, so connectivity queries do not spread through
     * the supply network.
     */
    public NetlistBuilder setExcludeSupplyNets(boolean excludeSupplyNets) {
        this.excludeSupplyNets = excludeSupplyNets;
        return this;
    }

    public Netlist build(ParsedDesign design) {
        Netlist netlist = new Netlist(design.getName());
        Map<String, List<PinId>> netPins = new LinkedHashMap<>();

        for (CellInstance inst : design.getInstances().values()) {
            List<PinId> pinIds = new ArrayList<>(inst.getConnections().size());
            for (Map.Entry<String, String> e : inst.getConnections().entrySet()) {
                String port = e.getKey();
                PinId pinId = PinId.of(inst.getName(), port);
                String netName = resolveNetName(design, e.getValue());
                NetId netId = null;
                if (netName != null) {
                    netId = new NetId(netName);
                    netPins.computeIfAbsent(netName, k -> new ArrayList<>()).add(pinId);
                }
                netlist.addPin(new Pin(pinId, port, pinDirections.getDirection(port), netId));
                pinIds.add(pinId);
            }
            netlist.addCell(new Cell(new CellId(inst.getName()), inst.getName(), inst.getCellType(), pinIds,
                    sequentialCells.isSequential(inst.getCellType())));
        }

        SubcircuitDefinition top = findTopCell(design);
        if (top != null) {
            for (String portName : top.getPorts()) {
                String netName = resolveNetName(design, portName);
                NetId netId = null;
                if (netName != null) {
                    netId = new NetId(netName);
                    netPins.computeIfAbsent(netName, k -> new ArrayList<>());
                }
                netlist.addPort(new Port(new PortId(portName), portName, pinDirections.getDirection(portName),
                        netId));
            }
        }

        for (Map.Entry<String, List<PinId>> e : netPins.entrySet()) {
            netlist.addNet(new Net(new NetId(e.getKey()), e.getKey(), e.getValue()));
        }

        violations = netlist.validate();
        if (Params.CDL_VERBOSE && !violations.isEmpty()) {
            MessageGenerator.warnings(violations);
        }
        return netlist;
    }

    /**
     * @return The normalized net name, or null when the net is a supply net that
     *         is being excluded
     */
    @Nullable
    private String resolveNetName(ParsedDesign design, String originalName) {
        NetInfo info = design.getNet(originalName);
        if (info == null) {
            info = normalizer.normalize(originalName);
        }
        if (excludeSupplyNets && info.getType().isSupply()) {
            return null;
        }
        return info.getNormalizedName();
    }

    /**
     * @param design A parsed design
     * @return The last definition in file order that is never instantiated, or
     *         null if every definition is instantiated
     */
    @Nullable
    public static SubcircuitDefinition findTopCell(ParsedDesign design) {
        Set<String> used = new HashSet<>();
        for (CellInstance inst : design.getInstances().values()) {
            used.add(inst.getCellType());
        }
        SubcircuitDefinition top = null;
        for (SubcircuitDefinition def : design.getSubcircuits().values()) {
            if (!used.contains(def.getName())) {
                top = def;
            }
        }
        return top;
    }

    /**
     * @return Referential integrity problems found by the last {@link #build}
     */
    public List<String> getViolations() {
        return new ArrayList<>(violations);
    }
}
