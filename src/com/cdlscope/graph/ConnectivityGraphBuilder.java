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

package com.cdlscope.graph;

import com.cdlscope.netlist.Cell;
import com.cdlscope.netlist.Net;
import com.cdlscope.netlist.NetId;
import com.cdlscope.netlist.Netlist;
import com.cdlscope.netlist.Pin;
import com.cdlscope.netlist.PinDirection;
import com.cdlscope.netlist.PinId;
import com.cdlscope.netlist.Port;

/**
 * Projects a {@link Netlist} into a {@link ConnectivityGraph}.
 *
 * Signal flow edges follow the pin and port directions: an OUTPUT pin drives its
 * net, a net drives its INPUT and INOUT pins; an INPUT or INOUT port drives its
 * net, a net drives its OUTPUT ports. Floating pins and ports get no signal flow
 * edge, and references to objects missing from the netlist are skipped.
 */
public class ConnectivityGraphBuilder {

    private ConnectivityGraph graph;

    /**
     * Builds a new graph for the netlist, discarding the one built before.
     * @param netlist The netlist to project
     * @return The new graph
     */
    public ConnectivityGraph build(Netlist netlist) {
        graph = new ConnectivityGraph(netlist);

        for (Cell cell : netlist.getAllCells()) {
            graph.addVertex(cell.getId());
        }
        for (Pin pin : netlist.getAllPins()) {
            graph.addVertex(pin.getId());
        }
        for (Net net : netlist.getAllNets()) {
            graph.addVertex(net.getId());
        }
        for (Port port : netlist.getAllPorts()) {
            graph.addVertex(port.getId());
        }

        for (Cell cell : netlist.getAllCells()) {
            for (PinId pinId : cell.getPinIds()) {
                if (graph.containsVertex(pinId)) {
                    graph.addEdge(cell.getId(), pinId, EdgeType.CONTAINS_PIN);
                }
            }
        }

        for (Pin pin : netlist.getAllPins()) {
            NetId netId = pin.getNetId();
            if (netId == null || !graph.containsVertex(netId)) continue;
            if (pin.getDirection() == PinDirection.OUTPUT) {
                graph.addEdge(pin.getId(), netId, EdgeType.DRIVES);
            } else {
                // INOUT pins are receivers
                graph.addEdge(netId, pin.getId(), EdgeType.DRIVES);
            }
        }

        for (Port port : netlist.getAllPorts()) {
            NetId netId = port.getNetId();
            if (netId == null || !graph.containsVertex(netId)) continue;
            if (port.getDirection() == PinDirection.OUTPUT) {
                graph.addEdge(netId, port.getId(), EdgeType.DRIVES);
            } else {
                // INOUT ports are drivers
                graph.addEdge(port.getId(), netId, EdgeType.DRIVES);
            }
        }
        return graph;
    }

    /**
     * @return The graph from the last {@link #build(Netlist)}, or null before the
     *         first build
     */
    public ConnectivityGraph getGraph() {
        return graph;
    }
}
