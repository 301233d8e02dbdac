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

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.Nullable;
import org.jgrapht.graph.DirectedMultigraph;

import com.cdlscope.netlist.Netlist;
import com.cdlscope.netlist.NetlistId;
import com.cdlscope.netlist.NetlistObjectType;

/**
 * Directed multigraph projection of a {@link Netlist}. Nodes are the ids of
 * cells, pins, nets and ports; they resolve back to netlist objects through
 * {@link #getNetlist()}. The graph is a derived index: rebuild it with
 * {@link ConnectivityGraphBuilder} whenever the netlist changes.
 */
public class ConnectivityGraph extends DirectedMultigraph<NetlistId, ConnectivityEdge> {

    private static final long serialVersionUID = 8370265117640520961L;

    private final transient Netlist netlist;

    public ConnectivityGraph(Netlist netlist) {
        super(ConnectivityEdge.class);
        this.netlist = netlist;
    }

    public Netlist getNetlist() {
        return netlist;
    }

    public ConnectivityEdge addEdge(NetlistId source, NetlistId target, EdgeType type) {
        ConnectivityEdge e = new ConnectivityEdge(type);
        addEdge(source, target, e);
        return e;
    }

    /**
     * @param node A node of this graph
     * @param type The edge type to follow
     * @return Targets of the node's outgoing edges of that type, one entry per edge
     */
    public List<NetlistId> getSuccessors(NetlistId node, EdgeType type) {
        List<NetlistId> result = new ArrayList<>();
        if (!containsVertex(node)) return result;
        for (ConnectivityEdge e : outgoingEdgesOf(node)) {
            if (e.getType() == type) result.add(getEdgeTarget(e));
        }
        return result;
    }

    /**
     * @param node A node of this graph
     * @param type The edge type to follow
     * @return Sources of the node's incoming edges of that type, one entry per edge
     */
    public List<NetlistId> getPredecessors(NetlistId node, EdgeType type) {
        List<NetlistId> result = new ArrayList<>();
        if (!containsVertex(node)) return result;
        for (ConnectivityEdge e : incomingEdgesOf(node)) {
            if (e.getType() == type) result.add(getEdgeSource(e));
        }
        return result;
    }

    @Nullable
    public NetlistObjectType getObjectType(NetlistId node) {
        return containsVertex(node) ? node.getType() : null;
    }

    public int getNodeCount() {
        return vertexSet().size();
    }

    public int getEdgeCount() {
        return edgeSet().size();
    }

    public int getNodeCount(NetlistObjectType type) {
        int count = 0;
        for (NetlistId id : vertexSet()) {
            if (id.getType() == type) count++;
        }
        return count;
    }

    public int getCellNodeCount() {
        return getNodeCount(NetlistObjectType.CELL);
    }

    public int getNetNodeCount() {
        return getNodeCount(NetlistObjectType.NET);
    }
}
