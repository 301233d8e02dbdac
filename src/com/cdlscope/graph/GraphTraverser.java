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

import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.cdlscope.netlist.Cell;
import com.cdlscope.netlist.CellId;
import com.cdlscope.netlist.Net;
import com.cdlscope.netlist.NetId;
import com.cdlscope.netlist.Pin;
import com.cdlscope.netlist.PinId;
import com.cdlscope.util.Params;

/**
 * Connectivity queries over a netlist. Unknown ids never cause an exception:
 * they yield an empty list or null.
 */
public interface GraphTraverser {

    /**
     * @param netId A net
     * @return The cells with a pin on the net, each once
     */
    List<Cell> getConnectedCells(NetId netId);

    List<Pin> getCellPins(CellId cellId);

    /**
     * @param pinId A pin
     * @return The net the pin is attached to, or null when it floats
     */
    @Nullable
    Net getPinNet(PinId pinId);

    /**
     * Finds the cells downstream of a cell, expanding only through output pins.
     * @param cellId Starting cell, never part of the result
     * @param hops Number of cell-to-cell steps; zero or less gives an empty list
     * @param stopAtSequential When true, sequential cells are reported but not
     *        expanded
     * @return Reached cells in discovery order
     */
    List<Cell> getFanoutCells(CellId cellId, int hops, boolean stopAtSequential);

    /**
     * Finds the cells upstream of a cell, expanding only through input pins.
     * @see #getFanoutCells(CellId, int, boolean)
     */
    List<Cell> getFaninCells(CellId cellId, int hops, boolean stopAtSequential);

    /**
     * Fanout of the cell that owns the pin. Precision is the whole cell, not just
     * the given pin.
     */
    List<Cell> getFanoutFromPin(PinId pinId, int hops, boolean stopAtSequential);

    /**
     * Fanin of the cell that owns the pin.
     */
    List<Cell> getFaninToPin(PinId pinId, int hops, boolean stopAtSequential);

    /**
     * Finds a shortest path between two cells, ignoring signal direction.
     * @param from First cell of the path
     * @param to Last cell of the path
     * @param maxHops Longest accepted path, in cell-to-cell steps
     * @return The cells on the path, from and to included, or null if the cells
     *         are unknown, unconnected or further apart than maxHops
     */
    @Nullable
    List<Cell> findPath(CellId from, CellId to, int maxHops);

    @Nullable
    default List<Cell> findPath(CellId from, CellId to) {
        return findPath(from, to, Params.CDL_DEFAULT_MAX_PATH_HOPS);
    }
}
