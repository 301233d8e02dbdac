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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An instance of a cell type in the netlist. Immutable.
 */
public final class Cell {

    private final CellId id;

    private final String name;

    private final String cellType;

    private final List<PinId> pinIds;

    private final boolean sequential;

    public Cell(CellId id, String name, String cellType, List<PinId> pinIds, boolean sequential) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.cellType = Objects.requireNonNull(cellType);
        this.pinIds = Collections.unmodifiableList(new ArrayList<>(pinIds));
        this.sequential = sequential;
    }

    public CellId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCellType() {
        return cellType;
    }

    public List<PinId> getPinIds() {
        return pinIds;
    }

    public int getPinCount() {
        return pinIds.size();
    }

    /**
     * @return True for flip-flops and latches, which bound fanout/fanin queries
     */
    public boolean isSequential() {
        return sequential;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell)) return false;
        Cell that = (Cell) o;
        return sequential == that.sequential && id.equals(that.id) && name.equals(that.name)
                && cellType.equals(that.cellType) && pinIds.equals(that.pinIds);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + cellType + ")" + (sequential ? " [sequential]" : "");
    }
}
