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

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * A connection point of a cell. A pin without a net is floating. Immutable.
 */
public final class Pin {

    private final PinId id;

    private final String name;

    private final PinDirection direction;

    private final NetId netId;

    /**
     * @param id Unique pin id, usually {@code <cell>.<pin>}
     * @param name Local pin name, such as "A", shared by pins of other cells
     * @param direction Signal direction
     * @param netId The connected net, or null for a floating pin
     */
    public Pin(PinId id, String name, PinDirection direction, @Nullable NetId netId) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.direction = Objects.requireNonNull(direction);
        this.netId = netId;
    }

    public PinId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PinDirection getDirection() {
        return direction;
    }

    @Nullable
    public NetId getNetId() {
        return netId;
    }

    public boolean isConnected() {
        return netId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pin)) return false;
        Pin that = (Pin) o;
        return id.equals(that.id) && name.equals(that.name) && direction == that.direction
                && Objects.equals(netId, that.netId);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + " (" + direction + ") -> " + (netId == null ? "<floating>" : netId);
    }
}
