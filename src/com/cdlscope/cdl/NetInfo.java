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

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Result of normalizing one net name. Immutable, so the normalizer shares one
 * instance between all callers asking about the same name.
 */
public final class NetInfo {

    private final String originalName;

    private final String normalizedName;

    private final NetType type;

    private final boolean bus;

    private final Integer busIndex;

    public NetInfo(String originalName, String normalizedName, NetType type, boolean bus,
            @Nullable Integer busIndex) {
        this.originalName = Objects.requireNonNull(originalName);
        this.normalizedName = Objects.requireNonNull(normalizedName);
        this.type = Objects.requireNonNull(type);
        this.bus = bus;
        this.busIndex = busIndex;
    }

    /**
     * @return The name exactly as it appeared in the netlist
     */
    public String getOriginalName() {
        return originalName;
    }

    /**
     * @return The canonical name: trailing '!'/'?' removed, bus bits as base[index]
     */
    public String getNormalizedName() {
        return normalizedName;
    }

    public NetType getType() {
        return type;
    }

    public boolean isBus() {
        return bus;
    }

    /**
     * @return The bus bit index, or null for a scalar net
     */
    @Nullable
    public Integer getBusIndex() {
        return busIndex;
    }

    public boolean isPower() {
        return type == NetType.POWER;
    }

    public boolean isGround() {
        return type == NetType.GROUND;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetInfo)) return false;
        NetInfo that = (NetInfo) o;
        return bus == that.bus && originalName.equals(that.originalName)
                && normalizedName.equals(that.normalizedName) && type == that.type
                && Objects.equals(busIndex, that.busIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(originalName, normalizedName, type, bus, busIndex);
    }

    @Override
    public String toString() {
        return normalizedName + " (" + type + (bus ? ", bit " + busIndex : "") + ")";
    }
}
