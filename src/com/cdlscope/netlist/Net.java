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
 * A wire joining a set of pins. Immutable.
 */
public final class Net {

    private final NetId id;

    private final String name;

    private final List<PinId> pinIds;

    public Net(NetId id, String name, List<PinId> pinIds) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.pinIds = Collections.unmodifiableList(new ArrayList<>(pinIds));
    }

    public NetId getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<PinId> getPinIds() {
        return pinIds;
    }

    public int getPinCount() {
        return pinIds.size();
    }

    public boolean isMultiFanout() {
        return pinIds.size() > 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Net)) return false;
        Net that = (Net) o;
        return id.equals(that.id) && name.equals(that.name) && pinIds.equals(that.pinIds);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + pinIds.size() + " pins)";
    }
}
