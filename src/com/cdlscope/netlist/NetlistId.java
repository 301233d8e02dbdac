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

/**
 * Base of the string backed identifiers. Identifiers of different kinds never
 * compare equal, even when they wrap the same string, so a net id cannot be
 * used to look up a cell by accident.
 */
public abstract class NetlistId implements Comparable<NetlistId> {

    private final String value;

    protected NetlistId(String value) {
        Objects.requireNonNull(value, "id value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " cannot be empty");
        }
        this.value = value;
    }

    public abstract NetlistObjectType getType();

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return value.equals(((NetlistId) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * getType().hashCode() + value.hashCode();
    }

    @Override
    public int compareTo(NetlistId o) {
        int c = getType().compareTo(o.getType());
        return c != 0 ? c : value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
