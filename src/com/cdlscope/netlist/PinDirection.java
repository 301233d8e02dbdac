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

/**
 * Signal direction of a pin or a top-level port.
 */
public enum PinDirection {
    INPUT,
    OUTPUT,
    INOUT;

    /**
     * Looks up a direction by name, case-insensitively. BIDIR is accepted as an
     * alias of INOUT.
     * @param s The direction name
     * @return The matching direction
     * @throws IllegalArgumentException if s names no direction
     */
    public static PinDirection getEnum(String s) {
        s = s.toUpperCase();
        if (s.equals("BIDIR")) return INOUT;
        return valueOf(s);
    }

    /**
     * @return True for INPUT and INOUT, the directions a fanin query expands
     */
    public boolean isInput() {
        return this != OUTPUT;
    }

    /**
     * @return True for OUTPUT and INOUT, the directions a fanout query expands
     */
    public boolean isOutput() {
        return this != INPUT;
    }
}
