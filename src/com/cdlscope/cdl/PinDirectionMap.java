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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cdlscope.netlist.PinDirection;

/**
 * Pin name to direction lookup read from a .pindir file. Pins that are not
 * listed are treated as {@link PinDirection#INOUT}.
 */
public class PinDirectionMap {

    public static final PinDirection DEFAULT_DIRECTION = PinDirection.INOUT;

    private final Map<String, PinDirection> directions;

    public PinDirectionMap(Map<String, PinDirection> directions) {
        this.directions = Collections.unmodifiableMap(new LinkedHashMap<>(directions));
    }

    public static PinDirectionMap empty() {
        return new PinDirectionMap(Collections.emptyMap());
    }

    /**
     * @param pinName A pin (port) name, case-sensitive
     * @return Its direction, INOUT when unlisted
     */
    public PinDirection getDirection(String pinName) {
        return directions.getOrDefault(pinName, DEFAULT_DIRECTION);
    }

    public boolean hasPin(String pinName) {
        return directions.containsKey(pinName);
    }

    public Map<String, PinDirection> getAll() {
        return new LinkedHashMap<>(directions);
    }

    public List<String> getPinsByDirection(PinDirection dir) {
        List<String> pins = new ArrayList<>();
        for (Map.Entry<String, PinDirection> e : directions.entrySet()) {
            if (e.getValue() == dir) pins.add(e.getKey());
        }
        return pins;
    }

    public int size() {
        return directions.size();
    }
}
