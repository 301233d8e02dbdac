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
 * Identifies one pin of one cell, by convention {@code <cell>.<pin>}.
 */
public final class PinId extends NetlistId {

    public static final char SEPARATOR = '.';

    public PinId(String value) {
        super(value);
    }

    public static PinId of(String cellName, String pinName) {
        return new PinId(cellName + SEPARATOR + pinName);
    }

    @Override
    public NetlistObjectType getType() {
        return NetlistObjectType.PIN;
    }
}
