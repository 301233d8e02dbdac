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

package com.cdlscope.util;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Deduplicates net and port name strings while a netlist is being read. Large
 * designs reference the same few thousand net names from hundreds of thousands
 * of instance lines, so sharing one String per distinct name keeps memory flat.
 *
 * Not thread safe, one pool per parse.
 */
public class NamePool {

    private final Map<String, String> pool;

    public NamePool() {
        this.pool = new HashMap<>();
    }

    /**
     * Returns the pooled instance equal to the given name, adding it if unseen.
     * @param name The name to pool
     * @return The canonical String instance for name
     */
    public String intern(String name) {
        return pool.computeIfAbsent(name, Function.identity());
    }

    /**
     * @return Number of distinct names pooled so far
     */
    public int size() {
        return pool.size();
    }

    public void clear() {
        pool.clear();
    }
}
