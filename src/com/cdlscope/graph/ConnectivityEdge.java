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

import org.jgrapht.graph.DefaultEdge;

/**
 * A typed edge of the connectivity graph. Edges compare by identity, so the
 * same pair of nodes may be joined by several edges.
 */
public class ConnectivityEdge extends DefaultEdge {

    private static final long serialVersionUID = -2417633861955096732L;

    private final EdgeType type;

    public ConnectivityEdge(EdgeType type) {
        this.type = type;
    }

    public EdgeType getType() {
        return type;
    }

    @Override
    public String toString() {
        return getSource() + " -" + type + "-> " + getTarget();
    }
}
