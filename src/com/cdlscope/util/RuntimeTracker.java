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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Records the elapsed time of a named step, with optional child steps. Used by
 * the CDL parser to report per-pass timing when {@link Params#CDL_VERBOSE} is set.
 */
public class RuntimeTracker {

    private static final int NAME_COLUMN_WIDTH = 30;

    private final String name;
    private long time;
    private long start;
    private final List<RuntimeTracker> children;

    public RuntimeTracker(String name) {
        this.name = name;
        this.time = 0;
        this.children = new ArrayList<>();
    }

    public void start() {
        this.start = System.nanoTime();
    }

    /**
     * Stops the tracker and adds the time since the last {@link #start()} to the
     * total.
     */
    public void stop() {
        this.time += System.nanoTime() - this.start;
    }

    /**
     * Creates, registers and starts a child tracker.
     * @param childName Name of the child step
     * @return The running child tracker
     */
    public RuntimeTracker startChild(String childName) {
        RuntimeTracker child = new RuntimeTracker(childName);
        children.add(child);
        child.start();
        return child;
    }

    /**
     * @return The total time elapsed in nanoseconds
     */
    public long getTime() {
        return time;
    }

    public String getName() {
        return name;
    }

    public List<RuntimeTracker> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        int pad = NAME_COLUMN_WIDTH - name.length();
        return name + ":" + MessageGenerator.makeWhiteSpace(pad) + String.format("%9.3fs", time * 1e-9);
    }

    /**
     * @return This tracker and all of its descendants, one per line, drawn as a tree
     */
    public String toTreeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, "", "");
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, String prefix, String childPrefix) {
        sb.append(prefix).append(this).append('\n');
        for (Iterator<RuntimeTracker> it = children.iterator(); it.hasNext();) {
            RuntimeTracker next = it.next();
            if (it.hasNext()) {
                next.appendTree(sb, childPrefix + "\u251c\u2500 ", childPrefix + "\u2502  ");
            } else {
                next.appendTree(sb, childPrefix + "\u2514\u2500 ", childPrefix + "   ");
            }
        }
    }
}
