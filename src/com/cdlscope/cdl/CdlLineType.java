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

/**
 * Classification of a logical CDL line.
 */
public enum CdlLineType {
    /** .SUBCKT name ports... */
    SUBCKT,
    /** .ENDS [name] */
    ENDS,
    /** X-prefixed cell instance */
    INSTANCE,
    /** M-prefixed transistor */
    TRANSISTOR,
    COMMENT,
    BLANK,
    /** Any other directive, for example .PARAM or .GLOBAL */
    UNKNOWN;

    public static final char INSTANCE_PREFIX = 'X';

    public static final char TRANSISTOR_PREFIX = 'M';

    public static final String SUBCKT_KEYWORD = ".SUBCKT";

    public static final String ENDS_KEYWORD = ".ENDS";

    /**
     * Classifies a logical line (continuations already joined). Keywords and
     * prefixes are matched case-insensitively.
     * @param line The logical line
     * @return The line type
     */
    public static CdlLineType classify(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) return BLANK;
        if (stripped.charAt(0) == '*') return COMMENT;
        String upper = stripped.toUpperCase();
        if (upper.startsWith(SUBCKT_KEYWORD)) return SUBCKT;
        if (upper.startsWith(ENDS_KEYWORD)) return ENDS;
        char first = upper.charAt(0);
        if (first == INSTANCE_PREFIX) return INSTANCE;
        if (first == TRANSISTOR_PREFIX) return TRANSISTOR;
        return UNKNOWN;
    }
}
