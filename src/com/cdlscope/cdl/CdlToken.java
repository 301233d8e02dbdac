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

/**
 * One logical line of a CDL file: continuation lines joined, inline comment
 * removed, classified.
 */
public final class CdlToken {

    private final int lineNumber;

    private final CdlLineType type;

    private final String content;

    private final String raw;

    /**
     * @param lineNumber 1-indexed number of the first physical line of the group
     * @param type Classification of the line
     * @param content Cleaned text used by the parsers
     * @param raw Original physical lines joined with '\n', for error reporting
     */
    public CdlToken(int lineNumber, CdlLineType type, String content, String raw) {
        this.lineNumber = lineNumber;
        this.type = Objects.requireNonNull(type);
        this.content = Objects.requireNonNull(content);
        this.raw = Objects.requireNonNull(raw);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public CdlLineType getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public String getRaw() {
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CdlToken)) return false;
        CdlToken that = (CdlToken) o;
        return lineNumber == that.lineNumber && type == that.type
                && content.equals(that.content) && raw.equals(that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, type, content, raw);
    }

    @Override
    public String toString() {
        return lineNumber + ":" + type + ":" + content;
    }
}
