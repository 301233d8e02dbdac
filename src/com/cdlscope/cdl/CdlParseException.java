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
 * Thrown when CDL (or companion pin direction) text cannot be parsed. Carries
 * the source line number, or {@link #NO_LINE} when the problem is not tied to a
 * single line. The message is prefixed with "Line N: " when the line is known;
 * {@link #getDetail()} gives the text without it.
 */
public class CdlParseException extends RuntimeException {

    public static final int NO_LINE = -1;

    private final int lineNumber;

    private final String detail;

    public CdlParseException(String message) {
        this(NO_LINE, message);
    }

    public CdlParseException(int lineNumber, String message) {
        super(withLine(lineNumber, message));
        this.lineNumber = lineNumber;
        this.detail = message;
    }

    public CdlParseException(int lineNumber, String message, Throwable cause) {
        super(withLine(lineNumber, message), cause);
        this.lineNumber = lineNumber;
        this.detail = message;
    }

    private static String withLine(int lineNumber, String message) {
        return lineNumber > 0 ? "Line " + lineNumber + ": " + message : message;
    }

    /**
     * @return The 1-indexed source line, or {@link #NO_LINE}
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return The message without the line number prefix
     */
    public String getDetail() {
        return detail;
    }
}
