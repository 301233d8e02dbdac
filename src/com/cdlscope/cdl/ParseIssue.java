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
 * A problem found while parsing, tagged with its source line.
 */
public final class ParseIssue {

    public enum Severity {
        /** Aborts the parse once every line has been processed */
        ERROR,
        /** Reported, the parse continues with best effort data */
        WARNING
    }

    private final int lineNumber;

    private final String message;

    private final Severity severity;

    /**
     * @param lineNumber Source line, or {@link CdlParseException#NO_LINE}
     * @param message Description of the problem
     * @param severity How the problem affects the parse
     */
    public ParseIssue(int lineNumber, String message, Severity severity) {
        this.lineNumber = lineNumber;
        this.message = Objects.requireNonNull(message);
        this.severity = Objects.requireNonNull(severity);
    }

    public static ParseIssue error(int lineNumber, String message) {
        return new ParseIssue(lineNumber, message, Severity.ERROR);
    }

    public static ParseIssue warning(String message) {
        return new ParseIssue(CdlParseException.NO_LINE, message, Severity.WARNING);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseIssue)) return false;
        ParseIssue that = (ParseIssue) o;
        return lineNumber == that.lineNumber && message.equals(that.message) && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, message, severity);
    }

    /**
     * @return "Line N: message", or just the message when no line applies
     */
    @Override
    public String toString() {
        return lineNumber > 0 ? "Line " + lineNumber + ": " + message : message;
    }
}
