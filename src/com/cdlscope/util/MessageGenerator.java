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

import java.util.List;

/**
 * Common class for generating user-facing messages.
 */
public class MessageGenerator {

    private static final int HEADER_WIDTH = 72;

    /**
     * Sends a message to std.out.
     * @param msg The message to print to standard out
     */
    public static void briefMessage(String msg) {
        System.out.println(msg);
    }

    /**
     * Sends an error message to std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Sends a message prefixed with "WARNING: " to std.err.
     * @param msg The warning text
     */
    public static void warning(String msg) {
        briefError("WARNING: " + msg);
    }

    /**
     * Prints each entry of the list as a warning.
     * @param msgs The warnings to print, in order
     */
    public static void warnings(List<String> msgs) {
        for (String msg : msgs) {
            warning(msg);
        }
    }

    /**
     * Prints a centered, framed header line to std.out.
     * @param s The header text
     */
    public static void printHeader(String s) {
        String bar = "==============================================================================";
        double whiteSpace = (HEADER_WIDTH - s.length()) / 2.0;
        String left = makeWhiteSpace((int) whiteSpace);
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        System.out.println(bar);
        System.out.println("== " + left + s + right + " ==");
        System.out.println(bar);
    }

    /**
     * Creates a string of spaces.
     * @param length Number of spaces, negative values yield an empty string
     * @return The whitespace string
     */
    public static String makeWhiteSpace(int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
