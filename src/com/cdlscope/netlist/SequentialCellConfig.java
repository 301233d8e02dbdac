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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.cdlscope.util.FileTools;
import com.cdlscope.util.MessageGenerator;

/**
 * Decides which cell types are sequential (flip-flops, latches) from wildcard
 * patterns on the cell type name, where '*' matches any run of characters.
 * Configuration files look like:
 *
 * <pre>
 * {"sequential_cells": {"patterns": ["*DFF*", "*LATCH*"], "case_sensitive": false}}
 * </pre>
 */
public class SequentialCellConfig {

    public static final List<String> DEFAULT_PATTERNS =
            Collections.unmodifiableList(Arrays.asList("*DFF*", "*LATCH*", "*FF*"));

    private static final String SECTION_KEY = "sequential_cells";
    private static final String PATTERNS_KEY = "patterns";
    private static final String CASE_SENSITIVE_KEY = "case_sensitive";

    private final List<String> patterns;

    private final boolean caseSensitive;

    private final List<Pattern> regexes;

    public SequentialCellConfig(List<String> patterns, boolean caseSensitive) {
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
        this.caseSensitive = caseSensitive;
        this.regexes = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            regexes.add(Pattern.compile(convertWildcardToRegex(p), caseSensitive ? 0 : Pattern.CASE_INSENSITIVE));
        }
    }

    public static SequentialCellConfig getDefault() {
        return new SequentialCellConfig(DEFAULT_PATTERNS, false);
    }

    /**
     * Reads patterns from a JSON file. A missing or malformed file, a missing
     * section or an empty pattern list yield the default patterns and a warning.
     * @param fileName The configuration file
     * @return The loaded or default configuration
     */
    public static SequentialCellConfig load(Path fileName) {
        JSONObject obj;
        try {
            obj = FileTools.readJSONObject(fileName);
        } catch (JSONException e) {
            MessageGenerator.warning("Invalid sequential cell configuration " + fileName + " ("
                    + e.getMessage() + "), using default patterns.");
            return getDefault();
        }
        if (obj == null) {
            MessageGenerator.warning("Sequential cell configuration " + fileName
                    + " not found, using default patterns.");
            return getDefault();
        }
        JSONObject section = obj.optJSONObject(SECTION_KEY);
        JSONArray arr = section == null ? null : section.optJSONArray(PATTERNS_KEY);
        List<String> patterns = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                String p = arr.optString(i, "").strip();
                if (!p.isEmpty()) patterns.add(p);
            }
        }
        if (patterns.isEmpty()) {
            MessageGenerator.warning("No patterns in sequential cell configuration " + fileName
                    + ", using default patterns.");
            return getDefault();
        }
        return new SequentialCellConfig(patterns, section.optBoolean(CASE_SENSITIVE_KEY, false));
    }

    /**
     * @param cellType A cell type name
     * @return True if any pattern matches the whole name
     */
    public boolean isSequential(String cellType) {
        for (Pattern p : regexes) {
            if (p.matcher(cellType).matches()) return true;
        }
        return false;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    static String convertWildcardToRegex(String wildcardPattern) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < wildcardPattern.length(); i++) {
            char c = wildcardPattern.charAt(i);
            switch (c) {
                case '*':
                    sb.append(".*");
                    break;
                case '?': case '\\': case '{': case '}': case '|': case '.': case '+':
                case '^': case '$':  case '(': case ')': case '[': case ']':
                    sb.append("\\");
                    sb.append(c);
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
