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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.cdlscope.util.FileTools;
import com.cdlscope.util.MessageGenerator;

/**
 * Project specific power and ground net names, stored as JSON in
 * {@code <project>/.cdlscope/net_classification.json}:
 *
 * <pre>
 * {
 *   "version": 1,
 *   "power_nets":  {"names": ["AVDD"], "patterns": ["VDD_.*"]},
 *   "ground_nets": {"names": ["AVSS"], "patterns": []},
 *   "override_defaults": false
 * }
 * </pre>
 *
 * Names match exactly but ignore case. Patterns are regular expressions matched
 * against the whole name, ignoring case.
 */
public class NetClassificationConfig {

    public static final String CONFIG_DIR = ".cdlscope";

    public static final String CONFIG_FILENAME = "net_classification.json";

    public static final int CONFIG_VERSION = 1;

    private static final String POWER_KEY = "power_nets";
    private static final String GROUND_KEY = "ground_nets";
    private static final String NAMES_KEY = "names";
    private static final String PATTERNS_KEY = "patterns";
    private static final String OVERRIDE_KEY = "override_defaults";
    private static final String VERSION_KEY = "version";

    private final List<String> powerNames = new ArrayList<>();
    private final List<String> powerPatterns = new ArrayList<>();
    private final List<String> groundNames = new ArrayList<>();
    private final List<String> groundPatterns = new ArrayList<>();
    private boolean overrideDefaults;

    /** Upper-cased names and compiled patterns, rebuilt on every change */
    private Set<String> powerNameSet = Collections.emptySet();
    private Set<String> groundNameSet = Collections.emptySet();
    private List<Pattern> powerRegexes = Collections.emptyList();
    private List<Pattern> groundRegexes = Collections.emptyList();

    /** Bumped on every change so caches built on this config can detect it */
    private int revision;

    public NetClassificationConfig() {
    }

    public NetClassificationConfig(List<String> powerNames, List<String> powerPatterns,
            List<String> groundNames, List<String> groundPatterns, boolean overrideDefaults) {
        this.powerNames.addAll(powerNames);
        this.powerPatterns.addAll(powerPatterns);
        this.groundNames.addAll(groundNames);
        this.groundPatterns.addAll(groundPatterns);
        this.overrideDefaults = overrideDefaults;
        compile();
    }

    public static Path getConfigFile(Path projectDir) {
        return projectDir.resolve(CONFIG_DIR).resolve(CONFIG_FILENAME);
    }

    /**
     * Loads the configuration of a project. A missing file yields an empty
     * configuration; an unreadable one yields an empty configuration and a
     * warning.
     * @param projectDir The project root directory
     * @return The loaded configuration
     */
    public static NetClassificationConfig load(Path projectDir) {
        Path file = getConfigFile(projectDir);
        try {
            JSONObject obj = FileTools.readJSONObject(file);
            return obj == null ? new NetClassificationConfig() : fromJSON(obj);
        } catch (JSONException e) {
            MessageGenerator.warning("Could not read net classification file " + file + " ("
                    + e.getMessage() + "), using default net classification.");
            return new NetClassificationConfig();
        }
    }

    /**
     * Writes this configuration to the project, creating the configuration
     * directory if needed.
     * @param projectDir The project root directory
     */
    public void save(Path projectDir) {
        FileTools.writeJSONObject(toJSON(), getConfigFile(projectDir));
    }

    public static NetClassificationConfig fromJSON(JSONObject obj) {
        JSONObject power = obj.optJSONObject(POWER_KEY);
        JSONObject ground = obj.optJSONObject(GROUND_KEY);
        return new NetClassificationConfig(
                getStrings(power, NAMES_KEY), getStrings(power, PATTERNS_KEY),
                getStrings(ground, NAMES_KEY), getStrings(ground, PATTERNS_KEY),
                obj.optBoolean(OVERRIDE_KEY, false));
    }

    public JSONObject toJSON() {
        JSONObject obj = new JSONObject();
        obj.put(VERSION_KEY, CONFIG_VERSION);
        obj.put(POWER_KEY, new JSONObject()
                .put(NAMES_KEY, new JSONArray(powerNames))
                .put(PATTERNS_KEY, new JSONArray(powerPatterns)));
        obj.put(GROUND_KEY, new JSONObject()
                .put(NAMES_KEY, new JSONArray(groundNames))
                .put(PATTERNS_KEY, new JSONArray(groundPatterns)));
        obj.put(OVERRIDE_KEY, overrideDefaults);
        return obj;
    }

    private static List<String> getStrings(@Nullable JSONObject section, String key) {
        List<String> values = new ArrayList<>();
        if (section == null) return values;
        JSONArray arr = section.optJSONArray(key);
        if (arr == null) return values;
        for (int i = 0; i < arr.length(); i++) {
            String s = arr.optString(i, "").strip();
            if (!s.isEmpty()) {
                values.add(s);
            }
        }
        return values;
    }

    private void compile() {
        powerNameSet = toUpperSet(powerNames);
        groundNameSet = toUpperSet(groundNames);
        powerRegexes = compilePatterns(powerPatterns);
        groundRegexes = compilePatterns(groundPatterns);
        revision++;
    }

    private static Set<String> toUpperSet(List<String> names) {
        Set<String> set = new LinkedHashSet<>();
        for (String n : names) {
            set.add(n.toUpperCase(Locale.ROOT));
        }
        return set;
    }

    private static List<Pattern> compilePatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String p : patterns) {
            try {
                compiled.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                MessageGenerator.warning("Ignoring invalid net classification pattern '" + p + "': "
                        + e.getDescription());
            }
        }
        return compiled;
    }

    /**
     * Classifies a name using only the entries of this configuration.
     * @param name A net name (markers already stripped)
     * @return POWER or GROUND when an entry matches, null otherwise
     */
    @Nullable
    public NetType classify(String name) {
        if (matches(name, powerNameSet, powerRegexes)) return NetType.POWER;
        if (matches(name, groundNameSet, groundRegexes)) return NetType.GROUND;
        return null;
    }

    private static boolean matches(String name, Set<String> names, List<Pattern> regexes) {
        if (names.contains(name.toUpperCase(Locale.ROOT))) return true;
        for (Pattern p : regexes) {
            if (p.matcher(name).matches()) return true;
        }
        return false;
    }

    public void addPowerName(String name) {
        powerNames.add(name);
        compile();
    }

    public void addGroundName(String name) {
        groundNames.add(name);
        compile();
    }

    public void addPowerPattern(String pattern) {
        powerPatterns.add(pattern);
        compile();
    }

    public void addGroundPattern(String pattern) {
        groundPatterns.add(pattern);
        compile();
    }

    public void setOverrideDefaults(boolean overrideDefaults) {
        this.overrideDefaults = overrideDefaults;
        revision++;
    }

    public int getRevision() {
        return revision;
    }

    /**
     * @return True when the built-in VDD/VSS name families must not be consulted
     */
    public boolean isOverrideDefaults() {
        return overrideDefaults;
    }

    public List<String> getPowerNames() {
        return new ArrayList<>(powerNames);
    }

    public List<String> getPowerPatterns() {
        return new ArrayList<>(powerPatterns);
    }

    public List<String> getGroundNames() {
        return new ArrayList<>(groundNames);
    }

    public List<String> getGroundPatterns() {
        return new ArrayList<>(groundPatterns);
    }

    public boolean isEmpty() {
        return powerNames.isEmpty() && powerPatterns.isEmpty() && groundNames.isEmpty()
                && groundPatterns.isEmpty();
    }
}
