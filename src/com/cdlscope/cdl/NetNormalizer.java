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

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes net names and classifies them as power, ground or signal.
 * Results are cached by the exact input name; asking twice for the same name
 * returns the same {@link NetInfo} instance as long as the
 * {@link NetClassificationConfig} is not changed; a change to the config drops
 * the cache.
 * <ul>
 * <li>Trailing '!' and '?' markers are removed: {@code VDD!} becomes {@code VDD}.</li>
 * <li>Bus bits {@code base<7>} become {@code base[7]}. A range {@code base<7:0>}
 * is taken as its first index. A bare {@code <7>} is kept as a literal name.</li>
 * <li>A name made only of markers, such as {@code !}, is kept as written.</li>
 * <li>Bus bits are classified by their base name.</li>
 * </ul>
 */
public class NetNormalizer {

    private static final Pattern BUS_PATTERN = Pattern.compile("^(.+)<(\\d+)(?::(\\d+))?>$");

    private static final Pattern[] POWER_PATTERNS = {
        Pattern.compile("^VDD[A-Z]*$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^VCC[A-Z]*$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^VPWR$", Pattern.CASE_INSENSITIVE),
    };

    private static final Pattern[] GROUND_PATTERNS = {
        Pattern.compile("^VSS[A-Z]*$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^GND[A-Z]*$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^VGND$", Pattern.CASE_INSENSITIVE),
    };

    private final NetClassificationConfig config;

    private final Map<String, NetInfo> cache = new HashMap<>();

    private int configRevision;

    public NetNormalizer() {
        this(new NetClassificationConfig());
    }

    public NetNormalizer(NetClassificationConfig config) {
        this.config = config;
        this.configRevision = config.getRevision();
    }

    /**
     * @param name A net name as written in the netlist
     * @return The cached or newly computed normalization of name
     */
    public NetInfo normalize(String name) {
        if (config.getRevision() != configRevision) {
            cache.clear();
            configRevision = config.getRevision();
        }
        NetInfo info = cache.get(name);
        if (info == null) {
            info = compute(name);
            cache.put(name, info);
        }
        return info;
    }

    private NetInfo compute(String name) {
        String cleaned = stripTrailingMarkers(name);
        if (cleaned.isEmpty()) {
            cleaned = name;
        }
        Matcher m = BUS_PATTERN.matcher(cleaned);
        if (m.matches()) {
            String base = m.group(1);
            Integer index = parseIndex(m.group(2));
            if (index != null) {
                return new NetInfo(name, base + "[" + index + "]", classify(base), true, index);
            }
        }
        return new NetInfo(name, cleaned, classify(cleaned), false, null);
    }

    private static Integer parseIndex(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            // index too large for a bus bit, keep the name literal
            return null;
        }
    }

    static String stripTrailingMarkers(String name) {
        int end = name.length();
        while (end > 0) {
            char c = name.charAt(end - 1);
            if (c != '!' && c != '?') break;
            end--;
        }
        return name.substring(0, end);
    }

    private NetType classify(String name) {
        NetType configured = config.classify(name);
        if (configured != null) return configured;
        if (config.isOverrideDefaults()) return NetType.SIGNAL;
        for (Pattern p : POWER_PATTERNS) {
            if (p.matcher(name).matches()) return NetType.POWER;
        }
        for (Pattern p : GROUND_PATTERNS) {
            if (p.matcher(name).matches()) return NetType.GROUND;
        }
        return NetType.SIGNAL;
    }

    public boolean isPowerOrGround(String name) {
        return normalize(name).getType().isSupply();
    }

    public NetClassificationConfig getConfig() {
        return config;
    }

    public int cacheSize() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }
}
