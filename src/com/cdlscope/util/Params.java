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

/**
 * Centralized access to global CDLScope settings. Every setting can be provided
 * either as an environment variable or as a JVM property of the same name.
 */
public class Params {

    public static String CDL_PROGRESS_INTERVAL_NAME = "CDL_PROGRESS_INTERVAL";

    public static String CDL_VERBOSE_NAME = "CDL_VERBOSE";

    public static String CDL_DEFAULT_MAX_PATH_HOPS_NAME = "CDL_DEFAULT_MAX_PATH_HOPS";

    public static int CDL_DEFAULT_PROGRESS_INTERVAL = 100;

    public static int CDL_DEFAULT_PATH_HOPS = 10;

    /**
     * Number of tokens processed between two invocations of a parse progress
     * listener. Values below 1 fall back to the default.
     */
    public static int CDL_PROGRESS_INTERVAL = getParamOrDefaultIntSetting(CDL_PROGRESS_INTERVAL_NAME,
            CDL_DEFAULT_PROGRESS_INTERVAL);

    /**
     * Flag to have the parser print a summary and all collected warnings after
     * each parse.
     */
    public static boolean CDL_VERBOSE = isParamSet(CDL_VERBOSE_NAME);

    /**
     * Hop limit used by path queries when the caller does not supply one.
     */
    public static int CDL_DEFAULT_MAX_PATH_HOPS = getParamOrDefaultIntSetting(CDL_DEFAULT_MAX_PATH_HOPS_NAME,
            CDL_DEFAULT_PATH_HOPS);

    /**
     * Checks if the named parameter is set via an environment variable or by a
     * JVM parameter of the same name.
     *
     * @param key Name of the global parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !(value == null
               || value.isEmpty()
               || value.equals("0")
               || value.equalsIgnoreCase("false"));
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set integer value of the parameter, or null if none was set or
     *         the value is not a parsable integer (a warning is printed).
     */
    public static Integer getParamIntValue(String key) {
        String value = getParamValue(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            MessageGenerator.warning("Couldn't interpret the value '" + value
                    + "' from the parameter '" + key + "' as an integer.");
        }
        return null;
    }

    /**
     * Gets the string value of the provided parameter name. Environment variables
     * take precedence over JVM properties.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set to a positive
     * integer, it returns that value. Otherwise it returns the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The parameter value if set and positive, otherwise defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null || setValue < 1 ? defaultValue : setValue;
    }
}
