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

package com.cdlscope.util.function;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.commons.io.function.IOSupplier;

import com.cdlscope.util.FileTools;

/**
 * Opens a fresh InputStream on every call. Readers that need to traverse their
 * source more than once (such as the CDL lexer) hold one of these instead of a
 * stream.
 */
public interface InputStreamSupplier extends IOSupplier<InputStream> {

    /**
     * Supplies streams over a file, transparently decompressing gzipped
     * (*.gz) files.
     * @param p Path to the file
     * @return A supplier that opens p on every call
     */
    static InputStreamSupplier fromPath(Path p) {
        return () -> FileTools.getInputStream(p);
    }

    /**
     * Supplies streams over the UTF-8 encoding of an in-memory text.
     * @param text The text to serve
     * @return A supplier that returns a new stream over text on every call
     */
    static InputStreamSupplier fromString(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return () -> new ByteArrayInputStream(bytes);
    }
}
