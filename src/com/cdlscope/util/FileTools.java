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

import java.io.BufferedWriter;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

import org.apache.commons.io.FilenameUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * A set of file helpers shared by the CDL readers and the configuration classes.
 */
public class FileTools {

    public static final String GZIP_EXTENSION = ".gz";

    /**
     * Opens an input stream on the file, decompressing it on the fly if its name
     * ends in *.gz.
     * @param fileName Path to the text or gzipped file
     * @return An opened InputStream, the caller is responsible for closing it
     */
    public static InputStream getInputStream(Path fileName) {
        InputStream in = null;
        try {
            in = Files.newInputStream(fileName);
            if (isGZIPFile(fileName)) {
                in = new GZIPInputStream(in);
            }
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("ERROR: Could not find file: " + fileName, e);
        } catch (IOException e) {
            closeQuietlyOnError(in, e);
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
        return in;
    }

    private static void closeQuietlyOnError(InputStream in, IOException cause) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    public static boolean isGZIPFile(Path fileName) {
        return fileName.toString().endsWith(GZIP_EXTENSION);
    }

    /**
     * Gets the name of a file without its directories and its extension. A
     * trailing *.gz is removed first, so "lib/top.ckt.gz" yields "top".
     * @param fileName The file path
     * @return The base name of the file
     */
    public static String getBaseName(Path fileName) {
        String name = fileName.getFileName() == null ? fileName.toString() : fileName.getFileName().toString();
        if (name.endsWith(GZIP_EXTENSION)) {
            name = name.substring(0, name.length() - GZIP_EXTENSION.length());
        }
        return FilenameUtils.getBaseName(name);
    }

    /**
     * Reads a JSON object from a UTF-8 text file.
     * @param fileName The JSON file to read
     * @return The parsed object, or null if the file does not exist
     * @throws JSONException if the file contents are not a JSON object
     */
    public static JSONObject readJSONObject(Path fileName) {
        if (!Files.isRegularFile(fileName)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(fileName, StandardCharsets.UTF_8)) {
            return new JSONObject(new JSONTokener(reader));
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + fileName, e);
        }
    }

    /**
     * Writes a JSON object to a UTF-8 text file, creating parent directories as
     * needed.
     * @param obj The object to write
     * @param fileName The destination file
     */
    public static void writeJSONObject(JSONObject obj, Path fileName) {
        try {
            Path parent = fileName.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(fileName, StandardCharsets.UTF_8)) {
                writer.write(obj.toString(2));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem writing file: " + fileName, e);
        }
    }

    /**
     * Throws if the file does not exist.
     * @param fileName The file that is expected to exist
     */
    public static void errorIfFileDoesNotExist(Path fileName) {
        if (!Files.exists(fileName)) {
            throw new UncheckedIOException(new FileNotFoundException("ERROR: Couldn't find file: " + fileName));
        }
    }
}
