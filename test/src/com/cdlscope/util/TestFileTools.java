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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.IOUtils;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.cdlscope.support.CdlTestFiles;
import com.cdlscope.util.function.InputStreamSupplier;

public class TestFileTools {

    @ParameterizedTest
    @CsvSource({
        "top.ckt,              top",
        "lib/top.ckt.gz,       top",
        "/a/b/design.cdl,      design",
        "noext,                noext",
    })
    public void testGetBaseName(String path, String expected) {
        Assertions.assertEquals(expected, FileTools.getBaseName(Paths.get(path)));
    }

    @Test
    public void testGzipTransparent() throws IOException {
        String plain;
        String unzipped;
        try (InputStream in = FileTools.getInputStream(CdlTestFiles.getPath("inverter_chain.ckt"))) {
            plain = IOUtils.toString(in, StandardCharsets.UTF_8);
        }
        try (InputStream in = InputStreamSupplier.fromPath(CdlTestFiles.getPath("inverter_chain.ckt.gz")).get()) {
            unzipped = IOUtils.toString(in, StandardCharsets.UTF_8);
        }
        Assertions.assertEquals(plain, unzipped);
        Assertions.assertTrue(FileTools.isGZIPFile(CdlTestFiles.getPath("inverter_chain.ckt.gz")));
    }

    @Test
    public void testMissingFile(@TempDir Path tmpDir) {
        UncheckedIOException e = Assertions.assertThrows(UncheckedIOException.class,
                () -> FileTools.getInputStream(tmpDir.resolve("gone.ckt")));
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: Could not find file: "));
        Assertions.assertThrows(UncheckedIOException.class,
                () -> FileTools.errorIfFileDoesNotExist(tmpDir.resolve("gone.ckt")));
    }

    @Test
    public void testJSONRoundTrip(@TempDir Path tmpDir) {
        Path file = tmpDir.resolve("sub").resolve("cfg.json");
        Assertions.assertNull(FileTools.readJSONObject(file));
        FileTools.writeJSONObject(new JSONObject().put("k", 3), file);
        Assertions.assertEquals(3, FileTools.readJSONObject(file).getInt("k"));
    }

    @Test
    public void testStringSupplierRestartable() throws IOException {
        InputStreamSupplier s = InputStreamSupplier.fromString("abc");
        for (int i = 0; i < 2; i++) {
            try (InputStream in = s.get()) {
                Assertions.assertEquals("abc", IOUtils.toString(in, StandardCharsets.UTF_8));
            }
        }
    }

    @Test
    public void testNamePool() {
        NamePool pool = new NamePool();
        String a = pool.intern(new String("net"));
        String b = pool.intern(new String("net"));
        Assertions.assertSame(a, b);
        Assertions.assertEquals(1, pool.size());
        pool.clear();
        Assertions.assertEquals(0, pool.size());
    }

    @Test
    public void testRuntimeTracker() {
        RuntimeTracker total = new RuntimeTracker("total");
        total.start();
        RuntimeTracker child = total.startChild("step");
        child.stop();
        total.stop();
        Assertions.assertEquals(1, total.getChildren().size());
        Assertions.assertTrue(total.getTime() >= child.getTime());
        String tree = total.toTreeString();
        Assertions.assertTrue(tree.startsWith("total:"));
        Assertions.assertTrue(tree.contains("step:"));
    }
}
