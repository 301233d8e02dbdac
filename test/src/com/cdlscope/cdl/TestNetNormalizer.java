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

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestNetNormalizer {

    @ParameterizedTest
    @CsvSource({
        "VDD,      VDD,      POWER",
        "VDD!,     VDD,      POWER",
        "vdda,     vdda,     POWER",
        "VCC,      VCC,      POWER",
        "VPWR,     VPWR,     POWER",
        "VSS,      VSS,      GROUND",
        "gnd!,     gnd,      GROUND",
        "VGND,     VGND,     GROUND",
        "VSS?!,    VSS,      GROUND",
        "net_1,    net_1,    SIGNAL",
        "a!b,      a!b,      SIGNAL",
        "VDD_CORE, VDD_CORE, SIGNAL",
        "VPWR2,    VPWR2,    SIGNAL",
    })
    public void testScalarNames(String name, String normalized, NetType type) {
        NetInfo info = new NetNormalizer().normalize(name);
        Assertions.assertEquals(name, info.getOriginalName());
        Assertions.assertEquals(normalized, info.getNormalizedName());
        Assertions.assertEquals(type, info.getType());
        Assertions.assertFalse(info.isBus());
        Assertions.assertNull(info.getBusIndex());
    }

    @ParameterizedTest
    @CsvSource({
        "data<7>,     data[7],   7",
        "data<0>,     data[0],   0",
        "a<b><12>,    a<b>[12],  12",
        "addr<15:0>,  addr[15],  15",
        "data<3>!,    data[3],   3",
    })
    public void testBusNames(String name, String normalized, int index) {
        NetInfo info = new NetNormalizer().normalize(name);
        Assertions.assertEquals(normalized, info.getNormalizedName());
        Assertions.assertTrue(info.isBus());
        Assertions.assertEquals(index, info.getBusIndex());
        Assertions.assertEquals(NetType.SIGNAL, info.getType());
    }

    @Test
    public void testBareIndexIsLiteral() {
        NetInfo info = new NetNormalizer().normalize("<7>");
        Assertions.assertEquals("<7>", info.getNormalizedName());
        Assertions.assertFalse(info.isBus());
    }

    @ParameterizedTest
    @ValueSource(strings = {"!", "?", "!?", "??!"})
    public void testMarkersOnlyNameIsLiteral(String name) {
        NetInfo info = new NetNormalizer().normalize(name);
        Assertions.assertEquals(name, info.getNormalizedName());
        Assertions.assertEquals(NetType.SIGNAL, info.getType());
        Assertions.assertFalse(info.isBus());
    }

    @Test
    public void testBusBitClassifiedByBase() {
        NetInfo info = new NetNormalizer().normalize("VDD<2>");
        Assertions.assertEquals("VDD[2]", info.getNormalizedName());
        Assertions.assertEquals(NetType.POWER, info.getType());
    }

    @Test
    public void testCacheReturnsSameInstance() {
        NetNormalizer n = new NetNormalizer();
        NetInfo first = n.normalize("data<1>");
        Assertions.assertSame(first, n.normalize("data<1>"));
        Assertions.assertNotSame(first, n.normalize("data<2>"));
        Assertions.assertEquals(2, n.cacheSize());
        n.clearCache();
        Assertions.assertEquals(0, n.cacheSize());
    }

    @Test
    public void testIsPowerOrGround() {
        NetNormalizer n = new NetNormalizer();
        Assertions.assertTrue(n.isPowerOrGround("VDD"));
        Assertions.assertTrue(n.isPowerOrGround("VSS!"));
        Assertions.assertFalse(n.isPowerOrGround("clk"));
    }

    @Test
    public void testCustomNamesAndPatterns() {
        NetClassificationConfig config = new NetClassificationConfig(
                Collections.singletonList("avdd_io"), Collections.singletonList("PWR_.*"),
                Collections.singletonList("AGND_SUB"), Collections.<String>emptyList(), false);
        NetNormalizer n = new NetNormalizer(config);
        Assertions.assertEquals(NetType.POWER, n.normalize("AVDD_IO").getType());
        Assertions.assertEquals(NetType.POWER, n.normalize("pwr_main").getType());
        Assertions.assertEquals(NetType.GROUND, n.normalize("agnd_sub!").getType());
        Assertions.assertEquals(NetType.POWER, n.normalize("VDD").getType());
    }

    @Test
    public void testOverrideDefaults() {
        NetClassificationConfig config = new NetClassificationConfig(
                Arrays.asList("MYPWR"), Collections.<String>emptyList(),
                Collections.<String>emptyList(), Collections.<String>emptyList(), true);
        NetNormalizer n = new NetNormalizer(config);
        Assertions.assertEquals(NetType.SIGNAL, n.normalize("VDD").getType());
        Assertions.assertEquals(NetType.SIGNAL, n.normalize("VSS").getType());
        Assertions.assertEquals(NetType.POWER, n.normalize("MYPWR").getType());
    }

    @Test
    public void testConfigChangeDropsCache() {
        NetClassificationConfig config = new NetClassificationConfig();
        NetNormalizer n = new NetNormalizer(config);
        NetInfo before = n.normalize("AVDD_IO");
        Assertions.assertEquals(NetType.SIGNAL, before.getType());
        Assertions.assertSame(before, n.normalize("AVDD_IO"));

        config.addPowerName("avdd_io");
        Assertions.assertEquals(NetType.POWER, n.normalize("AVDD_IO").getType());
        Assertions.assertEquals(1, n.cacheSize());

        config.setOverrideDefaults(true);
        Assertions.assertEquals(NetType.SIGNAL, n.normalize("VDD").getType());
    }
}
