/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Demand Response team
 */
class ModelAssemblyParametersTest {

    private FileSystem fileSystem;

    private InMemoryPlatformConfig platformConfig;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultConfig() {
        ModelAssemblyParameters parameters = ModelAssemblyParameters.load(platformConfig);
        assertTrue(parameters.isBinaries());
        assertEquals(ModelAssemblyParameters.HOUSEHOLD_NET_LOAD_MIN_DEFAULT_VALUE, parameters.getHouseholdNetLoadMin(), 0);
        assertEquals(ModelAssemblyParameters.HOUSEHOLD_NET_LOAD_MAX_DEFAULT_VALUE, parameters.getHouseholdNetLoadMax(), 0);
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(ModelAssemblyParameters.MODULE_NAME);
        moduleConfig.setStringProperty("binaries", "false");
        moduleConfig.setStringProperty("householdNetLoadMax", "12.5");

        ModelAssemblyParameters parameters = ModelAssemblyParameters.load(platformConfig);
        assertFalse(parameters.isBinaries());
        assertEquals(0, parameters.getHouseholdNetLoadMin(), 0);
        assertEquals(12.5, parameters.getHouseholdNetLoadMax(), 0);
        assertEquals("ModelAssemblyParameters(binaries=false, householdNetLoadMin=0.0, householdNetLoadMax=12.5)", parameters.toString());
    }

    @Test
    void testSetters() {
        ModelAssemblyParameters parameters = new ModelAssemblyParameters()
                .setBinaries(false)
                .setHouseholdNetLoadMin(Double.NEGATIVE_INFINITY)
                .setHouseholdNetLoadMax(Double.POSITIVE_INFINITY);
        assertFalse(parameters.isBinaries());
        assertEquals(Double.NEGATIVE_INFINITY, parameters.getHouseholdNetLoadMin());
        assertThrows(IllegalArgumentException.class, () -> parameters.setHouseholdNetLoadMax(Double.NaN));
        assertEquals(Double.POSITIVE_INFINITY, parameters.getHouseholdNetLoadMax());
    }
}
