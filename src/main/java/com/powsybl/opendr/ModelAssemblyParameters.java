/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.commons.config.PlatformConfig;

/**
 * Parameters of a model assembly run, decided once for all the households and devices.
 *
 * @author Open Demand Response team
 */
public class ModelAssemblyParameters {

    public static final String MODULE_NAME = "demand-response-model-default-parameters";

    public static final String BINARIES_PARAM_NAME = "binaries";
    public static final String HOUSEHOLD_NET_LOAD_MIN_PARAM_NAME = "householdNetLoadMin";
    public static final String HOUSEHOLD_NET_LOAD_MAX_PARAM_NAME = "householdNetLoadMax";

    public static final boolean BINARIES_DEFAULT_VALUE = true;
    public static final double HOUSEHOLD_NET_LOAD_MIN_DEFAULT_VALUE = 0;
    public static final double HOUSEHOLD_NET_LOAD_MAX_DEFAULT_VALUE = 10;

    private boolean binaries = BINARIES_DEFAULT_VALUE;

    private double householdNetLoadMin = HOUSEHOLD_NET_LOAD_MIN_DEFAULT_VALUE;

    private double householdNetLoadMax = HOUSEHOLD_NET_LOAD_MAX_DEFAULT_VALUE;

    /**
     * When false, on/off and start indicators are relaxed to continuous variables in [0, 1].
     */
    public boolean isBinaries() {
        return binaries;
    }

    public ModelAssemblyParameters setBinaries(boolean binaries) {
        this.binaries = binaries;
        return this;
    }

    public double getHouseholdNetLoadMin() {
        return householdNetLoadMin;
    }

    public ModelAssemblyParameters setHouseholdNetLoadMin(double householdNetLoadMin) {
        if (Double.isNaN(householdNetLoadMin)) {
            throw new IllegalArgumentException("Invalid household net load lower bound");
        }
        this.householdNetLoadMin = householdNetLoadMin;
        return this;
    }

    public double getHouseholdNetLoadMax() {
        return householdNetLoadMax;
    }

    public ModelAssemblyParameters setHouseholdNetLoadMax(double householdNetLoadMax) {
        if (Double.isNaN(householdNetLoadMax)) {
            throw new IllegalArgumentException("Invalid household net load upper bound");
        }
        this.householdNetLoadMax = householdNetLoadMax;
        return this;
    }

    public static ModelAssemblyParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static ModelAssemblyParameters load(PlatformConfig platformConfig) {
        ModelAssemblyParameters parameters = new ModelAssemblyParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setBinaries(config.getBooleanProperty(BINARIES_PARAM_NAME, BINARIES_DEFAULT_VALUE))
                .setHouseholdNetLoadMin(config.getDoubleProperty(HOUSEHOLD_NET_LOAD_MIN_PARAM_NAME, HOUSEHOLD_NET_LOAD_MIN_DEFAULT_VALUE))
                .setHouseholdNetLoadMax(config.getDoubleProperty(HOUSEHOLD_NET_LOAD_MAX_PARAM_NAME, HOUSEHOLD_NET_LOAD_MAX_DEFAULT_VALUE)));
        return parameters;
    }

    @Override
    public String toString() {
        return "ModelAssemblyParameters(" +
                "binaries=" + binaries +
                ", householdNetLoadMin=" + householdNetLoadMin +
                ", householdNetLoadMax=" + householdNetLoadMax +
                ')';
    }
}
