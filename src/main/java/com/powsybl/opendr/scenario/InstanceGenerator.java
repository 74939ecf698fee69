/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.scenario;

import com.powsybl.opendr.Aggregator;
import com.powsybl.opendr.DemandResponseModel;
import com.powsybl.opendr.Household;
import com.powsybl.opendr.HouseholdModelAssembler;
import com.powsybl.opendr.ModelAssemblyParameters;
import com.powsybl.opendr.TimeWindow;
import com.powsybl.opendr.model.DefaultMilpModel;

import java.util.Arrays;
import java.util.List;

/**
 * Generation of a complete demand response instance: random households, an aggregator paying the scenario price
 * with a total load capped at 7.5 kW per household on average, and the assembled model.
 *
 * @author Open Demand Response team
 */
public final class InstanceGenerator {

    /**
     * Daily energy allowance of a household, in kWh.
     */
    public static final double DAILY_ENERGY_PER_HOUSEHOLD = 180;

    private InstanceGenerator() {
    }

    public static DemandResponseModel<DefaultMilpModel> generate(int householdCount, ScenarioData data, OwnershipRates rates,
                                                                 DeviceParameters parameters, double deltaT, long seed) {
        return generate(householdCount, data, rates, parameters, new ModelAssemblyParameters(), deltaT, seed);
    }

    public static DemandResponseModel<DefaultMilpModel> generate(int householdCount, ScenarioData data, OwnershipRates rates,
                                                                 DeviceParameters parameters, ModelAssemblyParameters assemblyParameters,
                                                                 double deltaT, long seed) {
        TimeWindow timeWindow = new TimeWindow(data.getSize(), deltaT);
        List<Household> households = HouseholdGenerator.generate(householdCount, timeWindow, data, rates, parameters, seed);

        double[] totalLoadMin = new double[timeWindow.getSize()];
        double[] totalLoadMax = new double[timeWindow.getSize()];
        Arrays.fill(totalLoadMax, DAILY_ENERGY_PER_HOUSEHOLD * householdCount / 24);
        Aggregator aggregator = new Aggregator(data.getPrice(), totalLoadMin, totalLoadMax);

        return new HouseholdModelAssembler(assemblyParameters).assemble(households, aggregator, timeWindow);
    }
}
