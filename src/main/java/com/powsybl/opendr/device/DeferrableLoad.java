/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

import com.powsybl.opendr.MilpModelBuilder;
import com.powsybl.opendr.TimeWindow;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.model.ConstraintSense;

import static com.powsybl.opendr.device.DeferrableLoadConstraintType.*;
import static com.powsybl.opendr.device.DeferrableLoadVariableType.*;

/**
 * Load that needs a given amount of energy over the window, at any time its availability allows, for instance
 * an electric vehicle.
 * <p>
 * {@code energyMin <= sum of deltaT * pwr[t] <= energyMax}, and {@code pwrMin[t] * u[t] <= pwr[t] <= pwrMax[t] * u[t]}.
 * Setting both bounds to zero at a step makes the load unavailable at that step.
 *
 * @author Open Demand Response team
 */
public class DeferrableLoad extends AbstractDevice {

    private final double energyMin;
    private final double energyMax;
    private final double[] pwrMin;
    private final double[] pwrMax;

    public DeferrableLoad(String id, double energyMin, double energyMax, double[] pwrMin, double[] pwrMax) {
        super(id);
        checkFinite("energy min", energyMin);
        checkFinite("energy max", energyMax);
        if (energyMin > energyMax) {
            throw createException("invalid energy range [" + energyMin + ", " + energyMax + "]");
        }
        this.energyMin = energyMin;
        this.energyMax = energyMax;
        this.pwrMin = checkFinite("power min", pwrMin);
        this.pwrMax = checkFinite("power max", pwrMax);
        if (pwrMin.length != pwrMax.length) {
            throw createException("power min and power max have different lengths");
        }
        for (int t = 0; t < pwrMin.length; t++) {
            if (pwrMin[t] > pwrMax[t]) {
                throw createException("invalid power range [" + pwrMin[t] + ", " + pwrMax[t] + "] at step " + t);
            }
        }
    }

    @Override
    public DeviceType getType() {
        return DeviceType.DEFERRABLE_LOAD;
    }

    public double getEnergyMin() {
        return energyMin;
    }

    public double getEnergyMax() {
        return energyMax;
    }

    public double[] getPwrMin() {
        return pwrMin.clone();
    }

    public double[] getPwrMax() {
        return pwrMax.clone();
    }

    @Override
    public void validate(TimeWindow timeWindow) {
        super.validate(timeWindow);
        checkLength(timeWindow, "power min", pwrMin);
    }

    @Override
    public void contribute(MilpModelBuilder builder, String householdId) {
        int size = builder.getTimeWindow().getSize();
        double deltaT = builder.getTimeWindow().getDeltaT();

        // sign is only restricted by the indicator constraints
        createPowerVariables(builder, householdId, POWER, 1, Double.NEGATIVE_INFINITY);
        createIndicatorVariables(builder, householdId, ON_INDICATOR, true);

        MilpModelBuilder.ConstraintAdder energyMinAdder = builder.newConstraint(ModelKey.of(getScope(householdId), TOTAL_ENERGY_MIN), ConstraintSense.GREATER_EQUAL)
                .setRhs(energyMin);
        MilpModelBuilder.ConstraintAdder energyMaxAdder = builder.newConstraint(ModelKey.of(getScope(householdId), TOTAL_ENERGY_MAX), ConstraintSense.LESS_EQUAL)
                .setRhs(energyMax);
        for (int t = 0; t < size; t++) {
            energyMinAdder.addTerm(getKey(householdId, POWER, t), deltaT);
            energyMaxAdder.addTerm(getKey(householdId, POWER, t), deltaT);
        }
        energyMinAdder.add();
        energyMaxAdder.add();

        for (int t = 0; t < size; t++) {
            builder.newConstraint(getKey(householdId, POWER_MIN, t), ConstraintSense.LESS_EQUAL)
                    .addTerm(getKey(householdId, POWER, t), -1)
                    .addTerm(getKey(householdId, ON_INDICATOR, t), pwrMin[t])
                    .add();
        }
        for (int t = 0; t < size; t++) {
            builder.newConstraint(getKey(householdId, POWER_MAX, t), ConstraintSense.LESS_EQUAL)
                    .addTerm(getKey(householdId, POWER, t), 1)
                    .addTerm(getKey(householdId, ON_INDICATOR, t), -pwrMax[t])
                    .add();
        }
    }
}
