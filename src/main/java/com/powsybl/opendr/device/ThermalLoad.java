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
import com.powsybl.opendr.model.ConstraintSense;

import static com.powsybl.opendr.device.ThermalLoadConstraintType.*;
import static com.powsybl.opendr.device.ThermalLoadVariableType.*;

/**
 * Electric heating of a thermal mass exchanging heat with the outside.
 * <p>
 * First order RC model, with {@code a = deltaT * conductionCoefficient / heatCapacity} and
 * {@code b = deltaT * thermalEfficiency / heatCapacity}:
 * <pre>
 * temp[t] = (1 - a) * temp[t-1] + a * tempExt[t] + b * pwr[t]
 * </pre>
 * except at the first step where {@code temp[0] = tempInit + a * (tempExt[0] - tempInit) + b * pwr[0]}.
 * The heating power is bounded by an on/off indicator.
 *
 * @author Open Demand Response team
 */
public class ThermalLoad extends AbstractDevice {

    private final double[] tempMin;
    private final double[] tempMax;
    private final double[] tempExt;
    private final double tempInit;
    private final double pwrThMin;
    private final double pwrThMax;
    private final double heatCapacity;
    private final double thermalEfficiency;
    private final double conductionCoefficient;

    public ThermalLoad(String id, double[] tempMin, double[] tempMax, double[] tempExt, double tempInit,
                       double pwrThMin, double pwrThMax, double heatCapacity, double thermalEfficiency,
                       double conductionCoefficient) {
        super(id);
        this.tempMin = checkFinite("temp min", tempMin);
        this.tempMax = checkFinite("temp max", tempMax);
        this.tempExt = checkFinite("temp ext", tempExt);
        if (tempMax.length != tempMin.length || tempExt.length != tempMin.length) {
            throw createException("temperature series have different lengths");
        }
        for (int t = 0; t < tempMin.length; t++) {
            if (tempMin[t] > tempMax[t]) {
                throw createException("invalid temperature range [" + tempMin[t] + ", " + tempMax[t] + "] at step " + t);
            }
        }
        this.tempInit = checkFinite("initial temperature", tempInit);
        checkPowerRange("thermal power", pwrThMin, pwrThMax);
        this.pwrThMin = pwrThMin;
        this.pwrThMax = pwrThMax;
        if (!(heatCapacity > 0) || Double.isInfinite(heatCapacity)) {
            throw createException("heat capacity must be strictly positive: " + heatCapacity);
        }
        this.heatCapacity = heatCapacity;
        this.thermalEfficiency = checkFinite("thermal efficiency", thermalEfficiency);
        this.conductionCoefficient = checkFinite("conduction coefficient", conductionCoefficient);
    }

    @Override
    public DeviceType getType() {
        return DeviceType.THERMAL_LOAD;
    }

    public double[] getTempMin() {
        return tempMin.clone();
    }

    public double[] getTempMax() {
        return tempMax.clone();
    }

    public double[] getTempExt() {
        return tempExt.clone();
    }

    public double getTempInit() {
        return tempInit;
    }

    public double getPwrThMin() {
        return pwrThMin;
    }

    public double getPwrThMax() {
        return pwrThMax;
    }

    public double getHeatCapacity() {
        return heatCapacity;
    }

    public double getThermalEfficiency() {
        return thermalEfficiency;
    }

    public double getConductionCoefficient() {
        return conductionCoefficient;
    }

    @Override
    public void validate(TimeWindow timeWindow) {
        super.validate(timeWindow);
        // all series have the same length
        checkLength(timeWindow, "temp min", tempMin);
    }

    @Override
    public void contribute(MilpModelBuilder builder, String householdId) {
        int size = builder.getTimeWindow().getSize();
        double deltaT = builder.getTimeWindow().getDeltaT();

        createPowerVariables(builder, householdId, POWER, 1, 0);
        for (int t = 0; t < size; t++) {
            builder.newVariable(getKey(householdId, TEMPERATURE, t))
                    .setBounds(tempMin[t], tempMax[t])
                    .add();
        }
        createIndicatorVariables(builder, householdId, ON_INDICATOR, true);

        for (int t = 0; t < size; t++) {
            builder.newConstraint(getKey(householdId, POWER_MIN, t), ConstraintSense.LESS_EQUAL)
                    .addTerm(getKey(householdId, POWER, t), -1)
                    .addTerm(getKey(householdId, ON_INDICATOR, t), pwrThMin)
                    .add();
        }
        for (int t = 0; t < size; t++) {
            builder.newConstraint(getKey(householdId, POWER_MAX, t), ConstraintSense.LESS_EQUAL)
                    .addTerm(getKey(householdId, POWER, t), 1)
                    .addTerm(getKey(householdId, ON_INDICATOR, t), -pwrThMax)
                    .add();
        }

        double a = deltaT * conductionCoefficient / heatCapacity;
        double b = deltaT * thermalEfficiency / heatCapacity;
        builder.newConstraint(getKey(householdId, TEMPERATURE_EXCHANGE, 0), ConstraintSense.EQUAL)
                .setRhs(tempInit + a * (tempExt[0] - tempInit))
                .addTerm(getKey(householdId, TEMPERATURE, 0), 1)
                .addTerm(getKey(householdId, POWER, 0), -b)
                .add();
        for (int t = 1; t < size; t++) {
            builder.newConstraint(getKey(householdId, TEMPERATURE_EXCHANGE, t), ConstraintSense.EQUAL)
                    .setRhs(a * tempExt[t])
                    .addTerm(getKey(householdId, TEMPERATURE, t), 1)
                    .addTerm(getKey(householdId, TEMPERATURE, t - 1), -(1 - a))
                    .addTerm(getKey(householdId, POWER, t), -b)
                    .add();
        }
    }
}
