/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

import com.powsybl.opendr.LinkingKeys;
import com.powsybl.opendr.MilpModelBuilder;
import com.powsybl.opendr.TimeWindow;
import com.powsybl.opendr.index.Field;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.index.Scope;

import java.util.Objects;

/**
 * Base class of devices: identification, parameter checks and wiring of power variables into the household net
 * load.
 *
 * @author Open Demand Response team
 */
public abstract class AbstractDevice implements Device {

    protected final String id;

    protected AbstractDevice(String id) {
        this.id = Objects.requireNonNull(id);
        if (id.isEmpty()) {
            throw new DeviceParameterException("Empty device id");
        }
        if (id.contains(Scope.SEPARATOR)) {
            throw new DeviceParameterException("Device id '" + id + "' contains '" + Scope.SEPARATOR + "'");
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void validate(TimeWindow timeWindow) {
        Objects.requireNonNull(timeWindow);
    }

    protected Scope getScope(String householdId) {
        return Scope.device(householdId, id);
    }

    protected ModelKey getKey(String householdId, Field field, int time) {
        return ModelKey.of(getScope(householdId), field, time);
    }

    /**
     * Declare one power variable per time step, with a coefficient {@code sign} in the household net load linking
     * constraint of the same step.
     */
    protected void createPowerVariables(MilpModelBuilder builder, String householdId, Field field, double sign,
                                        double lowerBound) {
        for (int t = 0; t < builder.getTimeWindow().getSize(); t++) {
            builder.newVariable(getKey(householdId, field, t))
                    .setLowerBound(lowerBound)
                    .addToConstraint(LinkingKeys.netLoadLink(householdId, t), sign)
                    .add();
        }
    }

    protected void createIndicatorVariables(MilpModelBuilder builder, String householdId, Field field, boolean binaryRequested) {
        for (int t = 0; t < builder.getTimeWindow().getSize(); t++) {
            builder.newVariable(getKey(householdId, field, t))
                    .setIndicator(binaryRequested)
                    .add();
        }
    }

    protected DeviceParameterException createException(String message) {
        return new DeviceParameterException(getClass().getSimpleName() + " '" + id + "': " + message);
    }

    protected double checkFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw createException(name + " is not finite: " + value);
        }
        return value;
    }

    protected double[] checkFinite(String name, double[] values) {
        Objects.requireNonNull(values, name);
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw createException(name + "[" + i + "] is not finite: " + values[i]);
            }
        }
        return values.clone();
    }

    protected void checkLength(TimeWindow timeWindow, String name, double[] values) {
        if (values.length != timeWindow.getSize()) {
            throw createException(name + " has " + values.length + " values, expected " + timeWindow.getSize());
        }
    }

    /**
     * Check {@code 0 <= min <= max}.
     */
    protected void checkPowerRange(String name, double min, double max) {
        checkFinite(name + " min", min);
        checkFinite(name + " max", max);
        if (min < 0 || min > max) {
            throw createException("invalid " + name + " range [" + min + ", " + max + "]");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(id=" + id + ")";
    }
}
