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

import static com.powsybl.opendr.device.CurtailableLoadConstraintType.CURTAILMENT;
import static com.powsybl.opendr.device.CurtailableLoadVariableType.*;

/**
 * Load, or generation when negative, that can be curtailed: {@code pwr[t] = load[t] * u[t]} with {@code u[t]} in
 * [0, 1]. With binary control, the profile is either fully kept or fully curtailed at each step.
 *
 * @author Open Demand Response team
 */
public class CurtailableLoad extends AbstractDevice {

    private final double[] load;

    private final boolean binary;

    public CurtailableLoad(String id, double[] load, boolean binary) {
        super(id);
        this.load = checkFinite("load", load);
        this.binary = binary;
    }

    public CurtailableLoad(String id, double[] load) {
        this(id, load, true);
    }

    @Override
    public DeviceType getType() {
        return DeviceType.CURTAILABLE_LOAD;
    }

    public double[] getLoad() {
        return load.clone();
    }

    public boolean isBinary() {
        return binary;
    }

    @Override
    public void validate(TimeWindow timeWindow) {
        super.validate(timeWindow);
        checkLength(timeWindow, "load", load);
    }

    @Override
    public void contribute(MilpModelBuilder builder, String householdId) {
        int size = builder.getTimeWindow().getSize();

        createPowerVariables(builder, householdId, POWER, 1, Double.NEGATIVE_INFINITY);
        createIndicatorVariables(builder, householdId, CURTAILMENT_INDICATOR, binary);

        for (int t = 0; t < size; t++) {
            builder.newConstraint(getKey(householdId, CURTAILMENT, t), ConstraintSense.EQUAL)
                    .addTerm(getKey(householdId, POWER, t), 1)
                    .addTerm(getKey(householdId, CURTAILMENT_INDICATOR, t), -load[t])
                    .add();
        }
    }
}
