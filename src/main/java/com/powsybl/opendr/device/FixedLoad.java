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

/**
 * Uncontrollable load with a known profile.
 * <p>
 * As the load is not a decision, no variable is created: the household linking constraint
 * {@code -netLoad[t] + sum of device powers = rhs[t]} gets {@code load[t]} subtracted from its right-hand side.
 *
 * @author Open Demand Response team
 */
public class FixedLoad extends AbstractDevice {

    private final double[] load;

    public FixedLoad(String id, double[] load) {
        super(id);
        this.load = checkFinite("load", load);
    }

    @Override
    public DeviceType getType() {
        return DeviceType.FIXED_LOAD;
    }

    public double[] getLoad() {
        return load.clone();
    }

    @Override
    public void validate(TimeWindow timeWindow) {
        super.validate(timeWindow);
        checkLength(timeWindow, "load", load);
    }

    @Override
    public void contribute(MilpModelBuilder builder, String householdId) {
        for (int t = 0; t < builder.getTimeWindow().getSize(); t++) {
            builder.addToRhs(LinkingKeys.netLoadLink(householdId, t), -load[t]);
        }
    }
}
