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

/**
 * A controllable or fixed energy device of a household.
 * <p>
 * Devices are immutable: all the state of the device over the horizon (state of charge, temperature...) lives in
 * the model variables it declares.
 *
 * @author Open Demand Response team
 */
public interface Device {

    /**
     * Label of the device, unique within its household.
     */
    String getId();

    DeviceType getType();

    /**
     * Check the parameters of this device against the time window. Called for every device before the model is
     * modified.
     *
     * @throws DeviceParameterException if a time series does not match the window or the device cannot run in it
     */
    void validate(TimeWindow timeWindow);

    /**
     * Declare the variables and constraints of this device, and wire its power into the net load linking
     * constraints of its household, which must already exist.
     */
    void contribute(MilpModelBuilder builder, String householdId);
}
