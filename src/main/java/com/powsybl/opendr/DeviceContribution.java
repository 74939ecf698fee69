/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.opendr.index.ModelKey;

import java.util.List;
import java.util.Objects;

/**
 * Keys of the variables and constraints declared by one device of one household, in declaration order.
 *
 * @author Open Demand Response team
 */
public record DeviceContribution(String householdId, String deviceId, List<ModelKey> variables, List<ModelKey> constraints) {

    public DeviceContribution {
        Objects.requireNonNull(householdId);
        Objects.requireNonNull(deviceId);
        variables = List.copyOf(variables);
        constraints = List.copyOf(constraints);
    }
}
