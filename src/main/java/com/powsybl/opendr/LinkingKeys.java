/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.index.Scope;

/**
 * Keys of the aggregator and household linking structures, shared by the assembler and the devices.
 *
 * @author Open Demand Response team
 */
public final class LinkingKeys {

    private LinkingKeys() {
    }

    public static ModelKey totalLoad(int time) {
        return ModelKey.of(Scope.aggregator(), AggregationVariableType.TOTAL_LOAD, time);
    }

    public static ModelKey totalLoadLink(int time) {
        return ModelKey.of(Scope.aggregator(), AggregationConstraintType.TOTAL_LOAD_LINK, time);
    }

    public static ModelKey netLoad(String householdId, int time) {
        return ModelKey.of(Scope.household(householdId), AggregationVariableType.NET_LOAD, time);
    }

    /**
     * Household constraint {@code -netLoad[t] + sum of device powers at t = rhs} the devices are wired into.
     */
    public static ModelKey netLoadLink(String householdId, int time) {
        return ModelKey.of(Scope.household(householdId), AggregationConstraintType.NET_LOAD_LINK, time);
    }
}
