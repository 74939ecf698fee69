/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.index;

import java.util.Objects;

/**
 * Owner of a model element: the aggregator (no household, no device), a household (no device) or a device of a
 * household.
 *
 * @author Open Demand Response team
 */
public record Scope(String householdId, String deviceId) {

    /**
     * Separator of the ids in element names, not allowed in household and device ids.
     */
    public static final String SEPARATOR = "/";

    private static final Scope AGGREGATOR = new Scope(null, null);

    public Scope {
        if (householdId == null && deviceId != null) {
            throw new IllegalArgumentException("A device scope requires a household");
        }
    }

    public static Scope aggregator() {
        return AGGREGATOR;
    }

    public static Scope household(String householdId) {
        return new Scope(Objects.requireNonNull(householdId), null);
    }

    public static Scope device(String householdId, String deviceId) {
        return new Scope(Objects.requireNonNull(householdId), Objects.requireNonNull(deviceId));
    }

    public boolean isAggregator() {
        return householdId == null;
    }

    public boolean isHousehold() {
        return householdId != null && deviceId == null;
    }

    public boolean isDevice() {
        return deviceId != null;
    }

    public String getName() {
        if (householdId == null) {
            return "";
        }
        return deviceId == null ? householdId : householdId + SEPARATOR + deviceId;
    }

    @Override
    public String toString() {
        return "Scope(" + (isAggregator() ? "aggregator" : getName()) + ")";
    }
}
