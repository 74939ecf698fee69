/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.commons.PowsyblException;
import com.powsybl.opendr.index.ModelIndex;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.model.MilpModel;

import java.util.List;
import java.util.Objects;

/**
 * Result of a model assembly run: the solver model, the index mapping keys to model indices, and what each device
 * declared.
 *
 * @param <M> type of the solver model
 *
 * @author Open Demand Response team
 */
public class DemandResponseModel<M extends MilpModel> {

    private final M model;

    private final ModelIndex index;

    private final TimeWindow timeWindow;

    private final Aggregator aggregator;

    private final List<Household> households;

    private final List<DeviceContribution> contributions;

    public DemandResponseModel(M model, ModelIndex index, TimeWindow timeWindow, Aggregator aggregator,
                               List<Household> households, List<DeviceContribution> contributions) {
        this.model = Objects.requireNonNull(model);
        this.index = Objects.requireNonNull(index);
        this.timeWindow = Objects.requireNonNull(timeWindow);
        this.aggregator = Objects.requireNonNull(aggregator);
        this.households = List.copyOf(households);
        this.contributions = List.copyOf(contributions);
    }

    public M getModel() {
        return model;
    }

    public ModelIndex getIndex() {
        return index;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public Aggregator getAggregator() {
        return aggregator;
    }

    public List<Household> getHouseholds() {
        return households;
    }

    public List<DeviceContribution> getContributions() {
        return contributions;
    }

    public DeviceContribution getContribution(String householdId, String deviceId) {
        return contributions.stream()
                .filter(c -> c.householdId().equals(householdId) && c.deviceId().equals(deviceId))
                .findFirst()
                .orElseThrow(() -> new PowsyblException("Device '" + deviceId + "' of household '" + householdId + "' not found"));
    }

    public int getVariableIndex(ModelKey key) {
        return index.getVariableIndex(key);
    }

    public int getConstraintIndex(ModelKey key) {
        return index.getConstraintIndex(key);
    }
}
