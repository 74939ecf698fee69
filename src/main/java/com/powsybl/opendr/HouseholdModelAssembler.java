/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.opendr.device.Device;
import com.powsybl.opendr.device.DeviceParameterException;
import com.powsybl.opendr.index.ModelIndex;
import com.powsybl.opendr.model.ConstraintSense;
import com.powsybl.opendr.model.DefaultMilpModel;
import com.powsybl.opendr.model.MilpModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.powsybl.opendr.util.Markers.PERFORMANCE_MARKER;

/**
 * Builds the demand response model of a set of households:
 * <ul>
 *     <li>for each step, a total load variable priced in the objective, linked to the sum of the household net
 *     loads,</li>
 *     <li>for each household and step, a net load variable linked to the sum of its device powers,</li>
 *     <li>the variables and constraints of each device.</li>
 * </ul>
 * All the parameters are checked before the model is modified, so that a failing assembly leaves the model
 * untouched.
 *
 * @author Open Demand Response team
 */
public class HouseholdModelAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(HouseholdModelAssembler.class);

    private final ModelAssemblyParameters parameters;

    public HouseholdModelAssembler() {
        this(new ModelAssemblyParameters());
    }

    public HouseholdModelAssembler(ModelAssemblyParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public ModelAssemblyParameters getParameters() {
        return parameters;
    }

    public DemandResponseModel<DefaultMilpModel> assemble(List<Household> households, Aggregator aggregator, TimeWindow timeWindow) {
        return assemble(households, aggregator, timeWindow, new DefaultMilpModel());
    }

    public <M extends MilpModel> DemandResponseModel<M> assemble(List<Household> households, Aggregator aggregator,
                                                                 TimeWindow timeWindow, M model) {
        Objects.requireNonNull(households);
        Objects.requireNonNull(aggregator);
        Objects.requireNonNull(timeWindow);
        Objects.requireNonNull(model);

        Stopwatch stopwatch = Stopwatch.createStarted();

        validate(households, aggregator, timeWindow);

        ModelIndex index = new ModelIndex();
        MilpModelBuilder builder = new MilpModelBuilder(model, index, timeWindow, parameters);

        createAggregation(builder, aggregator, timeWindow);

        List<DeviceContribution> contributions = new ArrayList<>();
        for (Household household : households) {
            createHouseholdLinks(builder, household, timeWindow);
            for (Device device : household.getDevices()) {
                contributions.add(builder.contribute(device, household.getId()));
            }
            LOGGER.debug("Household '{}' with {} devices added to the model", household.getId(), household.getDevices().size());
        }

        stopwatch.stop();
        LOGGER.info("Demand response model of {} households over {} steps: {} variables, {} constraints",
                households.size(), timeWindow.getSize(), model.getVariableCount(), model.getConstraintCount());
        LOGGER.info(PERFORMANCE_MARKER, "Demand response model assembled in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));

        return new DemandResponseModel<>(model, index, timeWindow, aggregator, households, contributions);
    }

    private void validate(List<Household> households, Aggregator aggregator, TimeWindow timeWindow) {
        if (parameters.getHouseholdNetLoadMin() > parameters.getHouseholdNetLoadMax()) {
            throw new PowsyblException("Invalid household net load range: " + parameters);
        }
        aggregator.validate(timeWindow);
        Set<String> householdIds = new HashSet<>();
        for (Household household : households) {
            if (!householdIds.add(household.getId())) {
                throw new DeviceParameterException("Several households with id '" + household.getId() + "'");
            }
            household.validate(timeWindow);
        }
    }

    private static void createAggregation(MilpModelBuilder builder, Aggregator aggregator, TimeWindow timeWindow) {
        for (int t = 0; t < timeWindow.getSize(); t++) {
            builder.newVariable(LinkingKeys.totalLoad(t))
                    .setBounds(aggregator.getTotalLoadMin(t), aggregator.getTotalLoadMax(t))
                    .setObjectiveCoefficient(timeWindow.getDeltaT() * aggregator.getPrice(t))
                    .add();
        }
        for (int t = 0; t < timeWindow.getSize(); t++) {
            builder.newConstraint(LinkingKeys.totalLoadLink(t), ConstraintSense.EQUAL)
                    .addTerm(LinkingKeys.totalLoad(t), -1)
                    .add();
        }
    }

    private void createHouseholdLinks(MilpModelBuilder builder, Household household, TimeWindow timeWindow) {
        String householdId = household.getId();
        for (int t = 0; t < timeWindow.getSize(); t++) {
            builder.newVariable(LinkingKeys.netLoad(householdId, t))
                    .setBounds(parameters.getHouseholdNetLoadMin(), parameters.getHouseholdNetLoadMax())
                    .addToConstraint(LinkingKeys.totalLoadLink(t), 1)
                    .add();
        }
        for (int t = 0; t < timeWindow.getSize(); t++) {
            builder.newConstraint(LinkingKeys.netLoadLink(householdId, t), ConstraintSense.EQUAL)
                    .addTerm(LinkingKeys.netLoad(householdId, t), -1)
                    .add();
        }
    }
}
