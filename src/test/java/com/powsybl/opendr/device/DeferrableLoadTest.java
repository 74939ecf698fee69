/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

import com.powsybl.opendr.DemandResponseModel;
import com.powsybl.opendr.ModelValues;
import com.powsybl.opendr.TimeWindow;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.index.Scope;
import com.powsybl.opendr.model.ConstraintSense;
import com.powsybl.opendr.model.DefaultMilpModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.opendr.ModelValues.HOUSEHOLD_ID;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Demand Response team
 */
class DeferrableLoadTest {

    private static final Scope SCOPE = Scope.device(HOUSEHOLD_ID, "EV");

    private static DeferrableLoad createVehicle() {
        // available during the last two steps only
        return new DeferrableLoad("EV", 6, 8, new double[] {0, 0, 1, 1}, new double[] {0, 0, 4, 4});
    }

    private static ModelValues schedule(DemandResponseModel<DefaultMilpModel> drModel, double[] pwr, double[] u) {
        ModelValues values = new ModelValues(drModel);
        for (int t = 0; t < pwr.length; t++) {
            values.set(ModelKey.of(SCOPE, DeferrableLoadVariableType.POWER, t), pwr[t])
                    .set(ModelKey.of(SCOPE, DeferrableLoadVariableType.ON_INDICATOR, t), u[t]);
        }
        return values.completeLinks();
    }

    @Test
    void testStructure() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(4, 0.5), createVehicle());
        DefaultMilpModel model = drModel.getModel();
        DefaultMilpModel.ModelConstraint energyMin = model.getConstraint(drModel.getConstraintIndex(ModelKey.of(SCOPE, DeferrableLoadConstraintType.TOTAL_ENERGY_MIN)));
        DefaultMilpModel.ModelConstraint energyMax = model.getConstraint(drModel.getConstraintIndex(ModelKey.of(SCOPE, DeferrableLoadConstraintType.TOTAL_ENERGY_MAX)));
        assertEquals("HH_0/EV/E_tot_min", energyMin.getName());
        assertEquals(ConstraintSense.GREATER_EQUAL, energyMin.getSense());
        assertEquals(ConstraintSense.LESS_EQUAL, energyMax.getSense());
        assertEquals(6, energyMin.getRhs(), 0);
        assertEquals(8, energyMax.getRhs(), 0);
        assertEquals(4, energyMin.getRow().size());
        for (int t = 0; t < 4; t++) {
            int pwr = drModel.getVariableIndex(ModelKey.of(SCOPE, DeferrableLoadVariableType.POWER, t));
            assertEquals(0.5, energyMin.getCoefficient(pwr), 0);
            assertEquals(0.5, energyMax.getCoefficient(pwr), 0);
            assertEquals(Double.NEGATIVE_INFINITY, model.getVariable(pwr).lowerBound());
        }
        assertEquals(2 + 2 * 4, drModel.getContribution(HOUSEHOLD_ID, "EV").constraints().size());
    }

    @Test
    void testSchedules() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(4, 1), createVehicle());
        assertTrue(schedule(drModel, new double[] {0, 0, 3, 4}, new double[] {0, 0, 1, 1}).getViolations().isEmpty());
        assertTrue(schedule(drModel, new double[] {0, 0, 4, 4}, new double[] {0, 0, 1, 1}).getViolations().isEmpty());

        // not enough energy
        assertEquals(List.of("HH_0/EV/E_tot_min"), schedule(drModel, new double[] {0, 0, 1, 1}, new double[] {0, 0, 1, 1}).getViolations());
        // charging while not available
        assertEquals(List.of("HH_0/EV/pwr_max/0"), schedule(drModel, new double[] {2, 0, 2, 3}, new double[] {1, 0, 1, 1}).getViolations());
        // charging below the minimum power
        assertEquals(List.of("HH_0/EV/E_tot_min", "HH_0/EV/pwr_min/3"), schedule(drModel, new double[] {0, 0, 4, 0.5}, new double[] {0, 0, 1, 1}).getViolations());
    }

    @Test
    void testInvalidParameters() {
        double[] pwrMin = {0, 1};
        double[] pwrMax = {0, 4};
        assertThrows(DeviceParameterException.class, () -> new DeferrableLoad("EV", 8, 6, pwrMin, pwrMax));
        assertThrows(DeviceParameterException.class, () -> new DeferrableLoad("EV", 6, 8, pwrMax, pwrMin));
        assertThrows(DeviceParameterException.class, () -> new DeferrableLoad("EV", 6, 8, new double[] {0}, pwrMax));
        assertThrows(DeviceParameterException.class, () -> new DeferrableLoad("EV", 6, Double.POSITIVE_INFINITY, pwrMin, pwrMax));
        DeferrableLoad vehicle = new DeferrableLoad("EV", 6, 8, pwrMin, pwrMax);
        TimeWindow timeWindow = new TimeWindow(3, 1);
        assertThrows(DeviceParameterException.class, () -> vehicle.validate(timeWindow));
    }
}
