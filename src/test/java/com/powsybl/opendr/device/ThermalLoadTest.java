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
import com.powsybl.opendr.model.DefaultMilpModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.opendr.ModelValues.HOUSEHOLD_ID;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Demand Response team
 */
class ThermalLoadTest {

    private static final double[] TEMP_MIN = {18, 18, 18};
    private static final double[] TEMP_MAX = {22, 22, 22};
    private static final double[] TEMP_EXT = {5, 0, 10};

    private static ModelKey key(ThermalLoadVariableType type, int t) {
        return ModelKey.of(Scope.device(HOUSEHOLD_ID, "heat"), type, t);
    }

    private static ThermalLoad createHeating() {
        // heat capacity 2, conduction 0.2, efficiency 1
        return new ThermalLoad("heat", TEMP_MIN, TEMP_MAX, TEMP_EXT, 20, 1, 10, 2, 1, 0.2);
    }

    @Test
    void testStructure() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(3, 1), createHeating());
        DefaultMilpModel model = drModel.getModel();
        int pwr0 = drModel.getVariableIndex(key(ThermalLoadVariableType.POWER, 0));
        int pwr1 = drModel.getVariableIndex(key(ThermalLoadVariableType.POWER, 1));
        int temp0 = drModel.getVariableIndex(key(ThermalLoadVariableType.TEMPERATURE, 0));
        int temp1 = drModel.getVariableIndex(key(ThermalLoadVariableType.TEMPERATURE, 1));

        assertEquals(18, model.getVariable(temp1).lowerBound(), 0);
        assertEquals(22, model.getVariable(temp1).upperBound(), 0);

        DefaultMilpModel.ModelConstraint exchange0 = model.getConstraint(drModel.getConstraintIndex(
                ModelKey.of(Scope.device(HOUSEHOLD_ID, "heat"), ThermalLoadConstraintType.TEMPERATURE_EXCHANGE, 0)));
        // 20 + 0.1 * (5 - 20)
        assertEquals(18.5, exchange0.getRhs(), 1e-12);
        assertEquals(1, exchange0.getCoefficient(temp0), 0);
        assertEquals(-0.5, exchange0.getCoefficient(pwr0), 1e-12);

        DefaultMilpModel.ModelConstraint exchange1 = model.getConstraint(drModel.getConstraintIndex(
                ModelKey.of(Scope.device(HOUSEHOLD_ID, "heat"), ThermalLoadConstraintType.TEMPERATURE_EXCHANGE, 1)));
        assertEquals(0, exchange1.getRhs(), 1e-12);
        assertEquals(1, exchange1.getCoefficient(temp1), 0);
        assertEquals(-0.9, exchange1.getCoefficient(temp0), 1e-12);
        assertEquals(-0.5, exchange1.getCoefficient(pwr1), 1e-12);

        assertEquals(9, drModel.getContribution(HOUSEHOLD_ID, "heat").variables().size());
        assertEquals(9, drModel.getContribution(HOUSEHOLD_ID, "heat").constraints().size());
    }

    private static ModelValues schedule(DemandResponseModel<DefaultMilpModel> drModel, double[] pwr, double[] temp) {
        ModelValues values = new ModelValues(drModel);
        for (int t = 0; t < pwr.length; t++) {
            values.set(key(ThermalLoadVariableType.POWER, t), pwr[t])
                    .set(key(ThermalLoadVariableType.TEMPERATURE, t), temp[t])
                    .set(key(ThermalLoadVariableType.ON_INDICATOR, t), pwr[t] > 0 ? 1 : 0);
        }
        return values.completeLinks();
    }

    @Test
    void testTemperatureTrajectory() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(3, 1), createHeating());
        // temp[t] = 0.9 * temp[t-1] + 0.1 * tempExt[t] + 0.5 * pwr[t]
        double temp0 = 18.5 + 0.5 * 2;
        double temp1 = 0.9 * temp0 + 0 + 0.5 * 4;
        double temp2 = 0.9 * temp1 + 1;
        ModelValues values = schedule(drModel, new double[] {2, 4, 0}, new double[] {temp0, temp1, temp2});
        assertTrue(values.getViolations().isEmpty());

        // without heating, the temperature drops below the minimum
        values = schedule(drModel, new double[] {0, 0, 0}, new double[] {18.5, 0.9 * 18.5, 0.9 * 0.9 * 18.5 + 1});
        assertEquals(List.of("HH_0/heat/temp/1", "HH_0/heat/temp/2"), values.getViolations());

        // heating below the minimum power
        values = schedule(drModel, new double[] {0.5, 4, 2}, new double[] {18.75, 0.9 * 18.75 + 2, 0.9 * (0.9 * 18.75 + 2) + 2});
        assertEquals(List.of("HH_0/heat/pwr_th_min/0"), values.getViolations());
    }

    @Test
    void testInvalidParameters() {
        double[] shortSeries = {18, 18};
        assertThrows(DeviceParameterException.class, () -> new ThermalLoad("heat", shortSeries, TEMP_MAX, TEMP_EXT, 20, 0, 10, 2, 1, 0.2));
        assertThrows(DeviceParameterException.class, () -> new ThermalLoad("heat", TEMP_MAX, TEMP_MIN, TEMP_EXT, 20, 0, 10, 2, 1, 0.2));
        assertThrows(DeviceParameterException.class, () -> new ThermalLoad("heat", TEMP_MIN, TEMP_MAX, TEMP_EXT, 20, 0, 10, 0, 1, 0.2));
        assertThrows(DeviceParameterException.class, () -> new ThermalLoad("heat", TEMP_MIN, TEMP_MAX, TEMP_EXT, 20, 11, 10, 2, 1, 0.2));

        ThermalLoad heating = createHeating();
        TimeWindow timeWindow = new TimeWindow(4, 1);
        DeviceParameterException e = assertThrows(DeviceParameterException.class, () -> heating.validate(timeWindow));
        assertEquals("ThermalLoad 'heat': temp min has 3 values, expected 4", e.getMessage());
    }
}
