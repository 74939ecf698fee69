/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

import com.powsybl.opendr.DemandResponseModel;
import com.powsybl.opendr.LinkingKeys;
import com.powsybl.opendr.ModelValues;
import com.powsybl.opendr.TimeWindow;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.index.Scope;
import com.powsybl.opendr.model.ConstraintSense;
import com.powsybl.opendr.model.DefaultMilpModel;
import com.powsybl.opendr.model.VariableKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.opendr.ModelValues.HOUSEHOLD_ID;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Demand Response team
 */
class BatteryTest {

    private static ModelKey key(BatteryVariableType type, int t) {
        return ModelKey.of(Scope.device(HOUSEHOLD_ID, "bat"), type, t);
    }

    private static ModelKey key(BatteryConstraintType type, int t) {
        return ModelKey.of(Scope.device(HOUSEHOLD_ID, "bat"), type, t);
    }

    private static Battery createLosslessBattery() {
        return new Battery("bat", 0, 4, 0, 4, 0, 10, 3, 1, 1, Double.POSITIVE_INFINITY);
    }

    @Test
    void testSelfDischargeFactor() {
        assertEquals(1, createLosslessBattery().getSelfDischargeFactor(1), 0);
        Battery battery = new Battery("bat", 0, 4, 0, 4, 0, 10, 3, 1, 1, 2);
        assertEquals(0.5, battery.getSelfDischargeFactor(2), 1e-12);
        assertEquals(Math.sqrt(0.5), battery.getSelfDischargeFactor(1), 1e-12);
    }

    @Test
    void testStructure() {
        Battery battery = new Battery("bat", 1, 4, 0.5, 3, 2, 10, 3, 0.9, 0.8, 2);
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(2, 0.5), battery);
        DefaultMilpModel model = drModel.getModel();
        double eta = battery.getSelfDischargeFactor(0.5);

        int chg0 = drModel.getVariableIndex(key(BatteryVariableType.CHARGING_POWER, 0));
        int dis0 = drModel.getVariableIndex(key(BatteryVariableType.DISCHARGING_POWER, 0));
        int soc0 = drModel.getVariableIndex(key(BatteryVariableType.STATE_OF_CHARGE, 0));
        int soc1 = drModel.getVariableIndex(key(BatteryVariableType.STATE_OF_CHARGE, 1));
        int chgInd0 = drModel.getVariableIndex(key(BatteryVariableType.CHARGING_INDICATOR, 0));

        assertEquals(new DefaultMilpModel.ModelVariable("HH_0/bat/soc/1", 2, 10, VariableKind.CONTINUOUS, 0), model.getVariable(soc1));
        assertEquals(new DefaultMilpModel.ModelVariable("HH_0/bat/chg_ind/0", 0, 1, VariableKind.BINARY, 0), model.getVariable(chgInd0));
        assertEquals(0, model.getVariable(chg0).lowerBound(), 0);
        assertEquals(Double.POSITIVE_INFINITY, model.getVariable(chg0).upperBound());

        DefaultMilpModel.ModelConstraint link = model.getConstraint(drModel.getConstraintIndex(LinkingKeys.netLoadLink(HOUSEHOLD_ID, 0)));
        assertEquals(1, link.getCoefficient(chg0), 0);
        assertEquals(-1, link.getCoefficient(dis0), 0);

        DefaultMilpModel.ModelConstraint energy0 = model.getConstraint(drModel.getConstraintIndex(key(BatteryConstraintType.ENERGY_CONSERVATION, 0)));
        assertEquals(ConstraintSense.EQUAL, energy0.getSense());
        assertEquals(eta * 3, energy0.getRhs(), 1e-12);
        assertEquals(1, energy0.getCoefficient(soc0), 0);
        assertEquals(-0.5 * 0.9, energy0.getCoefficient(chg0), 1e-12);
        assertEquals(0.5 / 0.8, energy0.getCoefficient(dis0), 1e-12);

        DefaultMilpModel.ModelConstraint energy1 = model.getConstraint(drModel.getConstraintIndex(key(BatteryConstraintType.ENERGY_CONSERVATION, 1)));
        assertEquals(0, energy1.getRhs(), 0);
        assertEquals(-eta, energy1.getCoefficient(soc0), 1e-12);
        assertEquals(1, energy1.getCoefficient(soc1), 0);

        DefaultMilpModel.ModelConstraint chgMin = model.getConstraint(drModel.getConstraintIndex(key(BatteryConstraintType.CHARGING_POWER_MIN, 0)));
        assertEquals(ConstraintSense.LESS_EQUAL, chgMin.getSense());
        assertEquals(-1, chgMin.getCoefficient(chg0), 0);
        assertEquals(1, chgMin.getCoefficient(chgInd0), 0);
        DefaultMilpModel.ModelConstraint chgMax = model.getConstraint(drModel.getConstraintIndex(key(BatteryConstraintType.CHARGING_POWER_MAX, 0)));
        assertEquals(1, chgMax.getCoefficient(chg0), 0);
        assertEquals(-4, chgMax.getCoefficient(chgInd0), 0);

        assertEquals(10, drModel.getContribution(HOUSEHOLD_ID, "bat").variables().size());
        assertEquals(12, drModel.getContribution(HOUSEHOLD_ID, "bat").constraints().size());
    }

    private static ModelValues schedule(DemandResponseModel<DefaultMilpModel> drModel, double[] chg, double[] dis, double[] soc) {
        ModelValues values = new ModelValues(drModel);
        for (int t = 0; t < chg.length; t++) {
            values.set(key(BatteryVariableType.CHARGING_POWER, t), chg[t])
                    .set(key(BatteryVariableType.DISCHARGING_POWER, t), dis[t])
                    .set(key(BatteryVariableType.STATE_OF_CHARGE, t), soc[t])
                    .set(key(BatteryVariableType.CHARGING_INDICATOR, t), chg[t] > 0 ? 1 : 0)
                    .set(key(BatteryVariableType.DISCHARGING_INDICATOR, t), dis[t] > 0 ? 1 : 0);
        }
        return values.completeLinks();
    }

    @Test
    void testRoundTrip() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(4, 0.5), createLosslessBattery());
        // soc[t] = socInit + deltaT * sum of (chg - dis)
        ModelValues values = schedule(drModel, new double[] {4, 4, 0, 0}, new double[] {0, 0, 2, 4}, new double[] {5, 7, 6, 4});
        assertTrue(values.getViolations().isEmpty());
        assertEquals(4, values.get(LinkingKeys.netLoad(HOUSEHOLD_ID, 0)), 0);
        assertEquals(-4, values.get(LinkingKeys.netLoad(HOUSEHOLD_ID, 3)), 0);

        // one more charging step would go above the capacity
        values = schedule(drModel, new double[] {4, 4, 4, 4}, new double[] {0, 0, 0, 0}, new double[] {5, 7, 9, 11});
        assertEquals(List.of("HH_0/bat/soc/3"), values.getViolations());

        // inconsistent state of charge
        values = schedule(drModel, new double[] {4, 4, 0, 0}, new double[] {0, 0, 2, 4}, new double[] {5, 7, 6, 5});
        assertEquals(List.of("HH_0/bat/ener_cons/3"), values.getViolations());
    }

    @Test
    void testChargeDischargeExclusion() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(1, 1), createLosslessBattery());
        ModelValues values = schedule(drModel, new double[] {2}, new double[] {2}, new double[] {3});
        assertEquals(List.of("HH_0/bat/cstr_bin/0"), values.getViolations());

        // power without its indicator
        values = schedule(drModel, new double[] {2}, new double[] {0}, new double[] {5})
                .set(key(BatteryVariableType.CHARGING_INDICATOR, 0), 0);
        assertEquals(List.of("HH_0/bat/pwr_chg_max/0"), values.getViolations());
    }

    @Test
    void testChargeRate() {
        Battery battery = new Battery("bat", 0, 6, 0, 6, 0, 10, 0, 0.9, 0.9, 693149);
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(3, 1), battery);
        double eta = battery.getSelfDischargeFactor(1);

        // full power during one step brings the battery to 5.4, then the remaining capacity is filled
        double chg1 = (10 - eta * 5.4) / 0.9;
        ModelValues values = schedule(drModel, new double[] {6, chg1, 0}, new double[] {0, 0, 0}, new double[] {5.4, 10, eta * 10});
        assertTrue(chg1 < 6);
        assertTrue(values.getViolations().isEmpty());

        // charging faster than the maximum power
        values = schedule(drModel, new double[] {5.5 / 0.9, 0, 0}, new double[] {0, 0, 0},
                new double[] {5.5, eta * 5.5, eta * eta * 5.5});
        assertEquals(List.of("HH_0/bat/pwr_chg_max/0"), values.getViolations());
    }

    @Test
    void testRelaxedIndicators() {
        DemandResponseModel<DefaultMilpModel> drModel = ModelValues.assemble(new TimeWindow(1, 1), false, createLosslessBattery());
        DefaultMilpModel.ModelVariable indicator = drModel.getModel().getVariable(drModel.getVariableIndex(key(BatteryVariableType.DISCHARGING_INDICATOR, 0)));
        assertEquals(VariableKind.CONTINUOUS, indicator.kind());
        assertEquals(1, indicator.upperBound(), 0);
    }

    @Test
    void testInvalidParameters() {
        DeviceParameterException e = assertThrows(DeviceParameterException.class, () -> new Battery("bat", 0, 4, 0, 4, 0, 10, 3, 0, 1, 1));
        assertEquals("Battery 'bat': charging efficiency must be in ]0, 1]: 0.0", e.getMessage());
        assertThrows(DeviceParameterException.class, () -> new Battery("bat", 0, 4, 0, 4, 0, 10, 3, 1, 1.1, 1));
        assertThrows(DeviceParameterException.class, () -> new Battery("bat", 0, 4, 0, 4, 0, 10, 3, 1, 1, 0));
        assertThrows(DeviceParameterException.class, () -> new Battery("bat", 5, 4, 0, 4, 0, 10, 3, 1, 1, 1));
        assertThrows(DeviceParameterException.class, () -> new Battery("bat", 0, 4, -1, 4, 0, 10, 3, 1, 1, 1));
        assertThrows(DeviceParameterException.class, () -> new Battery("bat", 0, 4, 0, 4, 10, 0, 3, 1, 1, 1));
        assertThrows(DeviceParameterException.class, () -> new Battery("bat", 0, 4, 0, 4, 0, 10, Double.NaN, 1, 1, 1));
        assertThrows(DeviceParameterException.class, () -> new Battery("", 0, 4, 0, 4, 0, 10, 3, 1, 1, 1));
    }
}
