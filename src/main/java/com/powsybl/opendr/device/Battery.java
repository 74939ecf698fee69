/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

import com.powsybl.opendr.MilpModelBuilder;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.model.ConstraintSense;

import static com.powsybl.opendr.device.BatteryConstraintType.*;
import static com.powsybl.opendr.device.BatteryVariableType.*;

/**
 * Battery energy storage system.
 * <p>
 * Energy balance, with {@code eta = exp(-ln(2) * deltaT / halfLife)} the self-discharge factor over one step:
 * <pre>
 * soc[t] = eta * soc[t-1] + deltaT * effChg * pwrChg[t] - deltaT / effDis * pwrDis[t]
 * </pre>
 * with {@code soc[-1] = socInit}. Charging and discharging powers are bounded by their on/off indicators, which
 * cannot both be on at the same step.
 *
 * @author Open Demand Response team
 */
public class Battery extends AbstractDevice {

    private final double pwrChgMin;
    private final double pwrChgMax;
    private final double pwrDisMin;
    private final double pwrDisMax;
    private final double socMin;
    private final double socMax;
    private final double socInit;
    private final double effChg;
    private final double effDis;
    private final double halfLife;

    /**
     * @param halfLife hours for the stored energy to halve by self-discharge only, may be infinite
     */
    public Battery(String id, double pwrChgMin, double pwrChgMax, double pwrDisMin, double pwrDisMax,
                   double socMin, double socMax, double socInit, double effChg, double effDis, double halfLife) {
        super(id);
        checkPowerRange("charging power", pwrChgMin, pwrChgMax);
        checkPowerRange("discharging power", pwrDisMin, pwrDisMax);
        checkFinite("soc min", socMin);
        checkFinite("soc max", socMax);
        if (socMin > socMax) {
            throw createException("invalid state of charge range [" + socMin + ", " + socMax + "]");
        }
        checkFinite("initial soc", socInit);
        checkEfficiency("charging efficiency", effChg);
        checkEfficiency("discharging efficiency", effDis);
        if (!(halfLife > 0)) {
            throw createException("half-life must be strictly positive: " + halfLife);
        }
        this.pwrChgMin = pwrChgMin;
        this.pwrChgMax = pwrChgMax;
        this.pwrDisMin = pwrDisMin;
        this.pwrDisMax = pwrDisMax;
        this.socMin = socMin;
        this.socMax = socMax;
        this.socInit = socInit;
        this.effChg = effChg;
        this.effDis = effDis;
        this.halfLife = halfLife;
    }

    private void checkEfficiency(String name, double efficiency) {
        if (!(efficiency > 0 && efficiency <= 1)) {
            throw createException(name + " must be in ]0, 1]: " + efficiency);
        }
    }

    @Override
    public DeviceType getType() {
        return DeviceType.BATTERY;
    }

    public double getPwrChgMin() {
        return pwrChgMin;
    }

    public double getPwrChgMax() {
        return pwrChgMax;
    }

    public double getPwrDisMin() {
        return pwrDisMin;
    }

    public double getPwrDisMax() {
        return pwrDisMax;
    }

    public double getSocMin() {
        return socMin;
    }

    public double getSocMax() {
        return socMax;
    }

    public double getSocInit() {
        return socInit;
    }

    public double getEffChg() {
        return effChg;
    }

    public double getEffDis() {
        return effDis;
    }

    public double getHalfLife() {
        return halfLife;
    }

    /**
     * Fraction of the stored energy left after {@code deltaT} hours of self-discharge.
     */
    public double getSelfDischargeFactor(double deltaT) {
        return Math.exp(-Math.log(2) * deltaT / halfLife);
    }

    @Override
    public void contribute(MilpModelBuilder builder, String householdId) {
        int size = builder.getTimeWindow().getSize();
        double deltaT = builder.getTimeWindow().getDeltaT();

        // powers are bounded through the indicators
        createPowerVariables(builder, householdId, CHARGING_POWER, 1, 0);
        createPowerVariables(builder, householdId, DISCHARGING_POWER, -1, 0);
        for (int t = 0; t < size; t++) {
            builder.newVariable(getKey(householdId, STATE_OF_CHARGE, t))
                    .setBounds(socMin, socMax)
                    .add();
        }
        createIndicatorVariables(builder, householdId, CHARGING_INDICATOR, true);
        createIndicatorVariables(builder, householdId, DISCHARGING_INDICATOR, true);

        double eta = getSelfDischargeFactor(deltaT);
        for (int t = 0; t < size; t++) {
            MilpModelBuilder.ConstraintAdder energyConservation = builder.newConstraint(getKey(householdId, ENERGY_CONSERVATION, t), ConstraintSense.EQUAL)
                    .addTerm(getKey(householdId, STATE_OF_CHARGE, t), 1);
            if (t == 0) {
                energyConservation.setRhs(eta * socInit);
            } else {
                energyConservation.addTerm(getKey(householdId, STATE_OF_CHARGE, t - 1), -eta);
            }
            energyConservation.addTerm(getKey(householdId, CHARGING_POWER, t), -deltaT * effChg)
                    .addTerm(getKey(householdId, DISCHARGING_POWER, t), deltaT / effDis)
                    .add();
        }

        createIndicatorBounds(builder, householdId, CHARGING_POWER, CHARGING_INDICATOR, CHARGING_POWER_MIN, CHARGING_POWER_MAX, pwrChgMin, pwrChgMax);
        createIndicatorBounds(builder, householdId, DISCHARGING_POWER, DISCHARGING_INDICATOR, DISCHARGING_POWER_MIN, DISCHARGING_POWER_MAX, pwrDisMin, pwrDisMax);

        for (int t = 0; t < size; t++) {
            builder.newConstraint(getKey(householdId, CHARGE_DISCHARGE_EXCLUSION, t), ConstraintSense.LESS_EQUAL)
                    .setRhs(1)
                    .addTerm(getKey(householdId, CHARGING_INDICATOR, t), 1)
                    .addTerm(getKey(householdId, DISCHARGING_INDICATOR, t), 1)
                    .add();
        }
    }

    /**
     * min * indicator[t] <= power[t] <= max * indicator[t]
     */
    private void createIndicatorBounds(MilpModelBuilder builder, String householdId,
                                       BatteryVariableType power, BatteryVariableType indicator,
                                       BatteryConstraintType minType, BatteryConstraintType maxType,
                                       double min, double max) {
        int size = builder.getTimeWindow().getSize();
        for (int t = 0; t < size; t++) {
            ModelKey powerKey = getKey(householdId, power, t);
            ModelKey indicatorKey = getKey(householdId, indicator, t);
            builder.newConstraint(getKey(householdId, minType, t), ConstraintSense.LESS_EQUAL)
                    .addTerm(powerKey, -1)
                    .addTerm(indicatorKey, min)
                    .add();
        }
        for (int t = 0; t < size; t++) {
            ModelKey powerKey = getKey(householdId, power, t);
            ModelKey indicatorKey = getKey(householdId, indicator, t);
            builder.newConstraint(getKey(householdId, maxType, t), ConstraintSense.LESS_EQUAL)
                    .addTerm(powerKey, 1)
                    .addTerm(indicatorKey, -max)
                    .add();
        }
    }
}
