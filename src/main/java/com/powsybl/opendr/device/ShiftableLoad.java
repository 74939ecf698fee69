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
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.index.Scope;
import com.powsybl.opendr.model.ConstraintSense;
import org.apache.commons.lang3.Range;

import java.util.Objects;

import static com.powsybl.opendr.device.ShiftableLoadConstraintType.*;
import static com.powsybl.opendr.device.ShiftableLoadVariableType.*;

/**
 * Non interruptible load running one or several cycles in sequence, for instance a dishwasher.
 * <p>
 * Cycle {@code k} starts exactly once in {@code [tStartMin[k], tStartMax[k]]}, then follows its power profile
 * {@code cycles[k]}, one value per step. A cycle cannot start before the previous one is over.
 *
 * @author Open Demand Response team
 */
public class ShiftableLoad extends AbstractDevice {

    private final int[] tStartMin;
    private final int[] tStartMax;
    private final double[][] cycles;

    public ShiftableLoad(String id, int[] tStartMin, int[] tStartMax, double[][] cycles) {
        super(id);
        Objects.requireNonNull(tStartMin);
        Objects.requireNonNull(tStartMax);
        Objects.requireNonNull(cycles);
        if (tStartMin.length != cycles.length || tStartMax.length != cycles.length) {
            throw createException(cycles.length + " cycles but " + tStartMin.length + " min start times and "
                    + tStartMax.length + " max start times");
        }
        this.tStartMin = tStartMin.clone();
        this.tStartMax = tStartMax.clone();
        this.cycles = new double[cycles.length][];
        for (int k = 0; k < cycles.length; k++) {
            if (tStartMin[k] < 0 || tStartMin[k] > tStartMax[k]) {
                throw createException("invalid start window [" + tStartMin[k] + ", " + tStartMax[k] + "] for cycle " + k);
            }
            this.cycles[k] = checkFinite("cycle " + k, cycles[k]);
            if (this.cycles[k].length == 0) {
                throw createException("cycle " + k + " is empty");
            }
        }
    }

    @Override
    public DeviceType getType() {
        return DeviceType.SHIFTABLE_LOAD;
    }

    public int getCycleCount() {
        return cycles.length;
    }

    public int getTStartMin(int cycle) {
        return tStartMin[cycle];
    }

    public int getTStartMax(int cycle) {
        return tStartMax[cycle];
    }

    /**
     * Allowed start times of a cycle, bounds included.
     */
    public Range<Integer> getStartWindow(int cycle) {
        return Range.of(tStartMin[cycle], tStartMax[cycle]);
    }

    @SuppressWarnings("unchecked")
    private Range<Integer>[] getStartWindows() {
        Range<Integer>[] startWindows = new Range[cycles.length];
        for (int k = 0; k < cycles.length; k++) {
            startWindows[k] = getStartWindow(k);
        }
        return startWindows;
    }

    public double[] getCycle(int cycle) {
        return cycles[cycle].clone();
    }

    public int getDuration(int cycle) {
        return cycles[cycle].length;
    }

    /**
     * Check that every cycle can end within the time window and that the cycles can be run one after the other.
     */
    @Override
    public void validate(TimeWindow timeWindow) {
        super.validate(timeWindow);
        for (int k = 0; k < cycles.length; k++) {
            Range<Integer> startWindow = getStartWindow(k);
            if (startWindow.getMaximum() > timeWindow.getSize() - getDuration(k)) {
                throw createException("cycle " + k + " may end after the time window: latest start " + startWindow.getMaximum()
                        + ", duration " + getDuration(k) + ", window size " + timeWindow.getSize());
            }
        }
        // starting each cycle as early as possible gives a schedule if any exists
        int earliestStart = 0;
        for (int k = 0; k < cycles.length; k++) {
            Range<Integer> startWindow = getStartWindow(k);
            earliestStart = Math.max(startWindow.getMinimum(), earliestStart);
            if (startWindow.isBefore(earliestStart)) {
                throw createException("cycle " + k + " cannot start before " + earliestStart
                        + " while its latest start is " + startWindow.getMaximum());
            }
            // cannot overflow, the cycle ends within the time window
            earliestStart += getDuration(k);
        }
    }

    private ModelKey getStartKey(Scope scope, int cycle, int time) {
        return ModelKey.of(scope, START_INDICATOR, cycle, time);
    }

    @Override
    public void contribute(MilpModelBuilder builder, String householdId) {
        int size = builder.getTimeWindow().getSize();
        Scope scope = getScope(householdId);

        // equal to the superposition of the cycle profiles
        createPowerVariables(builder, householdId, POWER, 1, Double.NEGATIVE_INFINITY);
        Range<Integer>[] startWindows = getStartWindows();
        for (int k = 0; k < cycles.length; k++) {
            for (int t = tStartMin[k]; t <= tStartMax[k]; t++) {
                builder.newVariable(getStartKey(scope, k, t))
                        .setIndicator()
                        .add();
            }
        }

        for (int k = 0; k < cycles.length; k++) {
            MilpModelBuilder.ConstraintAdder startUp = builder.newConstraint(ModelKey.ofIndex(scope, START_UP, k), ConstraintSense.EQUAL)
                    .setRhs(1);
            for (int t = tStartMin[k]; t <= tStartMax[k]; t++) {
                startUp.addTerm(getStartKey(scope, k, t), 1);
            }
            startUp.add();
        }

        for (int t = 0; t < size; t++) {
            MilpModelBuilder.ConstraintAdder netPower = builder.newConstraint(getKey(householdId, NET_POWER, t), ConstraintSense.EQUAL)
                    .addTerm(getKey(householdId, POWER, t), 1);
            for (int k = 0; k < cycles.length; k++) {
                for (int d = 0; d < cycles[k].length; d++) {
                    int start = t - d;
                    if (startWindows[k].contains(start)) {
                        netPower.addTerm(getStartKey(scope, k, start), -cycles[k][d]);
                    }
                }
            }
            netPower.add();
        }

        // with exactly one start indicator set per cycle, sum of t * u[k, t] is the start time of cycle k
        for (int k = 1; k < cycles.length; k++) {
            MilpModelBuilder.ConstraintAdder sequence = builder.newConstraint(ModelKey.ofIndex(scope, CYCLE_SEQUENCE, k), ConstraintSense.GREATER_EQUAL)
                    .setRhs(getDuration(k - 1));
            for (int t = tStartMin[k - 1]; t <= tStartMax[k - 1]; t++) {
                sequence.addTerm(getStartKey(scope, k - 1, t), -t);
            }
            for (int t = tStartMin[k]; t <= tStartMax[k]; t++) {
                sequence.addTerm(getStartKey(scope, k, t), t);
            }
            sequence.add();
        }
    }
}
