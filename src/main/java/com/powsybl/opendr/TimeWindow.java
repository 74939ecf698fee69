/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.commons.PowsyblException;

import java.util.stream.IntStream;

/**
 * Time steps {@code 0..size-1} of the scheduling horizon, each of them lasting {@code deltaT} hours.
 *
 * @author Open Demand Response team
 */
public class TimeWindow {

    private final int size;

    private final double deltaT;

    public TimeWindow(int size, double deltaT) {
        if (size < 1) {
            throw new PowsyblException("Time window size must be strictly positive: " + size);
        }
        if (!(deltaT > 0) || Double.isInfinite(deltaT)) {
            throw new PowsyblException("Time step duration must be strictly positive and finite: " + deltaT);
        }
        this.size = size;
        this.deltaT = deltaT;
    }

    public int getSize() {
        return size;
    }

    /**
     * Duration of a time step, in hours.
     */
    public double getDeltaT() {
        return deltaT;
    }

    public IntStream getSteps() {
        return IntStream.range(0, size);
    }

    @Override
    public String toString() {
        return "TimeWindow(size=" + size + ", deltaT=" + deltaT + ")";
    }
}
