/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * System wide view of the households: energy price and bounds on the total load, per time step.
 * Bounds may be infinite.
 *
 * @author Open Demand Response team
 */
public class Aggregator {

    private final double[] price;

    private final double[] totalLoadMin;

    private final double[] totalLoadMax;

    public Aggregator(double[] price, double[] totalLoadMin, double[] totalLoadMax) {
        Objects.requireNonNull(price);
        Objects.requireNonNull(totalLoadMin);
        Objects.requireNonNull(totalLoadMax);
        if (totalLoadMin.length != price.length || totalLoadMax.length != price.length) {
            throw new PowsyblException("Aggregator series have different lengths: price " + price.length
                    + ", total load min " + totalLoadMin.length + ", total load max " + totalLoadMax.length);
        }
        for (int t = 0; t < price.length; t++) {
            if (!Double.isFinite(price[t])) {
                throw new PowsyblException("Price at step " + t + " is not finite: " + price[t]);
            }
            if (Double.isNaN(totalLoadMin[t]) || Double.isNaN(totalLoadMax[t]) || totalLoadMin[t] > totalLoadMax[t]) {
                throw new PowsyblException("Invalid total load range at step " + t + ": [" + totalLoadMin[t] + ", " + totalLoadMax[t] + "]");
            }
        }
        this.price = price.clone();
        this.totalLoadMin = totalLoadMin.clone();
        this.totalLoadMax = totalLoadMax.clone();
    }

    public double getPrice(int time) {
        return price[time];
    }

    public double getTotalLoadMin(int time) {
        return totalLoadMin[time];
    }

    public double getTotalLoadMax(int time) {
        return totalLoadMax[time];
    }

    public int getSize() {
        return price.length;
    }

    public void validate(TimeWindow timeWindow) {
        Objects.requireNonNull(timeWindow);
        if (price.length != timeWindow.getSize()) {
            throw new PowsyblException("Aggregator series have " + price.length + " values, expected " + timeWindow.getSize());
        }
    }
}
