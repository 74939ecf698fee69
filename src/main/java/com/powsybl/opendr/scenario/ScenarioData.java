/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.scenario;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * Hourly input series of a scenario, one value per time step: energy price, household load and PV production
 * normalized by their mean, and outside temperature.
 *
 * @author Open Demand Response team
 */
public class ScenarioData {

    private final double[] price;

    private final double[] loadNorm;

    private final double[] pvNorm;

    private final double[] temperature;

    public ScenarioData(double[] price, double[] loadNorm, double[] pvNorm, double[] temperature) {
        this.price = check("price", price);
        this.loadNorm = check("load", loadNorm);
        this.pvNorm = check("pv", pvNorm);
        this.temperature = check("temperature", temperature);
        if (loadNorm.length != price.length || pvNorm.length != price.length || temperature.length != price.length) {
            throw new PowsyblException("Scenario series have different lengths");
        }
    }

    private static double[] check(String name, double[] values) {
        Objects.requireNonNull(values, name);
        for (int t = 0; t < values.length; t++) {
            if (!Double.isFinite(values[t])) {
                throw new PowsyblException("Scenario " + name + " at step " + t + " is not finite: " + values[t]);
            }
        }
        return values.clone();
    }

    public int getSize() {
        return price.length;
    }

    public double[] getPrice() {
        return price.clone();
    }

    public double[] getLoadNorm() {
        return loadNorm.clone();
    }

    public double[] getPvNorm() {
        return pvNorm.clone();
    }

    public double[] getTemperature() {
        return temperature.clone();
    }
}
