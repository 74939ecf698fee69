/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.scenario;

import com.powsybl.commons.config.PlatformConfig;

/**
 * Share of the households owning each kind of equipment. Households owning PV panels also own an electric
 * vehicle and a home battery, and only households owning a clothes washer may own a clothes dryer.
 *
 * @author Open Demand Response team
 */
public class OwnershipRates {

    public static final String MODULE_NAME = "demand-response-ownership-rates";

    public static final double PV_DEFAULT_VALUE = 0.2;
    public static final double DISHWASHER_DEFAULT_VALUE = 0.6;
    public static final double CLOTHES_WASHER_DEFAULT_VALUE = 0.8;
    public static final double CLOTHES_DRYER_DEFAULT_VALUE = 0.6;
    public static final double HEATING_DEFAULT_VALUE = 0.5;

    private double pv = PV_DEFAULT_VALUE;

    private double dishwasher = DISHWASHER_DEFAULT_VALUE;

    private double clothesWasher = CLOTHES_WASHER_DEFAULT_VALUE;

    private double clothesDryer = CLOTHES_DRYER_DEFAULT_VALUE;

    private double heating = HEATING_DEFAULT_VALUE;

    private static double checkRate(String name, double rate) {
        if (!(rate >= 0 && rate <= 1)) {
            throw new IllegalArgumentException("Invalid " + name + " ownership rate: " + rate);
        }
        return rate;
    }

    public double getPv() {
        return pv;
    }

    public OwnershipRates setPv(double pv) {
        this.pv = checkRate("pv", pv);
        return this;
    }

    public double getDishwasher() {
        return dishwasher;
    }

    public OwnershipRates setDishwasher(double dishwasher) {
        this.dishwasher = checkRate("dishwasher", dishwasher);
        return this;
    }

    public double getClothesWasher() {
        return clothesWasher;
    }

    public OwnershipRates setClothesWasher(double clothesWasher) {
        this.clothesWasher = checkRate("clothes washer", clothesWasher);
        return this;
    }

    public double getClothesDryer() {
        return clothesDryer;
    }

    public OwnershipRates setClothesDryer(double clothesDryer) {
        this.clothesDryer = checkRate("clothes dryer", clothesDryer);
        return this;
    }

    public double getHeating() {
        return heating;
    }

    public OwnershipRates setHeating(double heating) {
        this.heating = checkRate("heating", heating);
        return this;
    }

    /**
     * Probability for a household owning a clothes washer to also own a clothes dryer.
     */
    public double getClothesDryerGivenWasher() {
        return clothesWasher > 0 ? clothesDryer / clothesWasher : 0;
    }

    public static OwnershipRates load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OwnershipRates load(PlatformConfig platformConfig) {
        OwnershipRates rates = new OwnershipRates();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> rates
                .setPv(config.getDoubleProperty("pv", PV_DEFAULT_VALUE))
                .setDishwasher(config.getDoubleProperty("dishwasher", DISHWASHER_DEFAULT_VALUE))
                .setClothesWasher(config.getDoubleProperty("clothesWasher", CLOTHES_WASHER_DEFAULT_VALUE))
                .setClothesDryer(config.getDoubleProperty("clothesDryer", CLOTHES_DRYER_DEFAULT_VALUE))
                .setHeating(config.getDoubleProperty("heating", HEATING_DEFAULT_VALUE)));
        return rates;
    }

    @Override
    public String toString() {
        return "OwnershipRates(" +
                "pv=" + pv +
                ", dishwasher=" + dishwasher +
                ", clothesWasher=" + clothesWasher +
                ", clothesDryer=" + clothesDryer +
                ", heating=" + heating +
                ')';
    }
}
