/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.scenario;

import com.powsybl.commons.config.ModuleConfig;
import com.powsybl.commons.config.PlatformConfig;

/**
 * Physical parameters of the generated devices. Shiftable load cycles draw 1 kW at each of their steps.
 *
 * @author Open Demand Response team
 */
public class DeviceParameters {

    public static final String MODULE_NAME = "demand-response-devices-default-parameters";

    public static final String DISHWASHER_CYCLE_LENGTH_PARAM_NAME = "dishwasherCycleLength";
    public static final String CLOTHES_WASHER_CYCLE_LENGTH_PARAM_NAME = "clothesWasherCycleLength";
    public static final String CLOTHES_DRYER_CYCLE_LENGTH_PARAM_NAME = "clothesDryerCycleLength";
    public static final String EV_POWER_MIN_PARAM_NAME = "evPowerMin";
    public static final String EV_POWER_MAX_PARAM_NAME = "evPowerMax";
    public static final String EV_ENERGY_MIN_PARAM_NAME = "evEnergyMin";
    public static final String EV_ENERGY_MAX_PARAM_NAME = "evEnergyMax";
    public static final String EV_CHARGING_START_HOUR_PARAM_NAME = "evChargingStartHour";
    public static final String HEATING_POWER_MIN_PARAM_NAME = "heatingPowerMin";
    public static final String HEATING_POWER_MAX_PARAM_NAME = "heatingPowerMax";
    public static final String HEATING_EFFICIENCY_PARAM_NAME = "heatingEfficiency";
    public static final String HEATING_CAPACITY_PARAM_NAME = "heatingCapacity";
    public static final String HEATING_CONDUCTION_PARAM_NAME = "heatingConduction";
    public static final String HEATING_TEMPERATURE_INIT_PARAM_NAME = "heatingTemperatureInit";
    public static final String HEATING_TEMPERATURE_MIN_PARAM_NAME = "heatingTemperatureMin";
    public static final String HEATING_TEMPERATURE_MAX_PARAM_NAME = "heatingTemperatureMax";
    public static final String BATTERY_SOC_MIN_PARAM_NAME = "batterySocMin";
    public static final String BATTERY_SOC_MAX_PARAM_NAME = "batterySocMax";
    public static final String BATTERY_SOC_INIT_PARAM_NAME = "batterySocInit";
    public static final String BATTERY_POWER_MIN_PARAM_NAME = "batteryPowerMin";
    public static final String BATTERY_POWER_MAX_PARAM_NAME = "batteryPowerMax";
    public static final String BATTERY_EFFICIENCY_PARAM_NAME = "batteryEfficiency";
    public static final String BATTERY_HALF_LIFE_PARAM_NAME = "batteryHalfLife";

    public static final int DISHWASHER_CYCLE_LENGTH_DEFAULT_VALUE = 2;
    public static final int CLOTHES_WASHER_CYCLE_LENGTH_DEFAULT_VALUE = 2;
    public static final int CLOTHES_DRYER_CYCLE_LENGTH_DEFAULT_VALUE = 3;
    public static final double EV_POWER_MIN_DEFAULT_VALUE = 1.1;
    public static final double EV_POWER_MAX_DEFAULT_VALUE = 7.7;
    public static final double EV_ENERGY_MIN_DEFAULT_VALUE = 10;
    public static final double EV_ENERGY_MAX_DEFAULT_VALUE = 10;
    public static final int EV_CHARGING_START_HOUR_DEFAULT_VALUE = 14;
    public static final double HEATING_POWER_MIN_DEFAULT_VALUE = 0;
    public static final double HEATING_POWER_MAX_DEFAULT_VALUE = 10;
    public static final double HEATING_EFFICIENCY_DEFAULT_VALUE = 1;
    public static final double HEATING_CAPACITY_DEFAULT_VALUE = 3;
    public static final double HEATING_CONDUCTION_DEFAULT_VALUE = 0.2;
    public static final double HEATING_TEMPERATURE_INIT_DEFAULT_VALUE = 20;
    public static final double HEATING_TEMPERATURE_MIN_DEFAULT_VALUE = 18;
    public static final double HEATING_TEMPERATURE_MAX_DEFAULT_VALUE = 22;
    public static final double BATTERY_SOC_MIN_DEFAULT_VALUE = 0;
    public static final double BATTERY_SOC_MAX_DEFAULT_VALUE = 13.5;
    public static final double BATTERY_SOC_INIT_DEFAULT_VALUE = 0;
    public static final double BATTERY_POWER_MIN_DEFAULT_VALUE = 0;
    public static final double BATTERY_POWER_MAX_DEFAULT_VALUE = 5;
    public static final double BATTERY_EFFICIENCY_DEFAULT_VALUE = 0.95;
    public static final double BATTERY_HALF_LIFE_DEFAULT_VALUE = 693149;

    private int dishwasherCycleLength = DISHWASHER_CYCLE_LENGTH_DEFAULT_VALUE;

    private int clothesWasherCycleLength = CLOTHES_WASHER_CYCLE_LENGTH_DEFAULT_VALUE;

    private int clothesDryerCycleLength = CLOTHES_DRYER_CYCLE_LENGTH_DEFAULT_VALUE;

    private double evPowerMin = EV_POWER_MIN_DEFAULT_VALUE;

    private double evPowerMax = EV_POWER_MAX_DEFAULT_VALUE;

    private double evEnergyMin = EV_ENERGY_MIN_DEFAULT_VALUE;

    private double evEnergyMax = EV_ENERGY_MAX_DEFAULT_VALUE;

    private int evChargingStartHour = EV_CHARGING_START_HOUR_DEFAULT_VALUE;

    private double heatingPowerMin = HEATING_POWER_MIN_DEFAULT_VALUE;

    private double heatingPowerMax = HEATING_POWER_MAX_DEFAULT_VALUE;

    private double heatingEfficiency = HEATING_EFFICIENCY_DEFAULT_VALUE;

    private double heatingCapacity = HEATING_CAPACITY_DEFAULT_VALUE;

    private double heatingConduction = HEATING_CONDUCTION_DEFAULT_VALUE;

    private double heatingTemperatureInit = HEATING_TEMPERATURE_INIT_DEFAULT_VALUE;

    private double heatingTemperatureMin = HEATING_TEMPERATURE_MIN_DEFAULT_VALUE;

    private double heatingTemperatureMax = HEATING_TEMPERATURE_MAX_DEFAULT_VALUE;

    private double batterySocMin = BATTERY_SOC_MIN_DEFAULT_VALUE;

    private double batterySocMax = BATTERY_SOC_MAX_DEFAULT_VALUE;

    private double batterySocInit = BATTERY_SOC_INIT_DEFAULT_VALUE;

    private double batteryPowerMin = BATTERY_POWER_MIN_DEFAULT_VALUE;

    private double batteryPowerMax = BATTERY_POWER_MAX_DEFAULT_VALUE;

    private double batteryEfficiency = BATTERY_EFFICIENCY_DEFAULT_VALUE;

    private double batteryHalfLife = BATTERY_HALF_LIFE_DEFAULT_VALUE;

    private static int checkCycleLength(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Invalid cycle length: " + length);
        }
        return length;
    }

    private static double checkFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
        return value;
    }

    /**
     * Number of steps of a dishwasher cycle.
     */
    public int getDishwasherCycleLength() {
        return dishwasherCycleLength;
    }

    public DeviceParameters setDishwasherCycleLength(int dishwasherCycleLength) {
        this.dishwasherCycleLength = checkCycleLength(dishwasherCycleLength);
        return this;
    }

    public int getClothesWasherCycleLength() {
        return clothesWasherCycleLength;
    }

    public DeviceParameters setClothesWasherCycleLength(int clothesWasherCycleLength) {
        this.clothesWasherCycleLength = checkCycleLength(clothesWasherCycleLength);
        return this;
    }

    public int getClothesDryerCycleLength() {
        return clothesDryerCycleLength;
    }

    public DeviceParameters setClothesDryerCycleLength(int clothesDryerCycleLength) {
        this.clothesDryerCycleLength = checkCycleLength(clothesDryerCycleLength);
        return this;
    }

    /**
     * Minimum charging power of an electric vehicle while plugged, in kW.
     */
    public double getEvPowerMin() {
        return evPowerMin;
    }

    public DeviceParameters setEvPowerMin(double evPowerMin) {
        this.evPowerMin = checkFinite("evPowerMin", evPowerMin);
        return this;
    }

    public double getEvPowerMax() {
        return evPowerMax;
    }

    public DeviceParameters setEvPowerMax(double evPowerMax) {
        this.evPowerMax = checkFinite("evPowerMax", evPowerMax);
        return this;
    }

    public double getEvEnergyMin() {
        return evEnergyMin;
    }

    public DeviceParameters setEvEnergyMin(double evEnergyMin) {
        this.evEnergyMin = checkFinite("evEnergyMin", evEnergyMin);
        return this;
    }

    public double getEvEnergyMax() {
        return evEnergyMax;
    }

    public DeviceParameters setEvEnergyMax(double evEnergyMax) {
        this.evEnergyMax = checkFinite("evEnergyMax", evEnergyMax);
        return this;
    }

    /**
     * Hour of the day, counted from the start of the window, from which an electric vehicle can charge until the end of the day.
     */
    public int getEvChargingStartHour() {
        return evChargingStartHour;
    }

    public DeviceParameters setEvChargingStartHour(int evChargingStartHour) {
        if (evChargingStartHour < 0 || evChargingStartHour > 24) {
            throw new IllegalArgumentException("Invalid hour: " + evChargingStartHour);
        }
        this.evChargingStartHour = evChargingStartHour;
        return this;
    }

    public double getHeatingPowerMin() {
        return heatingPowerMin;
    }

    public DeviceParameters setHeatingPowerMin(double heatingPowerMin) {
        this.heatingPowerMin = checkFinite("heatingPowerMin", heatingPowerMin);
        return this;
    }

    public double getHeatingPowerMax() {
        return heatingPowerMax;
    }

    public DeviceParameters setHeatingPowerMax(double heatingPowerMax) {
        this.heatingPowerMax = checkFinite("heatingPowerMax", heatingPowerMax);
        return this;
    }

    public double getHeatingEfficiency() {
        return heatingEfficiency;
    }

    public DeviceParameters setHeatingEfficiency(double heatingEfficiency) {
        this.heatingEfficiency = checkFinite("heatingEfficiency", heatingEfficiency);
        return this;
    }

    public double getHeatingCapacity() {
        return heatingCapacity;
    }

    public DeviceParameters setHeatingCapacity(double heatingCapacity) {
        this.heatingCapacity = checkFinite("heatingCapacity", heatingCapacity);
        return this;
    }

    public double getHeatingConduction() {
        return heatingConduction;
    }

    public DeviceParameters setHeatingConduction(double heatingConduction) {
        this.heatingConduction = checkFinite("heatingConduction", heatingConduction);
        return this;
    }

    public double getHeatingTemperatureInit() {
        return heatingTemperatureInit;
    }

    public DeviceParameters setHeatingTemperatureInit(double heatingTemperatureInit) {
        this.heatingTemperatureInit = checkFinite("heatingTemperatureInit", heatingTemperatureInit);
        return this;
    }

    public double getHeatingTemperatureMin() {
        return heatingTemperatureMin;
    }

    public DeviceParameters setHeatingTemperatureMin(double heatingTemperatureMin) {
        this.heatingTemperatureMin = checkFinite("heatingTemperatureMin", heatingTemperatureMin);
        return this;
    }

    public double getHeatingTemperatureMax() {
        return heatingTemperatureMax;
    }

    public DeviceParameters setHeatingTemperatureMax(double heatingTemperatureMax) {
        this.heatingTemperatureMax = checkFinite("heatingTemperatureMax", heatingTemperatureMax);
        return this;
    }

    public double getBatterySocMin() {
        return batterySocMin;
    }

    public DeviceParameters setBatterySocMin(double batterySocMin) {
        this.batterySocMin = checkFinite("batterySocMin", batterySocMin);
        return this;
    }

    /**
     * Battery capacity, in kWh.
     */
    public double getBatterySocMax() {
        return batterySocMax;
    }

    public DeviceParameters setBatterySocMax(double batterySocMax) {
        this.batterySocMax = checkFinite("batterySocMax", batterySocMax);
        return this;
    }

    public double getBatterySocInit() {
        return batterySocInit;
    }

    public DeviceParameters setBatterySocInit(double batterySocInit) {
        this.batterySocInit = checkFinite("batterySocInit", batterySocInit);
        return this;
    }

    public double getBatteryPowerMin() {
        return batteryPowerMin;
    }

    public DeviceParameters setBatteryPowerMin(double batteryPowerMin) {
        this.batteryPowerMin = checkFinite("batteryPowerMin", batteryPowerMin);
        return this;
    }

    public double getBatteryPowerMax() {
        return batteryPowerMax;
    }

    public DeviceParameters setBatteryPowerMax(double batteryPowerMax) {
        this.batteryPowerMax = checkFinite("batteryPowerMax", batteryPowerMax);
        return this;
    }

    /**
     * Efficiency of both charge and discharge.
     */
    public double getBatteryEfficiency() {
        return batteryEfficiency;
    }

    public DeviceParameters setBatteryEfficiency(double batteryEfficiency) {
        this.batteryEfficiency = checkFinite("batteryEfficiency", batteryEfficiency);
        return this;
    }

    /**
     * Self-discharge half-life of a battery, in hours.
     */
    public double getBatteryHalfLife() {
        return batteryHalfLife;
    }

    public DeviceParameters setBatteryHalfLife(double batteryHalfLife) {
        if (!(batteryHalfLife > 0)) {
            throw new IllegalArgumentException("Invalid half-life: " + batteryHalfLife);
        }
        this.batteryHalfLife = batteryHalfLife;
        return this;
    }

    public static DeviceParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static DeviceParameters load(PlatformConfig platformConfig) {
        DeviceParameters parameters = new DeviceParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME).ifPresent(config -> load(parameters, config));
        return parameters;
    }

    private static void load(DeviceParameters parameters, ModuleConfig config) {
        parameters
            .setDishwasherCycleLength(config.getIntProperty(DISHWASHER_CYCLE_LENGTH_PARAM_NAME, DISHWASHER_CYCLE_LENGTH_DEFAULT_VALUE))
            .setClothesWasherCycleLength(config.getIntProperty(CLOTHES_WASHER_CYCLE_LENGTH_PARAM_NAME, CLOTHES_WASHER_CYCLE_LENGTH_DEFAULT_VALUE))
            .setClothesDryerCycleLength(config.getIntProperty(CLOTHES_DRYER_CYCLE_LENGTH_PARAM_NAME, CLOTHES_DRYER_CYCLE_LENGTH_DEFAULT_VALUE))
            .setEvPowerMin(config.getDoubleProperty(EV_POWER_MIN_PARAM_NAME, EV_POWER_MIN_DEFAULT_VALUE))
            .setEvPowerMax(config.getDoubleProperty(EV_POWER_MAX_PARAM_NAME, EV_POWER_MAX_DEFAULT_VALUE))
            .setEvEnergyMin(config.getDoubleProperty(EV_ENERGY_MIN_PARAM_NAME, EV_ENERGY_MIN_DEFAULT_VALUE))
            .setEvEnergyMax(config.getDoubleProperty(EV_ENERGY_MAX_PARAM_NAME, EV_ENERGY_MAX_DEFAULT_VALUE))
            .setEvChargingStartHour(config.getIntProperty(EV_CHARGING_START_HOUR_PARAM_NAME, EV_CHARGING_START_HOUR_DEFAULT_VALUE))
            .setHeatingPowerMin(config.getDoubleProperty(HEATING_POWER_MIN_PARAM_NAME, HEATING_POWER_MIN_DEFAULT_VALUE))
            .setHeatingPowerMax(config.getDoubleProperty(HEATING_POWER_MAX_PARAM_NAME, HEATING_POWER_MAX_DEFAULT_VALUE))
            .setHeatingEfficiency(config.getDoubleProperty(HEATING_EFFICIENCY_PARAM_NAME, HEATING_EFFICIENCY_DEFAULT_VALUE))
            .setHeatingCapacity(config.getDoubleProperty(HEATING_CAPACITY_PARAM_NAME, HEATING_CAPACITY_DEFAULT_VALUE))
            .setHeatingConduction(config.getDoubleProperty(HEATING_CONDUCTION_PARAM_NAME, HEATING_CONDUCTION_DEFAULT_VALUE))
            .setHeatingTemperatureInit(config.getDoubleProperty(HEATING_TEMPERATURE_INIT_PARAM_NAME, HEATING_TEMPERATURE_INIT_DEFAULT_VALUE))
            .setHeatingTemperatureMin(config.getDoubleProperty(HEATING_TEMPERATURE_MIN_PARAM_NAME, HEATING_TEMPERATURE_MIN_DEFAULT_VALUE))
            .setHeatingTemperatureMax(config.getDoubleProperty(HEATING_TEMPERATURE_MAX_PARAM_NAME, HEATING_TEMPERATURE_MAX_DEFAULT_VALUE))
            .setBatterySocMin(config.getDoubleProperty(BATTERY_SOC_MIN_PARAM_NAME, BATTERY_SOC_MIN_DEFAULT_VALUE))
            .setBatterySocMax(config.getDoubleProperty(BATTERY_SOC_MAX_PARAM_NAME, BATTERY_SOC_MAX_DEFAULT_VALUE))
            .setBatterySocInit(config.getDoubleProperty(BATTERY_SOC_INIT_PARAM_NAME, BATTERY_SOC_INIT_DEFAULT_VALUE))
            .setBatteryPowerMin(config.getDoubleProperty(BATTERY_POWER_MIN_PARAM_NAME, BATTERY_POWER_MIN_DEFAULT_VALUE))
            .setBatteryPowerMax(config.getDoubleProperty(BATTERY_POWER_MAX_PARAM_NAME, BATTERY_POWER_MAX_DEFAULT_VALUE))
            .setBatteryEfficiency(config.getDoubleProperty(BATTERY_EFFICIENCY_PARAM_NAME, BATTERY_EFFICIENCY_DEFAULT_VALUE))
            .setBatteryHalfLife(config.getDoubleProperty(BATTERY_HALF_LIFE_PARAM_NAME, BATTERY_HALF_LIFE_DEFAULT_VALUE));
    }

    @Override
    public String toString() {
        return "DeviceParameters(" +
                "dishwasherCycleLength=" + dishwasherCycleLength +
                ", clothesWasherCycleLength=" + clothesWasherCycleLength +
                ", clothesDryerCycleLength=" + clothesDryerCycleLength +
                ", evPowerMin=" + evPowerMin +
                ", evPowerMax=" + evPowerMax +
                ", evEnergyMin=" + evEnergyMin +
                ", evEnergyMax=" + evEnergyMax +
                ", evChargingStartHour=" + evChargingStartHour +
                ", heatingPowerMin=" + heatingPowerMin +
                ", heatingPowerMax=" + heatingPowerMax +
                ", heatingEfficiency=" + heatingEfficiency +
                ", heatingCapacity=" + heatingCapacity +
                ", heatingConduction=" + heatingConduction +
                ", heatingTemperatureInit=" + heatingTemperatureInit +
                ", heatingTemperatureMin=" + heatingTemperatureMin +
                ", heatingTemperatureMax=" + heatingTemperatureMax +
                ", batterySocMin=" + batterySocMin +
                ", batterySocMax=" + batterySocMax +
                ", batterySocInit=" + batterySocInit +
                ", batteryPowerMin=" + batteryPowerMin +
                ", batteryPowerMax=" + batteryPowerMax +
                ", batteryEfficiency=" + batteryEfficiency +
                ", batteryHalfLife=" + batteryHalfLife +
                ')';
    }
}
