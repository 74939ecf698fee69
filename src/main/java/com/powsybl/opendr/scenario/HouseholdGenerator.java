/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.scenario;

import com.powsybl.commons.PowsyblException;
import com.powsybl.opendr.Household;
import com.powsybl.opendr.TimeWindow;
import com.powsybl.opendr.device.Battery;
import com.powsybl.opendr.device.CurtailableLoad;
import com.powsybl.opendr.device.DeferrableLoad;
import com.powsybl.opendr.device.Device;
import com.powsybl.opendr.device.DeviceType;
import com.powsybl.opendr.device.FixedLoad;
import com.powsybl.opendr.device.ShiftableLoad;
import com.powsybl.opendr.device.ThermalLoad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Random generation of residential households.
 * <p>
 * Each household gets a native load scaled by a random factor, then equipment drawn according to the ownership
 * rates. Households owning PV panels also get an electric vehicle and a home battery. Shiftable appliances run
 * one cycle per full day of the window. The time window is assumed to start at 5am.
 *
 * @author Open Demand Response team
 */
public final class HouseholdGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(HouseholdGenerator.class);

    private static final int HOURS_PER_DAY = 24;

    private HouseholdGenerator() {
    }

    public static List<Household> generate(int householdCount, TimeWindow timeWindow, ScenarioData data,
                                           OwnershipRates rates, DeviceParameters parameters, long seed) {
        Objects.requireNonNull(timeWindow);
        Objects.requireNonNull(data);
        Objects.requireNonNull(rates);
        Objects.requireNonNull(parameters);
        if (householdCount < 0) {
            throw new PowsyblException("Invalid household count: " + householdCount);
        }
        if (data.getSize() != timeWindow.getSize()) {
            throw new PowsyblException("Scenario data has " + data.getSize() + " steps, expected " + timeWindow.getSize());
        }

        // one seed per household, so that a household does not depend on the ones generated before
        Random random = new Random(seed);
        int[] householdSeeds = new int[householdCount];
        for (int i = 0; i < householdCount; i++) {
            householdSeeds[i] = random.nextInt(1 << 16);
        }

        List<Household> households = new ArrayList<>(householdCount);
        Map<DeviceType, Integer> deviceCounts = new EnumMap<>(DeviceType.class);
        for (int i = 0; i < householdCount; i++) {
            Household household = generateHousehold(i, timeWindow, data, rates, parameters, new Random(householdSeeds[i]));
            for (Device device : household.getDevices()) {
                deviceCounts.merge(device.getType(), 1, Integer::sum);
            }
            households.add(household);
        }
        LOGGER.info("{} households generated with devices {}", householdCount, deviceCounts);
        return households;
    }

    private static Household generateHousehold(int num, TimeWindow timeWindow, ScenarioData data, OwnershipRates rates,
                                               DeviceParameters parameters, Random random) {
        int size = timeWindow.getSize();
        int dayCount = size / HOURS_PER_DAY;
        double scale = 0.5 + random.nextDouble();
        List<Device> devices = new ArrayList<>();

        boolean pv = random.nextDouble() < rates.getPv();

        double[] loadNorm = data.getLoadNorm();
        double[] load = new double[size];
        for (int t = 0; t < size; t++) {
            load[t] = Math.max(0, scale * (loadNorm[t] + 0.05 * random.nextGaussian()));
        }
        devices.add(new FixedLoad("load_" + num, load));

        if (pv) {
            double[] pvNorm = data.getPvNorm();
            double[] production = new double[size];
            for (int t = 0; t < size; t++) {
                production[t] = -scale * pvNorm[t] * random.nextDouble();
            }
            devices.add(new CurtailableLoad("PV_" + num, production, true));
        }

        if (random.nextDouble() < rates.getDishwasher()) {
            addDailyCycles(devices, "shift_dw_" + num, parameters.getDishwasherCycleLength(), dayCount);
        }
        boolean clothesWasher = random.nextDouble() < rates.getClothesWasher();
        if (clothesWasher) {
            addDailyCycles(devices, "shift_cw_" + num, parameters.getClothesWasherCycleLength(), dayCount);
        }
        if (clothesWasher && random.nextDouble() < rates.getClothesDryerGivenWasher()) {
            addDailyCycles(devices, "shift_cd_" + num, parameters.getClothesDryerCycleLength(), dayCount);
        }

        if (pv) {
            devices.add(createElectricVehicle("EV_" + num, size, parameters));
        }

        if (random.nextDouble() < rates.getHeating()) {
            double[] temperature = data.getTemperature();
            double[] tempExt = new double[size];
            for (int t = 0; t < size; t++) {
                tempExt[t] = temperature[t] + 0.5 * random.nextGaussian();
            }
            double[] tempMin = new double[size];
            double[] tempMax = new double[size];
            Arrays.fill(tempMin, parameters.getHeatingTemperatureMin());
            Arrays.fill(tempMax, parameters.getHeatingTemperatureMax());
            devices.add(new ThermalLoad("heat_" + num, tempMin, tempMax, tempExt, parameters.getHeatingTemperatureInit(),
                    parameters.getHeatingPowerMin(), parameters.getHeatingPowerMax(), parameters.getHeatingCapacity(),
                    parameters.getHeatingEfficiency(), parameters.getHeatingConduction()));
        }

        if (pv) {
            devices.add(new Battery("bat_" + num,
                    parameters.getBatteryPowerMin(), parameters.getBatteryPowerMax(),
                    parameters.getBatteryPowerMin(), parameters.getBatteryPowerMax(),
                    parameters.getBatterySocMin(), parameters.getBatterySocMax(), parameters.getBatterySocInit(),
                    parameters.getBatteryEfficiency(), parameters.getBatteryEfficiency(), parameters.getBatteryHalfLife()));
        }

        Household household = new Household("HH_" + num, devices);
        LOGGER.debug("Household '{}' (scale {}): {}", household.getId(), scale, devices);
        return household;
    }

    /**
     * One single cycle device per full day, starting and ending within the day.
     */
    private static void addDailyCycles(List<Device> devices, String idPrefix, int cycleLength, int dayCount) {
        double[] cycle = new double[cycleLength];
        Arrays.fill(cycle, 1);
        for (int day = 0; day < dayCount; day++) {
            int tStartMin = HOURS_PER_DAY * day;
            int tStartMax = HOURS_PER_DAY * (day + 1) - 1 - cycleLength;
            if (tStartMax < tStartMin) {
                throw new PowsyblException("Cycle of " + cycleLength + " steps does not fit in a day");
            }
            devices.add(new ShiftableLoad(idPrefix + "_" + day, new int[] {tStartMin}, new int[] {tStartMax}, new double[][] {cycle}));
        }
    }

    /**
     * The vehicle can charge each day from the charging start hour to the end of the day.
     */
    private static DeferrableLoad createElectricVehicle(String id, int size, DeviceParameters parameters) {
        double[] pwrMin = new double[size];
        double[] pwrMax = new double[size];
        for (int t = 0; t < size; t++) {
            if (t % HOURS_PER_DAY >= parameters.getEvChargingStartHour()) {
                pwrMin[t] = parameters.getEvPowerMin();
                pwrMax[t] = parameters.getEvPowerMax();
            }
        }
        return new DeferrableLoad(id, parameters.getEvEnergyMin(), parameters.getEvEnergyMax(), pwrMin, pwrMax);
    }
}
