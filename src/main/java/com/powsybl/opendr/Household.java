/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.opendr.device.Device;
import com.powsybl.opendr.device.DeviceParameterException;
import com.powsybl.opendr.index.Scope;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A household: its devices all feed the same net load.
 *
 * @author Open Demand Response team
 */
public class Household {

    private final String id;

    private final List<Device> devices;

    public Household(String id, List<Device> devices) {
        this.id = Objects.requireNonNull(id);
        if (id.isEmpty()) {
            throw new DeviceParameterException("Empty household id");
        }
        if (id.contains(Scope.SEPARATOR)) {
            throw new DeviceParameterException("Household id '" + id + "' contains '" + Scope.SEPARATOR + "'");
        }
        this.devices = List.copyOf(devices);
        Set<String> deviceIds = new HashSet<>();
        for (Device device : this.devices) {
            if (!deviceIds.add(device.getId())) {
                throw new DeviceParameterException("Household '" + id + "' has several devices with id '" + device.getId() + "'");
            }
        }
    }

    public String getId() {
        return id;
    }

    public List<Device> getDevices() {
        return devices;
    }

    public Optional<Device> getDevice(String deviceId) {
        return devices.stream().filter(device -> device.getId().equals(deviceId)).findFirst();
    }

    public void validate(TimeWindow timeWindow) {
        for (Device device : devices) {
            device.validate(timeWindow);
        }
    }

    @Override
    public String toString() {
        return "Household(id=" + id + ", devices=" + devices + ")";
    }
}
