/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

/**
 * @author Open Demand Response team
 */
public enum DeviceType {
    FIXED_LOAD,
    BATTERY,
    THERMAL_LOAD,
    DEFERRABLE_LOAD,
    SHIFTABLE_LOAD,
    CURTAILABLE_LOAD
}
