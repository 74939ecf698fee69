/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.device;

import com.powsybl.opendr.index.Field;

/**
 * Constraints of a {@link Battery}.
 *
 * @author Open Demand Response team
 */
public enum BatteryConstraintType implements Field {
    ENERGY_CONSERVATION("ener_cons"),
    CHARGING_POWER_MIN("pwr_chg_min"),
    CHARGING_POWER_MAX("pwr_chg_max"),
    DISCHARGING_POWER_MIN("pwr_dis_min"),
    DISCHARGING_POWER_MAX("pwr_dis_max"),
    CHARGE_DISCHARGE_EXCLUSION("cstr_bin");

    private final String symbol;

    BatteryConstraintType(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }
}
