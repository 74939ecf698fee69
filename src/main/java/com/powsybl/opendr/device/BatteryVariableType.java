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
 * Variables of a {@link Battery}.
 *
 * @author Open Demand Response team
 */
public enum BatteryVariableType implements Field {
    CHARGING_POWER("pwr_chg"),
    DISCHARGING_POWER("pwr_dis"),
    STATE_OF_CHARGE("soc"),
    CHARGING_INDICATOR("chg_ind"),
    DISCHARGING_INDICATOR("dis_ind");

    private final String symbol;

    BatteryVariableType(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }
}
