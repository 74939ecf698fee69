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
 * Variables of a {@link DeferrableLoad}.
 *
 * @author Open Demand Response team
 */
public enum DeferrableLoadVariableType implements Field {
    POWER("pwr"),
    ON_INDICATOR("u");

    private final String symbol;

    DeferrableLoadVariableType(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }
}
