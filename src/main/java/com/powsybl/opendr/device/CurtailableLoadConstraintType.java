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
 * Constraints of a {@link CurtailableLoad}.
 *
 * @author Open Demand Response team
 */
public enum CurtailableLoadConstraintType implements Field {
    CURTAILMENT("curtail");

    private final String symbol;

    CurtailableLoadConstraintType(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public String getSymbol() {
        return symbol;
    }
}
