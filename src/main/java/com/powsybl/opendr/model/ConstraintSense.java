/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.model;

/**
 * Sense of a linear constraint {@code lhs <sense> rhs}.
 *
 * @author Open Demand Response team
 */
public enum ConstraintSense {
    EQUAL("="),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">=");

    private final String symbol;

    ConstraintSense(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isSatisfied(double lhs, double rhs, double tolerance) {
        return switch (this) {
            case EQUAL -> Math.abs(lhs - rhs) <= tolerance;
            case LESS_EQUAL -> lhs <= rhs + tolerance;
            case GREATER_EQUAL -> lhs >= rhs - tolerance;
        };
    }
}
