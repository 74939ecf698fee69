/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.index;

import com.google.common.testing.EqualsTester;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open Demand Response team
 */
class ModelKeyTest {

    private enum Fields implements Field {
        POWER("pwr"),
        STATE("soc");

        private final String symbol;

        Fields(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String getSymbol() {
            return symbol;
        }
    }

    @Test
    void testEquals() {
        new EqualsTester()
                .addEqualityGroup(ModelKey.of(Scope.device("HH_0", "bat"), Fields.POWER, 3), new ModelKey(new Scope("HH_0", "bat"), Fields.POWER, ModelKey.NO_INDEX, 3))
                .addEqualityGroup(ModelKey.of(Scope.device("HH_0", "bat"), Fields.POWER, 4))
                .addEqualityGroup(ModelKey.of(Scope.device("HH_0", "bat"), Fields.STATE, 3))
                .addEqualityGroup(ModelKey.of(Scope.device("HH_1", "bat"), Fields.POWER, 3))
                .addEqualityGroup(ModelKey.of(Scope.household("HH_0"), Fields.POWER, 3))
                .addEqualityGroup(ModelKey.of(Scope.aggregator(), Fields.POWER, 3))
                .addEqualityGroup(ModelKey.of(Scope.device("HH_0", "bat"), Fields.POWER, 0, 3))
                .addEqualityGroup(ModelKey.ofIndex(Scope.device("HH_0", "bat"), Fields.POWER, 3))
                .testEquals();
    }

    @Test
    void testName() {
        assertEquals("HH_0/bat/soc/3", ModelKey.of(Scope.device("HH_0", "bat"), Fields.STATE, 3).getName());
        assertEquals("HH_0/pwr/3", ModelKey.of(Scope.household("HH_0"), Fields.POWER, 3).getName());
        assertEquals("pwr/3", ModelKey.of(Scope.aggregator(), Fields.POWER, 3).getName());
        assertEquals("HH_0/wash/pwr/1/12", ModelKey.of(Scope.device("HH_0", "wash"), Fields.POWER, 1, 12).getName());
        assertEquals("HH_0/wash/pwr/1", ModelKey.ofIndex(Scope.device("HH_0", "wash"), Fields.POWER, 1).getName());
        assertEquals("HH_0/ev/soc", ModelKey.of(Scope.device("HH_0", "ev"), Fields.STATE).getName());
        assertEquals("ModelKey(pwr/0)", ModelKey.of(Scope.aggregator(), Fields.POWER, 0).toString());
    }

    @Test
    void testScope() {
        assertTrue(Scope.aggregator().isAggregator());
        assertFalse(Scope.aggregator().isHousehold());
        assertTrue(Scope.household("HH_0").isHousehold());
        assertFalse(Scope.household("HH_0").isDevice());
        assertTrue(Scope.device("HH_0", "bat").isDevice());
        assertEquals("Scope(aggregator)", Scope.aggregator().toString());
        assertEquals("Scope(HH_0/bat)", Scope.device("HH_0", "bat").toString());
        assertThrows(IllegalArgumentException.class, () -> new Scope(null, "bat"));
    }

    @Test
    void testInvalidSubscripts() {
        Scope scope = Scope.household("HH_0");
        assertThrows(IllegalArgumentException.class, () -> ModelKey.of(scope, Fields.POWER, -2));
        assertThrows(IllegalArgumentException.class, () -> ModelKey.of(scope, Fields.POWER, -3, 0));
        assertThrows(NullPointerException.class, () -> ModelKey.of(null, Fields.POWER, 0));
    }
}
