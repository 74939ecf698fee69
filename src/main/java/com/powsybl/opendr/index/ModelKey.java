/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.index;

import java.util.Objects;

/**
 * Identifier of a variable or a constraint of the model.
 *
 * @param scope owner of the element
 * @param field family of the element
 * @param index secondary subscript, for instance a cycle number, or {@link #NO_INDEX}
 * @param time time step, or {@link #NO_INDEX} for elements spanning the whole time window
 *
 * @author Open Demand Response team
 */
public record ModelKey(Scope scope, Field field, int index, int time) {

    public static final int NO_INDEX = -1;

    public ModelKey {
        Objects.requireNonNull(scope);
        Objects.requireNonNull(field);
        if (index < NO_INDEX || time < NO_INDEX) {
            throw new IllegalArgumentException("Invalid subscripts: index=" + index + ", time=" + time);
        }
    }

    public static ModelKey of(Scope scope, Field field) {
        return new ModelKey(scope, field, NO_INDEX, NO_INDEX);
    }

    public static ModelKey of(Scope scope, Field field, int time) {
        return new ModelKey(scope, field, NO_INDEX, time);
    }

    public static ModelKey of(Scope scope, Field field, int index, int time) {
        return new ModelKey(scope, field, index, time);
    }

    public static ModelKey ofIndex(Scope scope, Field field, int index) {
        return new ModelKey(scope, field, index, NO_INDEX);
    }

    /**
     * Name of the element in the solver model, for instance {@code HH_0/bat_0/soc/12}.
     */
    public String getName() {
        StringBuilder builder = new StringBuilder();
        String scopeName = scope.getName();
        if (!scopeName.isEmpty()) {
            builder.append(scopeName).append(Scope.SEPARATOR);
        }
        builder.append(field.getSymbol());
        if (index != NO_INDEX) {
            builder.append(Scope.SEPARATOR).append(index);
        }
        if (time != NO_INDEX) {
            builder.append(Scope.SEPARATOR).append(time);
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "ModelKey(" + getName() + ")";
    }
}
