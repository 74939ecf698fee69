/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.index;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * Thrown when a variable or a constraint is referenced before having been declared, which means model elements
 * are not created in the right order.
 *
 * @author Open Demand Response team
 */
public class UnknownKeyException extends PowsyblException {

    private final transient ModelKey key;

    public UnknownKeyException(String elementKind, ModelKey key) {
        super("Unknown " + elementKind + " '" + key.getName() + "'");
        this.key = Objects.requireNonNull(key);
    }

    public ModelKey getKey() {
        return key;
    }
}
