/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.index;

import com.powsybl.commons.PowsyblException;

import java.util.*;

/**
 * Registry of the solver indices of variables and constraints, by key. It only grows: there is no way to remove
 * an entry.
 *
 * @author Open Demand Response team
 */
public class ModelIndex {

    private final Map<ModelKey, Integer> variables = new HashMap<>();

    private final List<ModelKey> variableKeys = new ArrayList<>();

    private final Map<ModelKey, Integer> constraints = new HashMap<>();

    private final List<ModelKey> constraintKeys = new ArrayList<>();

    private static void register(Map<ModelKey, Integer> indices, List<ModelKey> keys, ModelKey key, int num, String elementKind) {
        Objects.requireNonNull(key);
        if (indices.putIfAbsent(key, num) != null) {
            throw new PowsyblException("The " + elementKind + " '" + key.getName() + "' is already declared");
        }
        keys.add(key);
    }

    public void addVariable(ModelKey key, int num) {
        register(variables, variableKeys, key, num, "variable");
    }

    public void addConstraint(ModelKey key, int num) {
        register(constraints, constraintKeys, key, num, "constraint");
    }

    public boolean hasVariable(ModelKey key) {
        return variables.containsKey(key);
    }

    public boolean hasConstraint(ModelKey key) {
        return constraints.containsKey(key);
    }

    public int getVariableIndex(ModelKey key) {
        Integer num = variables.get(Objects.requireNonNull(key));
        if (num == null) {
            throw new UnknownKeyException("variable", key);
        }
        return num;
    }

    public int getConstraintIndex(ModelKey key) {
        Integer num = constraints.get(Objects.requireNonNull(key));
        if (num == null) {
            throw new UnknownKeyException("constraint", key);
        }
        return num;
    }

    public int getVariableCount() {
        return variableKeys.size();
    }

    public int getConstraintCount() {
        return constraintKeys.size();
    }

    /**
     * Variable keys in declaration order.
     */
    public List<ModelKey> getVariableKeys() {
        return Collections.unmodifiableList(variableKeys);
    }

    /**
     * Constraint keys in declaration order.
     */
    public List<ModelKey> getConstraintKeys() {
        return Collections.unmodifiableList(constraintKeys);
    }
}
