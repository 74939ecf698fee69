/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.model;

/**
 * MILP modeling capability the model assembly writes into. Indices are assigned by the implementation in
 * declaration order, starting from 0, separately for variables and constraints.
 * <p>
 * The objective is always minimized.
 *
 * @author Open Demand Response team
 */
public interface MilpModel {

    /**
     * Add a variable.
     *
     * @param column coefficients of the new variable in already declared constraints, indexed by constraint index
     * @return the index of the new variable
     */
    int addVariable(String name, double lowerBound, double upperBound, VariableKind kind, double objectiveCoefficient,
                    LinearExpression column);

    /**
     * Add a linear constraint {@code row <sense> rhs}.
     *
     * @param row coefficients indexed by variable index
     * @return the index of the new constraint
     */
    int addConstraint(String name, ConstraintSense sense, double rhs, LinearExpression row);

    double getConstraintRhs(int constraintIndex);

    void setConstraintRhs(int constraintIndex, double rhs);

    int getVariableCount();

    int getConstraintCount();
}
