/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.model;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;

import java.util.Objects;

/**
 * Sparse linear expression, a list of (index, coefficient) pairs.
 * <p>
 * Depending on the context, indices are variable indices (a constraint row) or constraint indices (a variable
 * column). A same index may appear several times, coefficients are then summed.
 *
 * @author Open Demand Response team
 */
public class LinearExpression {

    private final TIntArrayList indices = new TIntArrayList();

    private final TDoubleArrayList coefficients = new TDoubleArrayList();

    public LinearExpression add(int index, double coefficient) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative index: " + index);
        }
        indices.add(index);
        coefficients.add(coefficient);
        return this;
    }

    public LinearExpression addAll(LinearExpression other) {
        Objects.requireNonNull(other);
        indices.addAll(other.indices);
        coefficients.addAll(other.coefficients);
        return this;
    }

    public int size() {
        return indices.size();
    }

    public int getIndex(int i) {
        return indices.getQuick(i);
    }

    public double getCoefficient(int i) {
        return coefficients.getQuick(i);
    }

    /**
     * Sum of coefficients attached to a given index.
     */
    public double getCoefficientSum(int index) {
        double sum = 0;
        for (int i = 0; i < indices.size(); i++) {
            if (indices.getQuick(i) == index) {
                sum += coefficients.getQuick(i);
            }
        }
        return sum;
    }

    public double evaluate(double[] values) {
        Objects.requireNonNull(values);
        double value = 0;
        for (int i = 0; i < indices.size(); i++) {
            value += coefficients.getQuick(i) * values[indices.getQuick(i)];
        }
        return value;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("LinearExpression(");
        for (int i = 0; i < indices.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(indices.getQuick(i)).append('=').append(coefficients.getQuick(i));
        }
        return builder.append(')').toString();
    }
}
