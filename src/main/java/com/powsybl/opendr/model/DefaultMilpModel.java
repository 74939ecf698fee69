/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr.model;

import com.powsybl.commons.PowsyblException;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * In-memory {@link MilpModel}: keeps declared variables and constraints so that they can be inspected, checked
 * against a candidate assignment or dumped for debugging before being handed to a solver.
 *
 * @author Open Demand Response team
 */
public class DefaultMilpModel implements MilpModel {

    public record ModelVariable(String name, double lowerBound, double upperBound, VariableKind kind,
                                double objectiveCoefficient) {
    }

    public static final class ModelConstraint {

        private final String name;

        private final ConstraintSense sense;

        private double rhs;

        private final LinearExpression row = new LinearExpression();

        private ModelConstraint(String name, ConstraintSense sense, double rhs) {
            this.name = name;
            this.sense = sense;
            this.rhs = rhs;
        }

        public String getName() {
            return name;
        }

        public ConstraintSense getSense() {
            return sense;
        }

        public double getRhs() {
            return rhs;
        }

        /**
         * Coefficients of this constraint, indexed by variable index.
         */
        public LinearExpression getRow() {
            return row;
        }

        public double getCoefficient(int variableIndex) {
            return row.getCoefficientSum(variableIndex);
        }
    }

    private final List<ModelVariable> variables = new ArrayList<>();

    private final List<ModelConstraint> constraints = new ArrayList<>();

    @Override
    public int addVariable(String name, double lowerBound, double upperBound, VariableKind kind, double objectiveCoefficient,
                           LinearExpression column) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(kind);
        Objects.requireNonNull(column);
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound) || lowerBound > upperBound) {
            throw new PowsyblException("Invalid bounds for variable '" + name + "': [" + lowerBound + ", " + upperBound + "]");
        }
        for (int i = 0; i < column.size(); i++) {
            checkConstraintIndex(column.getIndex(i));
        }
        int num = variables.size();
        variables.add(new ModelVariable(name, lowerBound, upperBound, kind, objectiveCoefficient));
        for (int i = 0; i < column.size(); i++) {
            constraints.get(column.getIndex(i)).row.add(num, column.getCoefficient(i));
        }
        return num;
    }

    @Override
    public int addConstraint(String name, ConstraintSense sense, double rhs, LinearExpression row) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(sense);
        Objects.requireNonNull(row);
        for (int i = 0; i < row.size(); i++) {
            checkVariableIndex(row.getIndex(i));
        }
        ModelConstraint constraint = new ModelConstraint(name, sense, rhs);
        constraint.row.addAll(row);
        constraints.add(constraint);
        return constraints.size() - 1;
    }

    private void checkVariableIndex(int variableIndex) {
        if (variableIndex < 0 || variableIndex >= variables.size()) {
            throw new PowsyblException("Variable " + variableIndex + " does not exist");
        }
    }

    private void checkConstraintIndex(int constraintIndex) {
        if (constraintIndex < 0 || constraintIndex >= constraints.size()) {
            throw new PowsyblException("Constraint " + constraintIndex + " does not exist");
        }
    }

    @Override
    public double getConstraintRhs(int constraintIndex) {
        checkConstraintIndex(constraintIndex);
        return constraints.get(constraintIndex).rhs;
    }

    @Override
    public void setConstraintRhs(int constraintIndex, double rhs) {
        checkConstraintIndex(constraintIndex);
        constraints.get(constraintIndex).rhs = rhs;
    }

    @Override
    public int getVariableCount() {
        return variables.size();
    }

    @Override
    public int getConstraintCount() {
        return constraints.size();
    }

    public ModelVariable getVariable(int variableIndex) {
        checkVariableIndex(variableIndex);
        return variables.get(variableIndex);
    }

    public ModelConstraint getConstraint(int constraintIndex) {
        checkConstraintIndex(constraintIndex);
        return constraints.get(constraintIndex);
    }

    public List<ModelVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<ModelConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public double evaluateObjective(double[] values) {
        checkValues(values);
        double objective = 0;
        for (int i = 0; i < variables.size(); i++) {
            objective += variables.get(i).objectiveCoefficient() * values[i];
        }
        return objective;
    }

    /**
     * Check an assignment of all the variables against bounds, integrality requirements and constraints.
     *
     * @return names of the violated variables and constraints, empty if the assignment is feasible
     */
    public List<String> getViolations(double[] values, double tolerance) {
        checkValues(values);
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < variables.size(); i++) {
            ModelVariable variable = variables.get(i);
            double value = values[i];
            if (value < variable.lowerBound() - tolerance
                    || value > variable.upperBound() + tolerance
                    || (variable.kind() == VariableKind.BINARY && Math.abs(value - Math.rint(value)) > tolerance)) {
                violations.add(variable.name());
            }
        }
        for (ModelConstraint constraint : constraints) {
            if (!constraint.sense.isSatisfied(constraint.row.evaluate(values), constraint.rhs, tolerance)) {
                violations.add(constraint.name);
            }
        }
        return violations;
    }

    private void checkValues(double[] values) {
        Objects.requireNonNull(values);
        if (values.length != variables.size()) {
            throw new PowsyblException("Expected " + variables.size() + " values, got " + values.length);
        }
    }

    private void writeExpression(Writer writer, LinearExpression expression) throws IOException {
        for (int i = 0; i < expression.size(); i++) {
            double coefficient = expression.getCoefficient(i);
            writer.write(coefficient < 0 ? " - " : " + ");
            writer.write(Double.toString(Math.abs(coefficient)));
            writer.write(" ");
            writer.write(variables.get(expression.getIndex(i)).name());
        }
    }

    /**
     * Write the model in a readable LP like format.
     */
    public void write(Writer writer) {
        Objects.requireNonNull(writer);
        try {
            writer.write("minimize");
            writer.write(System.lineSeparator());
            LinearExpression objective = new LinearExpression();
            for (int i = 0; i < variables.size(); i++) {
                if (variables.get(i).objectiveCoefficient() != 0) {
                    objective.add(i, variables.get(i).objectiveCoefficient());
                }
            }
            writer.write("  obj:");
            writeExpression(writer, objective);
            writer.write(System.lineSeparator());
            writer.write("subject to");
            writer.write(System.lineSeparator());
            for (ModelConstraint constraint : constraints) {
                writer.write("  " + constraint.name + ":");
                writeExpression(writer, constraint.row);
                writer.write(" " + constraint.sense.getSymbol() + " " + constraint.rhs);
                writer.write(System.lineSeparator());
            }
            writer.write("bounds");
            writer.write(System.lineSeparator());
            for (ModelVariable variable : variables) {
                writer.write("  " + variable.lowerBound() + " <= " + variable.name() + " <= " + variable.upperBound());
                writer.write(System.lineSeparator());
            }
            writer.write("binaries");
            writer.write(System.lineSeparator());
            for (ModelVariable variable : variables) {
                if (variable.kind() == VariableKind.BINARY) {
                    writer.write("  " + variable.name());
                    writer.write(System.lineSeparator());
                }
            }
            writer.write("end");
            writer.write(System.lineSeparator());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String writeToString() {
        try (StringWriter writer = new StringWriter()) {
            write(writer);
            writer.flush();
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
