/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.opendr;

import com.powsybl.commons.PowsyblException;
import com.powsybl.opendr.device.Device;
import com.powsybl.opendr.index.ModelIndex;
import com.powsybl.opendr.index.ModelKey;
import com.powsybl.opendr.model.ConstraintSense;
import com.powsybl.opendr.model.LinearExpression;
import com.powsybl.opendr.model.MilpModel;
import com.powsybl.opendr.model.VariableKind;

import java.util.Objects;

/**
 * Context of a model assembly run, passed to every device contribution. It is the only way to write into the
 * model and the index: variables and constraints are declared by key, and any reference to another element is
 * resolved through the index at declaration time.
 * <p>
 * Not thread safe: devices must contribute one after the other.
 *
 * @author Open Demand Response team
 */
public class MilpModelBuilder {

    private final MilpModel model;

    private final ModelIndex index;

    private final TimeWindow timeWindow;

    private final ModelAssemblyParameters parameters;

    public MilpModelBuilder(MilpModel model, TimeWindow timeWindow, ModelAssemblyParameters parameters) {
        this(model, new ModelIndex(), timeWindow, parameters);
    }

    public MilpModelBuilder(MilpModel model, ModelIndex index, TimeWindow timeWindow, ModelAssemblyParameters parameters) {
        this.model = Objects.requireNonNull(model);
        this.index = Objects.requireNonNull(index);
        this.timeWindow = Objects.requireNonNull(timeWindow);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public final class VariableAdder {

        private final ModelKey key;

        private double lowerBound = 0;

        private double upperBound = Double.POSITIVE_INFINITY;

        private VariableKind kind = VariableKind.CONTINUOUS;

        private double objectiveCoefficient = 0;

        private final LinearExpression column = new LinearExpression();

        private VariableAdder(ModelKey key) {
            this.key = Objects.requireNonNull(key);
        }

        public VariableAdder setLowerBound(double lowerBound) {
            this.lowerBound = lowerBound;
            return this;
        }

        public VariableAdder setUpperBound(double upperBound) {
            this.upperBound = upperBound;
            return this;
        }

        public VariableAdder setBounds(double lowerBound, double upperBound) {
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
            return this;
        }

        public VariableAdder setFree() {
            return setBounds(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        }

        public VariableAdder setKind(VariableKind kind) {
            this.kind = Objects.requireNonNull(kind);
            return this;
        }

        /**
         * Make this variable an indicator in [0, 1], binary unless binary enforcement is disabled for this run.
         */
        public VariableAdder setIndicator() {
            return setIndicator(true);
        }

        /**
         * Make this variable an indicator in [0, 1], binary if requested and if binary enforcement is enabled for
         * this run.
         */
        public VariableAdder setIndicator(boolean binaryRequested) {
            kind = binaryRequested && parameters.isBinaries() ? VariableKind.BINARY : VariableKind.CONTINUOUS;
            return setBounds(0, 1);
        }

        public VariableAdder setObjectiveCoefficient(double objectiveCoefficient) {
            this.objectiveCoefficient = objectiveCoefficient;
            return this;
        }

        /**
         * Give this variable a coefficient in an already declared constraint.
         */
        public VariableAdder addToConstraint(ModelKey constraintKey, double coefficient) {
            column.add(index.getConstraintIndex(constraintKey), coefficient);
            return this;
        }

        public int add() {
            if (index.hasVariable(key)) {
                throw new PowsyblException("The variable '" + key.getName() + "' is already declared");
            }
            int num = model.addVariable(key.getName(), lowerBound, upperBound, kind, objectiveCoefficient, column);
            index.addVariable(key, num);
            return num;
        }
    }

    public final class ConstraintAdder {

        private final ModelKey key;

        private final ConstraintSense sense;

        private double rhs = 0;

        private final LinearExpression row = new LinearExpression();

        private ConstraintAdder(ModelKey key, ConstraintSense sense) {
            this.key = Objects.requireNonNull(key);
            this.sense = Objects.requireNonNull(sense);
        }

        public ConstraintAdder setRhs(double rhs) {
            this.rhs = rhs;
            return this;
        }

        public ConstraintAdder addTerm(ModelKey variableKey, double coefficient) {
            row.add(index.getVariableIndex(variableKey), coefficient);
            return this;
        }

        public int add() {
            if (index.hasConstraint(key)) {
                throw new PowsyblException("The constraint '" + key.getName() + "' is already declared");
            }
            int num = model.addConstraint(key.getName(), sense, rhs, row);
            index.addConstraint(key, num);
            return num;
        }
    }

    public VariableAdder newVariable(ModelKey key) {
        return new VariableAdder(key);
    }

    public ConstraintAdder newConstraint(ModelKey key, ConstraintSense sense) {
        return new ConstraintAdder(key, sense);
    }

    public int getVariableIndex(ModelKey key) {
        return index.getVariableIndex(key);
    }

    public int getConstraintIndex(ModelKey key) {
        return index.getConstraintIndex(key);
    }

    /**
     * Shift the right-hand side of an already declared constraint.
     */
    public void addToRhs(ModelKey constraintKey, double delta) {
        int num = index.getConstraintIndex(constraintKey);
        model.setConstraintRhs(num, model.getConstraintRhs(num) + delta);
    }

    /**
     * Let a device of a household declare its variables and constraints. The device is checked against the time
     * window before anything is declared.
     */
    public DeviceContribution contribute(Device device, String householdId) {
        Objects.requireNonNull(device);
        Objects.requireNonNull(householdId);
        device.validate(timeWindow);
        int variableCount = index.getVariableCount();
        int constraintCount = index.getConstraintCount();
        device.contribute(this, householdId);
        return new DeviceContribution(householdId, device.getId(),
                index.getVariableKeys().subList(variableCount, index.getVariableCount()),
                index.getConstraintKeys().subList(constraintCount, index.getConstraintCount()));
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public ModelAssemblyParameters getParameters() {
        return parameters;
    }
}
