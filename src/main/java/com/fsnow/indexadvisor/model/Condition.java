package com.fsnow.indexadvisor.model;

import java.util.Objects;

/**
 * A single operator/operand pair applied to a field.
 */
public class Condition {
    private final Operator operator;
    private final Object operand;
    
    public Condition(Operator operator, Object operand) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        this.operand = operand;
    }
    
    public Operator getOperator() {
        return operator;
    }
    
    /**
     * The literal BSON value(s) bound to the operator. May be null for {@code {field: null}}.
     */
    public Object getOperand() {
        return operand;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition that = (Condition) o;
        return operator == that.operator && Objects.equals(operand, that.operand);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }
    
    @Override
    public String toString() {
        return operator.getKeyword() + ":" + operand;
    }
}
