package com.fsnow.indexadvisor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One constraint on one field path of a normalized query.
 * <p>
 * Most predicates hold a single condition. A range predicate may hold a second bound
 * on the same field, e.g. {@code {age: {$gte: 18, $lt: 65}}}; all conditions share
 * the predicate's class.
 */
public class Predicate {
    private final String field;
    private final PredicateClass predicateClass;
    private final List<Condition> conditions;
    
    public Predicate(String field, PredicateClass predicateClass, List<Condition> conditions) {
        this.field = Objects.requireNonNull(field, "Field name cannot be null");
        this.predicateClass = Objects.requireNonNull(predicateClass, "Predicate class cannot be null");
        Objects.requireNonNull(conditions, "Conditions cannot be null");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("A predicate needs at least one condition");
        }
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }
    
    public Predicate(String field, Operator operator, Object operand) {
        this(field, operator.getDefaultClass(), List.of(new Condition(operator, operand)));
    }
    
    public String getField() {
        return field;
    }
    
    public PredicateClass getPredicateClass() {
        return predicateClass;
    }
    
    public List<Condition> getConditions() {
        return conditions;
    }
    
    /**
     * The operator of the first condition.
     */
    public Operator getOperator() {
        return conditions.get(0).getOperator();
    }
    
    /**
     * The operand of the first condition.
     */
    public Object getOperand() {
        return conditions.get(0).getOperand();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Predicate that = (Predicate) o;
        return Objects.equals(field, that.field) 
                && predicateClass == that.predicateClass 
                && Objects.equals(conditions, that.conditions);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(field, predicateClass, conditions);
    }
    
    @Override
    public String toString() {
        return String.format("Predicate{field='%s', class=%s, conditions=%s}", field, predicateClass, conditions);
    }
}
