package com.fsnow.indexadvisor.estimation;

import com.fsnow.indexadvisor.model.Condition;
import com.fsnow.indexadvisor.model.Predicate;
import org.bson.BsonRegularExpression;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Sample source over a list of documents, evaluating predicates in memory.
 * Supports top-level and dotted field paths through embedded documents.
 */
public class InMemorySampleSource implements SampleSource {
    
    private final List<Document> documents;
    private final Set<String> failingFields = new HashSet<>();
    private final AtomicInteger countQueries = new AtomicInteger();
    private long delayMs;
    private RuntimeException unavailable;
    
    public InMemorySampleSource(List<Document> documents) {
        this.documents = new ArrayList<>(documents);
    }
    
    /**
     * Makes every count that constrains the field fail.
     */
    public InMemorySampleSource failOn(String field) {
        failingFields.add(field);
        return this;
    }
    
    /**
     * Delays every filtered count.
     */
    public InMemorySampleSource delay(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }
    
    /**
     * Makes every filtered count throw the given exception.
     */
    public InMemorySampleSource unavailable(RuntimeException unavailable) {
        this.unavailable = unavailable;
        return this;
    }
    
    public int getCountQueries() {
        return countQueries.get();
    }
    
    @Override
    public long count() {
        return documents.size();
    }
    
    @Override
    public long countMatching(List<Predicate> conjunction) {
        countQueries.incrementAndGet();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted", e);
            }
        }
        if (unavailable != null) {
            throw unavailable;
        }
        for (Predicate predicate : conjunction) {
            if (failingFields.contains(predicate.getField())) {
                throw new IllegalStateException("Count failed for " + predicate.getField());
            }
        }
        return documents.stream().filter(doc -> matchesAll(doc, conjunction)).count();
    }
    
    private boolean matchesAll(Document doc, List<Predicate> conjunction) {
        for (Predicate predicate : conjunction) {
            boolean present = isPresent(doc, predicate.getField());
            Object value = resolve(doc, predicate.getField());
            for (Condition condition : predicate.getConditions()) {
                if (!matches(present, value, condition)) {
                    return false;
                }
            }
        }
        return true;
    }
    
    private boolean matches(boolean present, Object value, Condition condition) {
        Object operand = condition.getOperand();
        switch (condition.getOperator()) {
            case EQ:
                return present ? Objects.equals(value, operand) : operand == null;
            case IN:
                return ((Collection<?>) operand).stream().anyMatch(o -> Objects.equals(value, o));
            case NE:
                return !Objects.equals(value, operand);
            case NIN:
                return ((Collection<?>) operand).stream().noneMatch(o -> Objects.equals(value, o));
            case EXISTS:
                return present == Boolean.TRUE.equals(operand);
            case SIZE:
                return value instanceof Collection && ((Collection<?>) value).size() == ((Number) operand).intValue();
            case REGEX:
                return value instanceof String
                        && Pattern.compile(((BsonRegularExpression) operand).getPattern()).matcher((String) value).find();
            case GT:
                return present && comparable(value, operand) && compare(value, operand) > 0;
            case GTE:
                return present && comparable(value, operand) && compare(value, operand) >= 0;
            case LT:
                return present && comparable(value, operand) && compare(value, operand) < 0;
            case LTE:
                return present && comparable(value, operand) && compare(value, operand) <= 0;
            default:
                throw new IllegalArgumentException("Unexpected operator " + condition.getOperator());
        }
    }
    
    // Mismatched types never satisfy a range bound
    private boolean comparable(Object value, Object operand) {
        if (value instanceof Number && operand instanceof Number) {
            return true;
        }
        return value instanceof Comparable && operand != null && value.getClass() == operand.getClass();
    }
    
    @SuppressWarnings({"unchecked", "rawtypes"})
    private int compare(Object value, Object operand) {
        if (value instanceof Number && operand instanceof Number) {
            return Double.compare(((Number) value).doubleValue(), ((Number) operand).doubleValue());
        }
        return ((Comparable) value).compareTo(operand);
    }
    
    private boolean isPresent(Document doc, String path) {
        Document current = doc;
        String[] parts = path.split("\\.");
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            if (!(next instanceof Document)) {
                return false;
            }
            current = (Document) next;
        }
        return current.containsKey(parts[parts.length - 1]);
    }
    
    private Object resolve(Document doc, String path) {
        Object current = doc;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Document)) {
                return null;
            }
            current = ((Document) current).get(part);
        }
        return current;
    }
}
