package com.fsnow.indexadvisor.parser;

import com.fsnow.indexadvisor.exception.UnsupportedQueryException;
import com.fsnow.indexadvisor.model.Condition;
import com.fsnow.indexadvisor.model.Operator;
import com.fsnow.indexadvisor.model.Predicate;
import com.fsnow.indexadvisor.model.PredicateClass;
import com.fsnow.indexadvisor.model.Query;
import com.fsnow.indexadvisor.model.RawQuery;
import com.fsnow.indexadvisor.transformation.ConjunctionFlattener;
import com.fsnow.indexadvisor.transformation.ConjunctionFlattener.FieldClause;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts logged queries into the normalized predicate model.
 * <p>
 * Never throws for a bad query: shapes the advisor cannot handle come back as
 * {@link Query#unsupported(String, com.fsnow.indexadvisor.model.OperationType) unsupported}
 * queries carrying the reason.
 */
public class QueryNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryNormalizer.class);

    private final ConjunctionFlattener flattener;
    private final SortParser sortParser;
    private final int inCardinalityThreshold;

    public QueryNormalizer(int inCardinalityThreshold) {
        if (inCardinalityThreshold <= 0) {
            throw new IllegalArgumentException("$in cardinality threshold must be positive");
        }
        this.flattener = new ConjunctionFlattener();
        this.sortParser = new SortParser();
        this.inCardinalityThreshold = inCardinalityThreshold;
    }

    /**
     * Normalizes a logged query.
     */
    public Query normalize(RawQuery raw) {
        try {
            if (!raw.getOperationType().isFilterBased()) {
                throw new UnsupportedQueryException("Unsupported operation type: " + raw.getOperationType());
            }

            Query.Builder builder = new Query.Builder()
                    .operationType(raw.getOperationType())
                    .limit(raw.getLimit());

            Map<String, List<Condition>> conditionsByField = new LinkedHashMap<>();
            for (FieldClause clause : flattener.flatten(raw.getFilter())) {
                conditionsByField.computeIfAbsent(clause.getField(), f -> new ArrayList<>())
                        .addAll(parseFieldCondition(clause.getField(), clause.getCondition()));
            }

            for (Map.Entry<String, List<Condition>> entry : conditionsByField.entrySet()) {
                builder.addPredicate(toPredicate(entry.getKey(), entry.getValue()));
            }

            sortParser.parse(raw.getSort()).forEach(builder::addSortField);
            projectedFields(raw.getProjection()).forEach(builder::addProjectionField);

            return builder.build();
        } catch (UnsupportedQueryException e) {
            logger.debug("Skipping unsupported query {}: {}", raw, e.getMessage());
            return Query.unsupported(e.getMessage(), raw.getOperationType());
        }
    }

    /**
     * Normalizes a query expressed with Spring Data MongoDB criteria.
     *
     * @param criteria The query criteria (null for an empty filter)
     * @param sort The sort specification (can be null)
     */
    public Query normalize(Criteria criteria, Sort sort) {
        Document filter = criteria == null ? new Document() : criteria.getCriteriaObject();
        return normalize(RawQuery.builder()
                .filter(filter)
                .sort(sortParser.toDocument(sort))
                .build());
    }

    /**
     * Parses the value bound to one field into its conditions.
     */
    private List<Condition> parseFieldCondition(String field, Object value) {
        List<Condition> conditions = new ArrayList<>();

        if (OperatorAnalyzer.isRegexLiteral(value)) {
            conditions.add(new Condition(Operator.REGEX, OperatorAnalyzer.toRegularExpression(field, value, null)));
            return conditions;
        }

        if (!(value instanceof Document) || !hasOperatorKeys((Document) value)) {
            // Scalars, arrays and embedded documents without operators are equality matches
            conditions.add(new Condition(Operator.EQ, value));
            return conditions;
        }

        Document operators = (Document) value;
        for (Map.Entry<String, Object> entry : operators.entrySet()) {
            String key = entry.getKey();

            if (!key.startsWith("$")) {
                throw new UnsupportedQueryException(String.format(
                        "Field '%s' mixes operators with plain key '%s'", field, key));
            }
            if ("$options".equals(key)) {
                if (!operators.containsKey("$regex")) {
                    throw new UnsupportedQueryException(String.format(
                            "$options without $regex on field '%s'", field));
                }
                continue;
            }

            Optional<Operator> operator = Operator.fromKeyword(key);
            if (operator.isEmpty()) {
                throw new UnsupportedQueryException(String.format(
                        "Unsupported operator '%s' on field '%s'", key, field));
            }

            Object operand = OperatorAnalyzer.canonicalOperand(
                    field, operator.get(), entry.getValue(), operators.get("$options"));
            conditions.add(new Condition(operator.get(), operand));
        }

        return conditions;
    }

    /**
     * Folds all conditions collected for a field into one predicate. Only range bounds
     * with distinct operators may share a field.
     */
    private Predicate toPredicate(String field, List<Condition> conditions) {
        Set<PredicateClass> classes = new HashSet<>();
        Set<Operator> operators = new HashSet<>();
        PredicateClass predicateClass = null;

        for (Condition condition : conditions) {
            predicateClass = OperatorAnalyzer.classify(
                    condition.getOperator(), condition.getOperand(), inCardinalityThreshold);
            classes.add(predicateClass);

            if (!operators.add(condition.getOperator())) {
                throw new UnsupportedQueryException(String.format(
                        "Operator %s repeated on field '%s'", condition.getOperator().getKeyword(), field));
            }
        }

        if (classes.size() > 1) {
            throw new UnsupportedQueryException(String.format(
                    "Conflicting operator classes %s on field '%s'", classes, field));
        }
        if (conditions.size() > 1 && predicateClass != PredicateClass.RANGE) {
            throw new UnsupportedQueryException(String.format(
                    "Multiple %s conditions on field '%s'", predicateClass, field));
        }

        return new Predicate(field, predicateClass, conditions);
    }

    private boolean hasOperatorKeys(Document document) {
        return document.keySet().stream().anyMatch(key -> key.startsWith("$"));
    }

    private List<String> projectedFields(Document projection) {
        List<String> fields = new ArrayList<>();
        if (projection == null) {
            return fields;
        }
        for (Map.Entry<String, Object> entry : projection.entrySet()) {
            Object flag = entry.getValue();
            boolean included = flag instanceof Boolean ? (Boolean) flag
                    : !(flag instanceof Number) || ((Number) flag).intValue() != 0;
            if (included) {
                fields.add(entry.getKey());
            }
        }
        return fields;
    }
}
