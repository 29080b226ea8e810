package com.fsnow.indexadvisor.parser;

import com.fsnow.indexadvisor.exception.UnsupportedQueryException;
import com.fsnow.indexadvisor.model.Operator;
import com.fsnow.indexadvisor.model.PredicateClass;
import org.bson.BsonRegularExpression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies MongoDB operators and validates their operands.
 */
public class OperatorAnalyzer {
    
    private static final Set<String> DISJUNCTIVE_OPERATORS = new HashSet<>(Arrays.asList(
            "$or", "$nor"
    ));
    
    private static final Set<String> IGNORED_TOP_LEVEL_KEYS = new HashSet<>(Arrays.asList(
            "$comment"
    ));
    
    private OperatorAnalyzer() {}
    
    /**
     * Determines if an operator introduces a disjunction.
     */
    public static boolean isDisjunction(String operator) {
        return DISJUNCTIVE_OPERATORS.contains(operator);
    }
    
    /**
     * Determines if a top-level key carries no predicate and can be skipped.
     */
    public static boolean isIgnoredTopLevelKey(String key) {
        return IGNORED_TOP_LEVEL_KEYS.contains(key);
    }
    
    /**
     * Determines the class of an operator applied to an operand. A $in list longer than
     * the cardinality threshold scans like a range and is classified as one.
     */
    public static PredicateClass classify(Operator operator, Object operand, int inCardinalityThreshold) {
        if (operator == Operator.IN && operand instanceof Collection
                && ((Collection<?>) operand).size() > inCardinalityThreshold) {
            return PredicateClass.RANGE;
        }
        return operator.getDefaultClass();
    }
    
    /**
     * Validates an operand and converts it into the canonical form kept in the predicate model.
     */
    public static Object canonicalOperand(String field, Operator operator, Object operand, Object regexOptions) {
        switch (operator) {
            case IN:
            case NIN:
                if (!(operand instanceof Collection)) {
                    throw new UnsupportedQueryException(String.format(
                            "%s on field '%s' requires an array", operator.getKeyword(), field));
                }
                List<Object> values = new ArrayList<>();
                for (Object value : (Collection<?>) operand) {
                    values.add(isRegexLiteral(value) ? toRegularExpression(field, value, null) : value);
                }
                return values;
                
            case SIZE:
                if (!(operand instanceof Number)) {
                    throw new UnsupportedQueryException(String.format(
                            "$size on field '%s' requires a number", field));
                }
                return operand;
                
            case REGEX:
                return toRegularExpression(field, operand, regexOptions);
                
            default:
                return operand;
        }
    }
    
    /**
     * Checks whether a plain value is a regular expression literal, e.g. {@code {name: /^bo/}}.
     */
    public static boolean isRegexLiteral(Object value) {
        return value instanceof Pattern || value instanceof BsonRegularExpression;
    }
    
    /**
     * Converts the supported regular expression representations to a BsonRegularExpression,
     * which has value equality.
     */
    public static BsonRegularExpression toRegularExpression(String field, Object value, Object options) {
        String extraOptions = options instanceof String ? (String) options : "";
        if (value instanceof BsonRegularExpression) {
            BsonRegularExpression regex = (BsonRegularExpression) value;
            return new BsonRegularExpression(regex.getPattern(), regex.getOptions() + extraOptions);
        }
        if (value instanceof Pattern) {
            Pattern pattern = (Pattern) value;
            return new BsonRegularExpression(pattern.pattern(), patternFlagsToOptions(pattern.flags()) + extraOptions);
        }
        if (value instanceof String) {
            return new BsonRegularExpression((String) value, extraOptions);
        }
        throw new UnsupportedQueryException(String.format("$regex on field '%s' requires a pattern", field));
    }
    
    private static String patternFlagsToOptions(int flags) {
        StringBuilder options = new StringBuilder();
        if ((flags & Pattern.CASE_INSENSITIVE) != 0) options.append('i');
        if ((flags & Pattern.MULTILINE) != 0) options.append('m');
        if ((flags & Pattern.DOTALL) != 0) options.append('s');
        if ((flags & Pattern.COMMENTS) != 0) options.append('x');
        return options.toString();
    }
}
