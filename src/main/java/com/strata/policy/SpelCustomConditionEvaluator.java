package com.strata.policy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Custom conditions written in the Spring Expression Language, e.g.
 * {@code rowCount > 1000000 and codec != 'zstd'}.
 *
 * Evaluation uses a read-only data binding context: conditions can read partition
 * properties and compare them but cannot call methods or construct types.
 */
@Component
public class SpelCustomConditionEvaluator implements CustomConditionEvaluator {

    private static final int CACHE_MAX_SIZE = 500;

    private final ExpressionParser parser = new SpelExpressionParser();
    private final EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
    private final Cache<String, Expression> expressions = Caffeine.newBuilder()
        .maximumSize(CACHE_MAX_SIZE)
        .build();

    @Override
    public Optional<String> check(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of("Custom condition is empty");
        }
        try {
            parse(expression);
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
    }

    @Override
    public boolean evaluate(String expression, PartitionAttributes attributes) {
        Expression parsed = parse(expression);
        try {
            Boolean result = parsed.getValue(context, attributes, Boolean.class);
            return Boolean.TRUE.equals(result);
        } catch (EvaluationException e) {
            throw new IllegalArgumentException("Custom condition '" + expression + "' failed: " + e.getMessage(), e);
        }
    }

    private Expression parse(String expression) {
        Expression cached = expressions.getIfPresent(expression);
        if (cached != null) {
            return cached;
        }
        try {
            Expression parsed = parser.parseExpression(expression);
            expressions.put(expression, parsed);
            return parsed;
        } catch (ParseException e) {
            throw new IllegalArgumentException("Custom condition '" + expression + "' is not valid: " + e.getMessage(), e);
        }
    }
}
