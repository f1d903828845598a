package com.agentflow.core.condition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;

/**
 * Compiles and evaluates branch and loop predicates written in Spring Expression Language.
 *
 * Predicates see a read-only map scope: one entry per step name holding
 * {@code {result, status, error}}, plus {@code input} for the execution's input data.
 * Evaluation runs in a {@link SimpleEvaluationContext}, so no types, constructors or bean
 * references are reachable. A predicate that fails to evaluate, or yields anything but
 * {@code true}, counts as false.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final SpelExpressionParser parser = new SpelExpressionParser();
    private final EvaluationContext context = SimpleEvaluationContext
        .forPropertyAccessors(new MapPropertyAccessor())
        .build();

    /**
     * Parse a predicate.
     *
     * @throws InvalidConditionException if the source is not a valid expression
     */
    public StepCondition compile(String source) {
        if (source == null || source.isBlank()) {
            throw new InvalidConditionException(String.valueOf(source),
                new IllegalArgumentException("expression is empty"));
        }
        try {
            return new StepCondition(source, parser.parseExpression(source));
        } catch (ParseException e) {
            throw new InvalidConditionException(source, e);
        }
    }

    /**
     * Evaluate a predicate against a scope of step outcomes.
     */
    public boolean evaluate(StepCondition condition, Map<String, Object> scope) {
        try {
            Object value = condition.expression().getValue(context, scope);
            return Boolean.TRUE.equals(value);
        } catch (EvaluationException e) {
            log.warn("Condition '{}' could not be evaluated, treating as false: {}",
                condition.source(), e.getMessage());
            return false;
        }
    }
}
