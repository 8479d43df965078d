package com.myorg.olc.eventing.routing;

import com.myorg.olc.contracts.order.OrderEventAttributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Boolean SpEL expression over an event's routing attributes, e.g.
 * {@code eventType == 'ORDER_CREATED' and requesterEmail matches '.*@corp\.com'}.
 * Evaluated in a read-only context: no bean references, no method calls on types, no assignment.
 */
@Slf4j
public final class FilterExpression {

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    // attributes every event may carry; absent ones evaluate to null instead of failing
    private static final List<String> KNOWN_ATTRIBUTES = List.of(
            OrderEventAttributes.EVENT_TYPE,
            OrderEventAttributes.ORDER_ID,
            OrderEventAttributes.REQUESTER_EMAIL
    );

    private static final FilterExpression MATCH_ALL = new FilterExpression("", null);

    private final String source;
    private final Expression expression; // null = match all

    private FilterExpression(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    /**
     * @throws IllegalArgumentException if the expression does not parse
     */
    public static FilterExpression compile(String source) {
        if (!StringUtils.hasText(source)) return MATCH_ALL;
        try {
            return new FilterExpression(source.trim(), PARSER.parseExpression(source.trim()));
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid filter expression '" + source + "': " + e.getMessage(), e);
        }
    }

    public static FilterExpression matchAll() {
        return MATCH_ALL;
    }

    public boolean isMatchAll() {
        return expression == null;
    }

    public boolean matches(Map<String, String> attributes) {
        if (expression == null) return true;

        Map<String, String> root = new HashMap<>();
        KNOWN_ATTRIBUTES.forEach(k -> root.put(k, null));
        root.putAll(attributes);

        EvaluationContext ctx = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor())
                .withRootObject(root)
                .build();
        try {
            return Boolean.TRUE.equals(expression.getValue(ctx, Boolean.class));
        } catch (EvaluationException e) {
            log.warn("Filter '{}' could not be evaluated against {}: {}", source, root.keySet(), e.getMessage());
            return false;
        }
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return isMatchAll() ? "<all>" : source;
    }
}
