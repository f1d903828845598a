package com.agentflow.core.condition;

import org.springframework.expression.Expression;
import org.springframework.expression.spel.SpelNode;
import org.springframework.expression.spel.ast.CompoundExpression;
import org.springframework.expression.spel.ast.Projection;
import org.springframework.expression.spel.ast.PropertyOrFieldReference;
import org.springframework.expression.spel.ast.Selection;
import org.springframework.expression.spel.standard.SpelExpression;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A parsed predicate, ready to be evaluated against accumulated step results.
 */
public record StepCondition(String source, Expression expression) {

    /**
     * Top-level names the predicate reads from its scope, such as {@code A} in
     * {@code A.result.flag == true}. Property access below those names is not included.
     */
    public Set<String> referencedNames() {
        Set<String> names = new LinkedHashSet<>();
        if (expression instanceof SpelExpression) {
            collectScopeReads(((SpelExpression) expression).getAST(), names);
        }
        return names;
    }

    private static void collectScopeReads(SpelNode node, Set<String> names) {
        if (node instanceof PropertyOrFieldReference) {
            names.add(((PropertyOrFieldReference) node).getName());
            return;
        }
        if (node instanceof CompoundExpression) {
            collectScopeReads(node.getChild(0), names);
            for (int i = 1; i < node.getChildCount(); i++) {
                collectNestedReads(node.getChild(i), names);
            }
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collectScopeReads(node.getChild(i), names);
        }
    }

    // indexer and method arguments are evaluated against the scope again
    private static void collectNestedReads(SpelNode node, Set<String> names) {
        if (node instanceof PropertyOrFieldReference || node instanceof Selection || node instanceof Projection) {
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collectScopeReads(node.getChild(i), names);
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
