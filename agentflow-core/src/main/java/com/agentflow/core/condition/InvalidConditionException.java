package com.agentflow.core.condition;

/**
 * Thrown when a predicate cannot be parsed.
 */
public class InvalidConditionException extends IllegalArgumentException {

    public InvalidConditionException(String source, Throwable cause) {
        super("Invalid condition '" + source + "': " + cause.getMessage(), cause);
    }
}
