package com.forgemind.core.error;

/**
 * Thrown when a lifecycle edge is allowed but its precondition is not met.
 */
public class PromotionBlockedException extends ForgemindException {

    private final String condition;

    public PromotionBlockedException(String behaviorId, String condition) {
        super("Promotion of " + behaviorId + " blocked: " + condition);
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }
}
