package com.bbthechange.roomsync.model;

/**
 * Result of evaluating the role hierarchy for one requested change.
 */
public record HierarchyDecision(boolean allowed, HierarchyRule rule, String message) {

    public static HierarchyDecision allow(HierarchyRule rule) {
        return new HierarchyDecision(true, rule, rule.getDescription());
    }

    public static HierarchyDecision deny(HierarchyRule rule) {
        return new HierarchyDecision(false, rule, rule.getDescription());
    }

    public static HierarchyDecision invalid(String message) {
        return new HierarchyDecision(false, HierarchyRule.INVALID_ROLE, message);
    }

    public boolean isInvalidInput() {
        return rule == HierarchyRule.INVALID_ROLE;
    }
}
