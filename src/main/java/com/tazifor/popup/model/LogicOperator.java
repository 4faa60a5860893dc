package com.tazifor.popup.model;

import java.util.Collection;
import java.util.function.Predicate;

/**
 * How several conditions combine. An empty condition list always passes.
 */
public enum LogicOperator {
    AND,
    OR;

    public <T> boolean combine(Collection<T> conditions, Predicate<T> test) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        return this == AND
            ? conditions.stream().allMatch(test)
            : conditions.stream().anyMatch(test);
    }
}
