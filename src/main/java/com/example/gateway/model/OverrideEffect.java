package com.example.gateway.model;

/**
 * What an emergency override does while it is active.
 */
public enum OverrideEffect {
    /**
     * Multiply quotas by a factor.
     */
    QUOTA_MULTIPLIER,

    /**
     * Raise the priority class to at least the given class.
     */
    PRIORITY_FLOOR,

    /**
     * Cap the priority class at the given class.
     */
    PRIORITY_CEILING
}
