package com.codesmith.orchestrator.model;

/**
 * Generation tiers, cheapest first.
 *
 * The declaration order is the escalation order: a job starts on LOCAL and
 * may only move towards PREMIUM, never back.
 */
public enum Tier {
    LOCAL,        // single local model, free and fast
    LOCAL_PLUS,   // larger local model with a review pass
    PREMIUM;      // paid cloud model

    public static Tier cheapest() {
        return LOCAL;
    }

    public boolean isMoreExpensiveThan(Tier other) {
        return ordinal() > other.ordinal();
    }

    public static Tier max(Tier a, Tier b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
