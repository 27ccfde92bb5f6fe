package com.hftrisk.event;

/**
 * Severity of a {@link RiskEvent}. HIGH and CRITICAL events are additionally pushed to the
 * escalation channel. The weight feeds the running risk score.
 */
public enum RiskSeverity {

    MEDIUM(1),

    HIGH(3),

    /** Triggers automatic protective action (strategy stop). */
    CRITICAL(5);

    private final int weight;

    RiskSeverity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public boolean isEscalated() {
        return this == HIGH || this == CRITICAL;
    }

    public String code() {
        return name().toLowerCase();
    }
}
