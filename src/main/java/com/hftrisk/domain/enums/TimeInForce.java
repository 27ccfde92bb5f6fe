package com.hftrisk.domain.enums;

/** Order expiry semantics. GTD orders must carry an expiry timestamp. */
public enum TimeInForce {
    /** Good-til-canceled. */
    GTC,
    /** Immediate-or-cancel. */
    IOC,
    /** Fill-or-kill. */
    FOK,
    /** Good-til-date. */
    GTD;

    public boolean requiresExpiry() {
        return this == GTD;
    }

    public String code() {
        return name().toLowerCase();
    }

    public static TimeInForce fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (TimeInForce timeInForce : values()) {
            if (timeInForce.name().equalsIgnoreCase(code.trim())) {
                return timeInForce;
            }
        }
        return null;
    }
}
