package com.hftrisk.event;

/** Remedial step implied by a risk violation. Handled exhaustively by the risk service. */
public enum RiskAction {

    /** The order was already refused synchronously; nothing left to do. */
    BLOCK_ORDER("block_order"),

    /** Signal position reduction for the strategy. */
    REDUCE_EXPOSURE("reduce_exposure"),

    /** Signal the strategy kill switch. */
    STOP_STRATEGY("stop_strategy"),

    /** Keep the position under closer watch. */
    MONITOR_POSITION("monitor_position");

    private final String code;

    RiskAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
