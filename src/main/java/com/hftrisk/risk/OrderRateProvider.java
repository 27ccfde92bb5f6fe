package com.hftrisk.risk;

/** Counts orders a strategy submitted within the current rate window. */
public interface OrderRateProvider {

    int recentOrderCount(String strategyId);

    /** Records one order submission for the strategy at the current time. */
    void recordOrder(String strategyId);
}
