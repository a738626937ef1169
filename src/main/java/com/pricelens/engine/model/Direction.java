package com.pricelens.engine.model;

/**
 * Direction of a recommended price change relative to the current price.
 */
public enum Direction {
    UP,
    DOWN,
    SAME;

    /**
     * Maps a percentage change to a direction; changes strictly inside the dead band are SAME.
     */
    public static Direction of(double changePercent, double deadBandPercent) {
        if (Math.abs(changePercent) < deadBandPercent) return SAME;
        return changePercent > 0 ? UP : DOWN;
    }
}
