package com.callqueue.dispatch.caller;

/**
 * Penalty window of one caller. A null bound is unset and filters nothing.
 *
 * @param raise members with a lower penalty are ranked as if they had this one
 */
public record PenaltyBand(Integer min, Integer max, Integer raise) {

    public static final PenaltyBand NONE = new PenaltyBand(null, null, null);

    public static PenaltyBand of(Integer min, Integer max) {
        return new PenaltyBand(min, max, null);
    }

    public int raised(int penalty) {
        return raise != null && penalty < raise ? raise : penalty;
    }

    public boolean excludes(int penalty) {
        return (max != null && penalty > max) || (min != null && penalty < min);
    }
}
