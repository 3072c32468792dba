package villagecompute.captions.services;

/**
 * Outcome of one reservation expiry sweep.
 *
 * @param expired
 *            assignments deactivated because their expiry horizon passed
 * @param pastSendDate
 *            assignments deactivated because their claimed window ended
 * @param activeRemaining
 *            active assignments left after the sweep
 */
public record SweepResult(int expired, int pastSendDate, long activeRemaining) {

    public int total() {
        return expired + pastSendDate;
    }
}
