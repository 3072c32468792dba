package villagecompute.captions.jobs;

/**
 * Queue families for background work.
 *
 * <p>Each queue has its own running-jobs gauge so a stuck ledger update can be told apart from a slow sweep.
 */
public enum JobQueue {

    /**
     * DEFAULT queue - learning work that feeds selection quality.
     * <p>Handles: feedback ledger updates.
     * <p><b>SLA:</b> completes well within one feedback interval (6 hours)
     */
    DEFAULT("Ledger maintenance"),

    /**
     * LOW queue - housekeeping.
     * <p>Handles: reservation expiry sweep.
     */
    LOW("Background cleanup");

    private final String description;

    JobQueue(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
