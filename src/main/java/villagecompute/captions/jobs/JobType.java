package villagecompute.captions.jobs;

/**
 * Enumeration of background job types with their queue assignments and execution cadence.
 *
 * <p>
 * Each job type maps to exactly one {@link JobQueue} family. Handler implementations register themselves with the
 * corresponding job type for CDI discovery. Every type here is exclusive: a run is skipped while another run of the
 * same type is in progress on this instance.
 *
 * @see JobQueue for queue family descriptions
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Folds delivery outcomes into the decayed bandit ledger.
     * <p>
     * <b>Cadence:</b> Every 6 hours ({@code bandit.feedback.cron}), plus on demand from the admin API
     * <p>
     * <b>Handler:</b> FeedbackUpdateJobHandler
     */
    FEEDBACK_UPDATE(JobQueue.DEFAULT, "Bandit feedback update (6 hours)"),

    /**
     * Deactivates reservations past their expiry horizon and releases their day claims.
     * <p>
     * <b>Cadence:</b> Hourly ({@code bandit.assignment.sweep-cron})
     * <p>
     * <b>Handler:</b> AssignmentExpirySweepJobHandler
     */
    ASSIGNMENT_EXPIRY_SWEEP(JobQueue.LOW, "Reservation expiry sweep (hourly)");

    private final JobQueue queue;
    private final String description;

    JobType(JobQueue queue, String description) {
        this.queue = queue;
        this.description = description;
    }

    /**
     * Returns the queue family this job type executes in.
     */
    public JobQueue getQueue() {
        return queue;
    }

    /**
     * Returns a human-readable description including cadence.
     */
    public String getDescription() {
        return description;
    }
}
