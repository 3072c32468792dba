package villagecompute.captions.jobs;

import java.util.Map;

/**
 * Contract for background job handler implementations.
 *
 * <p>Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement
 * this interface. The {@link villagecompute.captions.services.JobDispatchService} discovers handlers
 * at startup and routes runs based on their {@link JobType}.
 *
 * <p><b>Execution Model:</b>
 * <ul>
 *   <li>Handlers run on the scheduler thread or on the dispatcher's worker pool</li>
 *   <li>At most one run per job type executes at a time on an instance</li>
 *   <li>OpenTelemetry spans wrap handler execution</li>
 * </ul>
 *
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * @param jobId
     *            run identifier assigned by the dispatcher
     * @param payload
     *            job parameters (may be empty, never null)
     * @throws Exception
     *             if the run fails; the dispatcher logs and records it
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
