package villagecompute.captions.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.jobs.JobHandler;
import villagecompute.captions.jobs.JobQueue;
import villagecompute.captions.jobs.JobType;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes background job runs to their {@link JobHandler}.
 *
 * <p>
 * This service handles:
 * <ul>
 * <li>CDI discovery of handlers into a type → handler registry</li>
 * <li>Per-type exclusivity: a run is refused while another run of the same type is in progress</li>
 * <li>Synchronous runs for schedulers and asynchronous runs for on-demand API triggers</li>
 * <li>OpenTelemetry instrumentation of every run</li>
 * </ul>
 *
 * <p>
 * Exclusivity is per instance. Schedulers additionally declare {@code ConcurrentExecution.SKIP} so a slow run never
 * overlaps the next trigger.
 *
 * @see JobHandler for handler contract
 * @see JobType for job-to-queue mappings
 */
@ApplicationScoped
public class JobDispatchService {

    private static final Logger LOG = Logger.getLogger(JobDispatchService.class);

    private static final int ASYNC_WORKERS = 2;

    /**
     * Registry mapping JobType → JobHandler for CDI-based handler discovery.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    private final Map<JobType, AtomicBoolean> runningByType = new EnumMap<>(JobType.class);

    private final Map<JobQueue, AtomicInteger> runningByQueue = new EnumMap<>(JobQueue.class);

    private final AtomicLong runSequence = new AtomicLong();

    private final ExecutorService asyncExecutor = Executors.newFixedThreadPool(ASYNC_WORKERS, runnable -> {
        Thread thread = new Thread(runnable, "caption-job-worker");
        thread.setDaemon(true);
        return thread;
    });

    @Inject
    Tracer tracer;

    @Inject
    public JobDispatchService(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        for (JobType type : JobType.values()) {
            runningByType.put(type, new AtomicBoolean(false));
        }
        for (JobQueue queue : JobQueue.values()) {
            runningByQueue.put(queue, new AtomicInteger(0));
        }
        LOG.infof("Initialized JobDispatchService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Discovers all CDI-managed {@link JobHandler} beans and builds a type → handler map.
     *
     * @throws IllegalStateException
     *             if duplicate handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Instance<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s (queue: %s, %s)", handler.getClass().getSimpleName(),
                    type, type.getQueue(), type.getDescription());
        }
        return registry;
    }

    /**
     * Runs a job on the calling thread unless a run of the same type is already in progress.
     *
     * @param jobType
     *            the type of job to run
     * @param payload
     *            job parameters
     * @return the run id, or empty when the run was skipped
     */
    public OptionalLong dispatch(JobType jobType, Map<String, Object> payload) {
        if (!tryAcquire(jobType)) {
            LOG.infof("Skipping JobType.%s: a previous run is still in progress", jobType);
            return OptionalLong.empty();
        }
        long jobId = runSequence.incrementAndGet();
        try {
            executeJob(jobType, jobId, payload);
        } finally {
            release(jobType);
        }
        return OptionalLong.of(jobId);
    }

    /**
     * Starts a job on the dispatcher's worker pool unless a run of the same type is already in progress. The
     * exclusivity check happens before this method returns.
     *
     * @return the run id, or empty when a run is already in progress
     */
    public OptionalLong dispatchAsync(JobType jobType, Map<String, Object> payload) {
        if (!tryAcquire(jobType)) {
            return OptionalLong.empty();
        }
        long jobId = runSequence.incrementAndGet();
        try {
            asyncExecutor.submit(() -> {
                try {
                    executeJob(jobType, jobId, payload);
                } finally {
                    release(jobType);
                }
            });
        } catch (RuntimeException e) {
            release(jobType);
            throw e;
        }
        LOG.infof("Started JobType.%s asynchronously as run %d", jobType, jobId);
        return OptionalLong.of(jobId);
    }

    public int getRunningCount(JobQueue queue) {
        return runningByQueue.get(queue).get();
    }

    /**
     * Executes a single run by dispatching to its registered handler. Failures are logged and recorded on the span,
     * never rethrown: the next scheduled run retries naturally.
     *
     * @throws IllegalStateException
     *             if no handler registered for jobType
     */
    void executeJob(JobType jobType, Long jobId, Map<String, Object> payload) {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name()).setAttribute("job.queue", jobType.getQueue().name())
                .startSpan();
        AtomicInteger queueCounter = runningByQueue.get(jobType.getQueue());
        queueCounter.incrementAndGet();

        try (Scope scope = span.makeCurrent()) {
            handler.execute(jobId, payload);
            span.addEvent("job.completed");
            LOG.infof("Job %d (type: %s) completed successfully", jobId, jobType);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            LOG.warnf(e, "Job %d (type: %s) interrupted during execution", jobId, jobType);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.addEvent("job.failed");
            LOG.errorf(e, "Job %d (type: %s) failed", jobId, jobType);

        } finally {
            queueCounter.decrementAndGet();
            span.end();
        }
    }

    private boolean tryAcquire(JobType jobType) {
        return runningByType.get(jobType).compareAndSet(false, true);
    }

    private void release(JobType jobType) {
        runningByType.get(jobType).set(false);
    }

    @PreDestroy
    void shutdown() {
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Background job workers did not finish within 30s, interrupting");
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            asyncExecutor.shutdownNow();
        }
    }
}
