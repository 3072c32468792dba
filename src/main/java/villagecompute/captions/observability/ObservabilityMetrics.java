package villagecompute.captions.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.captions.jobs.JobQueue;
import villagecompute.captions.services.JobDispatchService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registers and manages custom metrics of the caption selection engine.
 *
 * <p>
 * All metrics follow the naming convention {@code captions_<category>_<metric>}:
 * <ul>
 * <li><b>Gauges:</b> {@code captions_assignments_active} - active reservations, refreshed by the expiry sweep</li>
 * <li><b>Gauges:</b> {@code captions_jobs_running{queue}} - jobs currently executing per queue</li>
 * <li><b>Counters:</b> {@code captions_selection_requests_total{status}} - selection outcomes</li>
 * <li><b>Counters:</b> {@code captions_pool_filtered_total{stage}} - candidates removed per filter stage</li>
 * <li><b>Counters:</b> {@code captions_lock_batches_total{result}} - reservation batch outcomes</li>
 * <li><b>Counters:</b> {@code captions_lock_compensations_total} - batches rolled back after a partial insert</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}. Gauges read cached values instead of querying the
 * database from the scrape thread.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    JobDispatchService jobDispatchService;

    private final AtomicLong activeAssignments = new AtomicLong(0);

    private final Map<String, Counter> selectionCounters = new ConcurrentHashMap<>();

    private final Map<String, Counter> lockCounters = new ConcurrentHashMap<>();

    /**
     * Registers gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering caption selection metrics");

        Gauge.builder("captions_assignments_active", activeAssignments, AtomicLong::get)
                .description("Active caption reservations as of the last expiry sweep").register(registry);

        for (JobQueue queue : JobQueue.values()) {
            Gauge.builder("captions_jobs_running", jobDispatchService, s -> s.getRunningCount(queue))
                    .description(queue.getDescription() + " jobs currently executing")
                    .tags(List.of(Tag.of("queue", queue.name()))).register(registry);
        }

        LOG.infof("Caption selection metrics registration complete. Access metrics at /q/metrics");
    }

    public void setActiveAssignments(long count) {
        activeAssignments.set(count);
    }

    public long getActiveAssignments() {
        return activeAssignments.get();
    }

    /**
     * Records a finished selection request and the candidates each filter stage removed.
     *
     * @param status
     *            {@code ok}, {@code insufficient_eligible} or {@code failed_shortfall}
     * @param removedByStage
     *            candidates removed, keyed by stage name
     */
    public void recordSelection(String status, Map<String, Integer> removedByStage) {
        selectionCounters.computeIfAbsent(status, s -> Counter.builder("captions_selection_requests_total")
                .description("Caption selection requests by outcome").tag("status", s).register(registry))
                .increment();

        removedByStage.forEach((stage, removed) -> {
            if (removed > 0) {
                Counter.builder("captions_pool_filtered_total").description("Candidates removed per filter stage")
                        .tag("stage", stage).register(registry).increment(removed);
            }
        });
    }

    /**
     * Records the outcome of a reservation batch: {@code locked}, {@code conflict} or {@code replayed}.
     */
    public void recordLockBatch(String result) {
        lockCounters.computeIfAbsent(result, r -> Counter.builder("captions_lock_batches_total")
                .description("Caption reservation batches by outcome").tag("result", r).register(registry))
                .increment();
    }

    public void incrementLockCompensation() {
        Counter.builder("captions_lock_compensations_total")
                .description("Reservation batches rolled back after a partial insert").register(registry).increment();
    }
}
