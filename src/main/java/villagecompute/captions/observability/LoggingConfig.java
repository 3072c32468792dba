package villagecompute.captions.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Structured logging field definitions and MDC helpers.
 *
 * <p>
 * Every log line written while serving a selection, a reservation or a background job carries these fields so that a
 * single request can be followed through the logs:
 * <ul>
 * <li>{@code trace_id}, {@code span_id}: OpenTelemetry context of the current span (empty strings when none)</li>
 * <li>{@code creator_id}: creator the request or job item concerns</li>
 * <li>{@code schedule_id}: schedule of a reservation batch</li>
 * <li>{@code job_id}: run id of a background job</li>
 * <li>{@code request_origin}: entry point, e.g. {@code POST /api/captions/selections} or a scheduler name</li>
 * </ul>
 *
 * <p>
 * Callers must invoke {@link #clearMDC()} in a {@code finally} block; worker threads are reused.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_CREATOR_ID = "creator_id";

    public static final String MDC_SCHEDULE_ID = "schedule_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies the current OpenTelemetry trace and span ids into the MDC.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            // Set empty strings to maintain consistent JSON schema
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setCreatorId(String creatorId) {
        if (creatorId != null) {
            MDC.put(MDC_CREATOR_ID, creatorId);
        }
    }

    public static void setScheduleId(String scheduleId) {
        if (scheduleId != null) {
            MDC.put(MDC_SCHEDULE_ID, scheduleId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    /**
     * Clears all observability-related MDC fields. Should be called at the end of every request/job to prevent context
     * leakage across thread reuse.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_CREATOR_ID);
        MDC.remove(MDC_SCHEDULE_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
    }
}
