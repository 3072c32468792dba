package villagecompute.captions.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.captions.jobs.JobType;
import villagecompute.captions.services.JobDispatchService;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Admin trigger for an out-of-schedule feedback run.
 */
@Path("/api/admin/captions/feedback")
@Tag(
        name = "Admin - Captions",
        description = "Operational endpoints for the caption bandit")
@Produces(MediaType.APPLICATION_JSON)
public class FeedbackAdminResource {

    private static final Logger LOG = Logger.getLogger(FeedbackAdminResource.class);

    @Inject
    JobDispatchService jobDispatchService;

    @POST
    @Path("/run")
    @Operation(
            summary = "Run a feedback update now",
            description = "Starts a feedback run in the background. Refused while another run is in progress.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Run started"),
                    @APIResponse(
                            responseCode = "409",
                            description = "A feedback run is already in progress")})
    public Response run() {
        OptionalLong runId = jobDispatchService.dispatchAsync(JobType.FEEDBACK_UPDATE, Map.of("trigger", "admin"));
        if (runId.isEmpty()) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(Map.of("error", "feedback run already in progress")).build();
        }
        LOG.infof("Feedback run %d started from admin API", runId.getAsLong());
        return Response.accepted(Map.of("run_id", runId.getAsLong(), "status", "started")).build();
    }
}
