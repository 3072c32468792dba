package villagecompute.captions.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.captions.api.types.FeedbackBatchType;
import villagecompute.captions.services.FeedbackUpdateService;

import java.time.Instant;
import java.util.Map;

/**
 * Ingests delivery outcomes. Outcomes are stored and folded into the ledger by the next feedback run.
 */
@Path("/api/captions/feedback")
@Tag(
        name = "Captions",
        description = "Caption selection and reservation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CaptionFeedbackResource {

    @Inject
    FeedbackUpdateService feedbackUpdateService;

    @POST
    @Operation(
            summary = "Submit delivery outcomes",
            description = "Stores sent/viewed/purchased counts and earnings per caption delivery for the next feedback run.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Outcomes accepted"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid outcome batch")})
    public Response submit(@Valid @NotNull FeedbackBatchType batch) {
        int accepted = feedbackUpdateService.recordOutcomes(batch.events(), Instant.now());
        return Response.accepted(Map.of("accepted", accepted)).build();
    }
}
