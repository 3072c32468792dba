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
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.captions.api.types.CaptionSelectionRequestType;
import villagecompute.captions.api.types.CaptionSelectionResultType;
import villagecompute.captions.exceptions.PoolExhaustionException;
import villagecompute.captions.exceptions.ValidationException;
import villagecompute.captions.observability.LoggingConfig;
import villagecompute.captions.services.CaptionSelectionService;

/**
 * Caption selection endpoint.
 *
 * <p>
 * {@code POST /api/captions/selections} returns ranked captions for one creator. Nothing is reserved; the caller
 * locks the chosen captions through {@link CaptionAssignmentResource}.
 */
@Path("/api/captions/selections")
@Tag(
        name = "Captions",
        description = "Caption selection and reservation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CaptionSelectionResource {

    private static final Logger LOG = Logger.getLogger(CaptionSelectionResource.class);

    @Inject
    CaptionSelectionService captionSelectionService;

    @POST
    @Operation(
            summary = "Select captions for a creator",
            description = "Ranks eligible captions with Thompson sampling, diversity and tier quotas. A pool that cannot fill the request returns a partial result unless fail_on_shortfall is set.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Selection returned, possibly partial (status insufficient_eligible)",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CaptionSelectionResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request"),
                    @APIResponse(
                            responseCode = "422",
                            description = "Shortfall with fail_on_shortfall set, body carries the partial result")})
    public Response select(@Valid @NotNull CaptionSelectionRequestType request) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("POST /api/captions/selections");
        try {
            CaptionSelectionResultType result = captionSelectionService.select(request);
            return Response.ok(result).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (PoolExhaustionException e) {
            LOG.infof("Selection for creator %s failed on shortfall", request.creatorId());
            return Response.status(422).entity(e.getPartialResult()).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    public record ErrorResponse(String error) {
    }
}
