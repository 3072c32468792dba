package villagecompute.captions.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
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
import villagecompute.captions.api.types.AssignmentConflictType;
import villagecompute.captions.api.types.AssignmentLockRequestType;
import villagecompute.captions.api.types.AssignmentLockResultType;
import villagecompute.captions.data.models.ActiveAssignment;
import villagecompute.captions.exceptions.AssignmentConflictException;
import villagecompute.captions.exceptions.ResourceNotFoundException;
import villagecompute.captions.exceptions.ValidationException;
import villagecompute.captions.observability.LoggingConfig;
import villagecompute.captions.services.AssignmentLockService;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Caption reservation endpoints.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/captions/assignments} – reserve a batch of captions for a schedule, all or nothing</li>
 * <li>{@code DELETE /api/captions/assignments/{scheduleId}} – cancel a schedule's reservations</li>
 * </ul>
 *
 * <p>
 * A rejected batch answers 409 with the conflicting caption ids; the caller selects again and retries.
 */
@Path("/api/captions/assignments")
@Tag(
        name = "Captions",
        description = "Caption selection and reservation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CaptionAssignmentResource {

    private static final Logger LOG = Logger.getLogger(CaptionAssignmentResource.class);

    @Inject
    AssignmentLockService assignmentLockService;

    @POST
    @Operation(
            summary = "Reserve captions",
            description = "Reserves every (caption, date, hour) tuple or none. A caption reserved within the cooldown window by any creator is a conflict.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "All captions reserved",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = AssignmentLockResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request or unknown caption"),
                    @APIResponse(
                            responseCode = "409",
                            description = "One or more captions already reserved, nothing was reserved",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = AssignmentConflictType.class)))})
    public Response lock(@Valid @NotNull AssignmentLockRequestType request) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setScheduleId(request.scheduleId());
        LoggingConfig.setCreatorId(request.creatorId());
        try {
            List<ActiveAssignment> assignments = assignmentLockService.lock(request.scheduleId(), request.creatorId(),
                    request.assignments());
            List<UUID> ids = assignments.stream().map(a -> a.id).toList();
            return Response.status(Response.Status.CREATED)
                    .entity(new AssignmentLockResultType(request.scheduleId(), ids, ids.size())).build();
        } catch (AssignmentConflictException e) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(AssignmentConflictType.of(e.getConflictingCaptionIds())).build();
        } catch (ValidationException | ResourceNotFoundException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @DELETE
    @Path("/{scheduleId}")
    @Operation(
            summary = "Cancel a schedule",
            description = "Deactivates every active reservation of the schedule and releases its captions.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Schedule cancelled, body carries the number of released reservations"),
                    @APIResponse(
                            responseCode = "404",
                            description = "No active reservations for the schedule")})
    public Response cancel(@PathParam("scheduleId") String scheduleId) {
        LoggingConfig.setScheduleId(scheduleId);
        try {
            int cancelled = assignmentLockService.cancel(scheduleId);
            if (cancelled == 0) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(Map.of("error", "No active reservations for schedule " + scheduleId)).build();
            }
            LOG.infof("Cancelled schedule %s via API (%d reservations)", scheduleId, cancelled);
            return Response.ok(Map.of("schedule_id", scheduleId, "cancelled_count", cancelled)).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
