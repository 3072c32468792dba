package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request type for POST /api/captions/feedback. Events are stored and folded into the ledger by the next feedback
 * run.
 */
public record FeedbackBatchType(
        @NotEmpty @Size(max = 5000) @Valid @JsonProperty("events") List<DeliveryOutcomeType> events) {
}
