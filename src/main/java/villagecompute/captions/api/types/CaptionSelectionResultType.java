package villagecompute.captions.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Response type for POST /api/captions/selections.
 *
 * <p>
 * {@code status} is {@value #STATUS_OK} when every requested slot and tier quota was filled, otherwise
 * {@value #STATUS_INSUFFICIENT} with {@code reason} set.
 */
public record CaptionSelectionResultType(@JsonProperty("request_id") UUID requestId,
        @JsonProperty("items") List<SelectedCaptionType> items, @JsonProperty("pool_health") PoolHealthType poolHealth,
        @JsonProperty("status") String status, @JsonProperty("reason") String reason) {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_INSUFFICIENT = "insufficient_eligible";
    public static final String REASON_INSUFFICIENT = "insufficient eligible captions";

    public boolean isShortfall() {
        return STATUS_INSUFFICIENT.equals(status);
    }
}
