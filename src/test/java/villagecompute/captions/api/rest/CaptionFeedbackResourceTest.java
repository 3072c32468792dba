package villagecompute.captions.api.rest;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.captions.TestFixtures;
import villagecompute.captions.data.models.CaptionDeliveryOutcome;
import villagecompute.captions.data.models.PriceTier;
import villagecompute.captions.testing.H2TestResource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Integration tests for {@link CaptionFeedbackResource} outcome ingestion.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class CaptionFeedbackResourceTest {

    private Long captionId;

    @BeforeEach
    @Transactional
    public void setupTestData() {
        TestFixtures.clearAll();
        captionId = TestFixtures.caption(PriceTier.STANDARD, "chat", null).id;
    }

    private Map<String, Object> event(int sent, int viewed, int purchased, double earnings) {
        Map<String, Object> event = new HashMap<>();
        event.put("caption_id", captionId);
        event.put("creator_id", "alice");
        event.put("sent_count", sent);
        event.put("viewed_count", viewed);
        event.put("purchased_count", purchased);
        event.put("earnings", earnings);
        event.put("sent_at", Instant.now().minus(2, ChronoUnit.HOURS).toString());
        return event;
    }

    @Test
    public void testSubmit_storesOutcomes() {
        given().contentType(ContentType.JSON)
                .body(Map.of("events", List.of(event(100, 40, 4, 60.0), event(80, 20, 0, 0.0)))).when()
                .post("/api/captions/feedback").then().statusCode(202).body("accepted", equalTo(2));

        long stored = QuarkusTransaction.requiringNew().call(CaptionDeliveryOutcome::countUnprocessed);
        assertEquals(2, stored);
    }

    @Test
    public void testSubmit_emptyBatch_returns400() {
        given().contentType(ContentType.JSON).body(Map.of("events", List.of())).when().post("/api/captions/feedback")
                .then().statusCode(400);
    }

    @Test
    public void testSubmit_negativeEarnings_returns400() {
        given().contentType(ContentType.JSON).body(Map.of("events", List.of(event(10, 5, 1, -3.0)))).when()
                .post("/api/captions/feedback").then().statusCode(400);
    }
}
