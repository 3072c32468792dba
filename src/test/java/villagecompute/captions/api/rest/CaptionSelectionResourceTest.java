package villagecompute.captions.api.rest;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.captions.TestFixtures;
import villagecompute.captions.data.models.PriceTier;
import villagecompute.captions.testing.H2TestResource;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for {@link CaptionSelectionResource}.
 *
 * <p>
 * Tests cover:
 * <ul>
 * <li>Successful selection with snake_case payload</li>
 * <li>Request validation (bean constraints and quota rules)</li>
 * <li>Shortfall reporting with and without fail_on_shortfall</li>
 * </ul>
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class CaptionSelectionResourceTest {

    @BeforeEach
    @Transactional
    public void setupTestData() {
        TestFixtures.clearAll();
        TestFixtures.captions(PriceTier.BUDGET, 4);
        TestFixtures.captions(PriceTier.STANDARD, 4);
    }

    @Test
    public void testSelect_returnsQuotaFilledPicks() {
        given().contentType(ContentType.JSON)
                .body(Map.of("creator_id", "alice", "count_needed", 4, "price_tier_quota_map",
                        Map.of("budget", 2, "standard", 2)))
                .when().post("/api/captions/selections").then().statusCode(200).body("status", equalTo("ok"))
                .body("request_id", notNullValue()).body("items", hasSize(4))
                .body("items.price_tier", containsInAnyOrder("budget", "budget", "standard", "standard"))
                .body("items[0].selection_strategy", equalTo("explore"))
                .body("items[0].wilson_bounds.lower", notNullValue())
                .body("pool_health.total_available", equalTo(8)).body("pool_health.final_selected", equalTo(4));
    }

    @Test
    public void testSelect_missingCreator_returns400() {
        given().contentType(ContentType.JSON).body(Map.of("count_needed", 4)).when().post("/api/captions/selections")
                .then().statusCode(400);
    }

    @Test
    public void testSelect_unknownTier_returns400() {
        given().contentType(ContentType.JSON)
                .body(Map.of("creator_id", "alice", "count_needed", 4, "price_tier_quota_map", Map.of("gold", 2)))
                .when().post("/api/captions/selections").then().statusCode(400).body("error", containsString("gold"));
    }

    @Test
    public void testSelect_shortfall_reportedWith200() {
        given().contentType(ContentType.JSON).body(Map.of("creator_id", "alice", "count_needed", 10)).when()
                .post("/api/captions/selections").then().statusCode(200)
                .body("status", equalTo("insufficient_eligible")).body("items", hasSize(8));
    }

    @Test
    public void testSelect_failOnShortfall_returns422WithPartialResult() {
        given().contentType(ContentType.JSON)
                .body(Map.of("creator_id", "alice", "count_needed", 10, "fail_on_shortfall", true)).when()
                .post("/api/captions/selections").then().statusCode(422)
                .body("status", equalTo("insufficient_eligible"))
                .body("reason", equalTo("insufficient eligible captions")).body("items", hasSize(8));
    }
}
