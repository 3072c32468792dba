package villagecompute.captions.api.rest;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;
import villagecompute.captions.testing.H2TestResource;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class HealthResourceTest {

    @Test
    public void testHealth_reportsUp() {
        given().when().get("/api/health").then().statusCode(200).body("status", equalTo("UP"))
                .body("active_assignments", greaterThanOrEqualTo(0));
    }
}
