package dev.reviewgate.infrastructure.kantata;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.reviewgate.config.KantataProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class CustomFieldValueUpserterTest {

    private static final String VALUES = "/custom_field_values";

    private CustomFieldValueUpserter upserter;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        KantataProperties properties = new KantataProperties(wmInfo.getHttpBaseUrl(), "test-token", "field-1",
                null, 0, null, null, Duration.ofSeconds(2), null);
        upserter = new CustomFieldValueUpserter(new KantataApiClient(WebClient.builder(), properties));
    }

    @Test
    @DisplayName("first push creates the value, second push updates it")
    void createThenUpdate() {
        stubFor(get(urlPathEqualTo(VALUES)).inScenario("field")
                .whenScenarioStateIs(STARTED)
                .willReturn(okJson("{\"count\": 0, \"results\": []}")));
        stubFor(post(urlPathEqualTo(VALUES)).inScenario("field")
                .whenScenarioStateIs(STARTED)
                .willReturn(okJson(existing("In Progress")))
                .willSetStateTo("exists"));
        stubFor(get(urlPathEqualTo(VALUES)).inScenario("field")
                .whenScenarioStateIs("exists")
                .willReturn(okJson(existing("In Progress"))));
        stubFor(put(urlPathEqualTo(VALUES + "/777")).willReturn(ok()));

        assertThat(upserter.upsert("123", "field-1", "In Progress")).isEqualTo(UpsertOutcome.CREATED);
        assertThat(upserter.upsert("123", "field-1", "Approved")).isEqualTo(UpsertOutcome.UPDATED);

        verify(1, postRequestedFor(urlPathEqualTo(VALUES))
                .withRequestBody(matchingJsonPath("$.custom_field_value.subject_id", equalTo("123")))
                .withRequestBody(matchingJsonPath("$.custom_field_value.value", equalTo("In Progress"))));
        verify(1, putRequestedFor(urlPathEqualTo(VALUES + "/777"))
                .withRequestBody(equalToJson("{\"custom_field_value\": {\"value\": \"Approved\"}}")));
    }

    @Test
    void lookup404CreatesTheValue() {
        stubFor(get(urlPathEqualTo(VALUES)).willReturn(notFound()));
        stubFor(post(urlPathEqualTo(VALUES)).willReturn(okJson(existing("Approved"))));

        assertThat(upserter.upsert("123", "field-1", "Approved")).isEqualTo(UpsertOutcome.CREATED);
        verify(0, putRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("a failed lookup is not a reason to create")
    void lookupServerErrorNeverCreates() {
        stubFor(get(urlPathEqualTo(VALUES)).willReturn(serverError()));

        assertThatThrownBy(() -> upserter.upsert("123", "field-1", "Approved"))
                .isInstanceOf(KantataApiException.class);
        verify(0, postRequestedFor(anyUrl()));
        verify(0, putRequestedFor(anyUrl()));
    }

    @Test
    void updateFailureIsThrown() {
        stubFor(get(urlPathEqualTo(VALUES)).willReturn(okJson(existing("In Progress"))));
        stubFor(put(urlPathEqualTo(VALUES + "/777")).willReturn(aResponse().withStatus(422)));

        assertThatThrownBy(() -> upserter.upsert("123", "field-1", "Approved"))
                .isInstanceOf(KantataApiException.class)
                .hasMessageContaining("422");
        verify(0, postRequestedFor(anyUrl()));
    }

    private static String existing(String value) {
        return """
                {"count": 1,
                 "results": [{"key": "custom_field_values", "id": "777"}],
                 "custom_field_values": {"777": {"id": "777", "value": "%s"}}}
                """.formatted(value);
    }
}
