package io.oauthbridge.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link HttpHeaders}. */
class HttpHeadersTest {

    @Test
    void firstIsCaseInsensitive() {
        HttpHeaders headers = HttpHeaders.of(Map.of("Content-Type", "application/json"));
        assertThat(headers.first("content-type")).isEqualTo("application/json");
        assertThat(headers.first("CONTENT-TYPE")).isEqualTo("application/json");
    }

    @Test
    void firstReturnsNullForMissingHeader() {
        assertThat(HttpHeaders.of(Map.of("Accept", "text/html")).first("X-Missing")).isNull();
    }

    @Test
    void builderKeepsRepeatedValuesInArrivalOrder() {
        HttpHeaders headers = HttpHeaders.builder()
                .add("Authorization", "Basic Zm9vOmJhcg==")
                .add("authorization", "Bearer abc")
                .build();

        assertThat(headers.count("AUTHORIZATION")).isEqualTo(2);
        assertThat(headers.all("Authorization")).containsExactly("Basic Zm9vOmJhcg==", "Bearer abc");
    }

    @Test
    void builderIgnoresNullNamesAndValues() {
        HttpHeaders headers =
                HttpHeaders.builder().add(null, "x").add("X-A", null).build();

        assertThat(headers.isEmpty()).isTrue();
        assertThat(headers).isSameAs(HttpHeaders.empty());
    }

    @Test
    void ofMultiMergesNamesDifferingOnlyInCase() {
        Map<String, List<String>> raw = new LinkedHashMap<>();
        raw.put("Accept", List.of("text/html"));
        raw.put("ACCEPT", List.of("application/json"));

        HttpHeaders headers = HttpHeaders.ofMulti(raw);

        assertThat(headers.all("accept")).containsExactly("text/html", "application/json");
        assertThat(headers.toMultiValueMap()).containsOnlyKeys("accept");
    }

    @Test
    void allIsEmptyForMissingHeader() {
        assertThat(HttpHeaders.empty().all("authorization")).isEmpty();
        assertThat(HttpHeaders.empty().count("authorization")).isZero();
        assertThat(HttpHeaders.empty().contains("authorization")).isFalse();
    }

    @Test
    void equalityIsByContent() {
        assertThat(HttpHeaders.of(Map.of("X-A", "1"))).isEqualTo(HttpHeaders.of(Map.of("x-a", "1")));
        assertThat(HttpHeaders.of(Map.of("X-A", "1"))).isNotEqualTo(HttpHeaders.of(Map.of("X-A", "2")));
    }
}
