package io.vaultkit.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EndpointSupport.
 */
class EndpointSupportTest {

    @Test
    void putIfPresent_withNull_omitsKey() {
        Map<String, Object> body = new LinkedHashMap<>();

        EndpointSupport.putIfPresent(body, "ttl", null);

        assertThat(body).isEmpty();
    }

    @Test
    void putIfPresent_withEmptyOptional_omitsKey() {
        Map<String, Object> body = new LinkedHashMap<>();

        EndpointSupport.putIfPresent(body, "ttl", Optional.empty());

        assertThat(body).isEmpty();
    }

    @Test
    void putIfPresent_withPresentOptional_putsUnwrappedValue() {
        Map<String, Object> body = new LinkedHashMap<>();

        EndpointSupport.putIfPresent(body, "ttl", Optional.of("10m"));

        assertThat(body).containsExactly(Map.entry("ttl", "10m"));
    }

    @Test
    void putIfPresent_withEmptyString_keepsKey() {
        Map<String, Object> body = new LinkedHashMap<>();

        EndpointSupport.putIfPresent(body, "description", "");

        assertThat(body).containsEntry("description", "");
    }

    @Test
    void addQuery_withScalar_addsSingleParameter() {
        List<QueryParameter> query = new ArrayList<>();

        EndpointSupport.addQuery(query, "version", 3);

        assertThat(query).containsExactly(new QueryParameter("version", "3"));
    }

    @Test
    void addQuery_withCollection_addsParameterPerElement() {
        List<QueryParameter> query = new ArrayList<>();

        EndpointSupport.addQuery(query, "key", Arrays.asList("a", null, "b"));

        assertThat(query).containsExactly(
                new QueryParameter("key", "a"),
                new QueryParameter("key", "b"));
    }

    @Test
    void addQuery_withAbsentValues_addsNothing() {
        List<QueryParameter> query = new ArrayList<>();

        EndpointSupport.addQuery(query, "version", null);
        EndpointSupport.addQuery(query, "version", Optional.empty());

        assertThat(query).isEmpty();
    }

    @Test
    void pathValue_withNull_throwsException() {
        assertThatThrownBy(() -> EndpointSupport.pathValue("mount", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mount");
    }

    @Test
    void pathValue_isNotEncoded() {
        assertThat(EndpointSupport.pathValue("path", "a/b c")).isEqualTo("a/b c");
    }
}
