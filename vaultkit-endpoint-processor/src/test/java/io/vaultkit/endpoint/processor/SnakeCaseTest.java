package io.vaultkit.endpoint.processor;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SnakeCaseTest {

    @ParameterizedTest
    @CsvSource({
            "roleId, role_id",
            "ttl, ttl",
            "tokenBoundCidrs, token_bound_cidrs",
            "tokenTTL, token_ttl",
            "secretIdNumUses, secret_id_num_uses"
    })
    void toSnakeCase_convertsCamelCase(String input, String expected) {
        assertThat(SnakeCase.toSnakeCase(input)).isEqualTo(expected);
    }
}
