package io.vaultkit.client.api.transit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * @param plaintext base64-encoded plaintext
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecryptResponse(@JsonProperty("plaintext") String plaintext) {

    /**
     * Decodes the plaintext as UTF-8 text.
     *
     * @throws IllegalArgumentException if the plaintext is not valid base64
     */
    public String plaintextString() {
        return new String(Base64.getDecoder().decode(plaintext), StandardCharsets.UTF_8);
    }
}
