package io.vaultkit.client.api.sys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MountResponse(
        @JsonProperty("type") String type,
        @JsonProperty("description") String description,
        @JsonProperty("accessor") String accessor,
        @JsonProperty("local") boolean local,
        @JsonProperty("seal_wrap") boolean sealWrap,
        @JsonProperty("external_entropy_access") boolean externalEntropyAccess,
        @JsonProperty("options") Map<String, String> options,
        @JsonProperty("config") Map<String, Object> config) {
}
