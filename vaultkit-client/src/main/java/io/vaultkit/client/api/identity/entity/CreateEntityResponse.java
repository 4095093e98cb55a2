package io.vaultkit.client.api.identity.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateEntityResponse(@JsonProperty("id") String id, @JsonProperty("name") String name) {
}
