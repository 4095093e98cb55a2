package io.vaultkit.client.api.identity.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListEntitiesResponse(@JsonProperty("keys") List<String> keys) {
}
