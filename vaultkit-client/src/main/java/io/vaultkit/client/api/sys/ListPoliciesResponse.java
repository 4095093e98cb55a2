package io.vaultkit.client.api.sys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListPoliciesResponse(@JsonProperty("keys") List<String> keys) {
}
