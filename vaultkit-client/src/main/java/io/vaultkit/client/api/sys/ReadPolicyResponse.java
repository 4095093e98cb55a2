package io.vaultkit.client.api.sys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An ACL policy.
 *
 * @param name   the policy name
 * @param policy the policy document in HCL or JSON
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadPolicyResponse(
        @JsonProperty("name") String name,
        @JsonProperty("policy") String policy) {
}
