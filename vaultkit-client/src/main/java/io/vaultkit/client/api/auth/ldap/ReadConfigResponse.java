package io.vaultkit.client.api.auth.ldap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The LDAP configuration. The bind password is never returned.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadConfigResponse(
        @JsonProperty("url") String url,
        @JsonProperty("userdn") String userdn,
        @JsonProperty("userattr") String userattr,
        @JsonProperty("groupdn") String groupdn,
        @JsonProperty("groupfilter") String groupfilter,
        @JsonProperty("groupattr") String groupattr,
        @JsonProperty("binddn") String binddn,
        @JsonProperty("upndomain") String upndomain,
        @JsonProperty("starttls") boolean starttls,
        @JsonProperty("insecure_tls") boolean insecureTls,
        @JsonProperty("token_policies") List<String> tokenPolicies) {
}
