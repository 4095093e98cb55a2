package io.vaultkit.client.api.sys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthResponse(
        @JsonProperty("initialized") boolean initialized,
        @JsonProperty("sealed") boolean sealed,
        @JsonProperty("standby") boolean standby,
        @JsonProperty("performance_standby") boolean performanceStandby,
        @JsonProperty("server_time_utc") long serverTimeUtc,
        @JsonProperty("version") String version,
        @JsonProperty("cluster_name") String clusterName,
        @JsonProperty("cluster_id") String clusterId) {
}
