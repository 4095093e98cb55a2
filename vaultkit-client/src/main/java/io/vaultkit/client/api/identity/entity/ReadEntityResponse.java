package io.vaultkit.client.api.identity.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * An identity entity.
 *
 * @param aliases the entity's aliases, one per auth method mount it has logged in through
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReadEntityResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("policies") List<String> policies,
        @JsonProperty("disabled") boolean disabled,
        @JsonProperty("creation_time") String creationTime,
        @JsonProperty("last_update_time") String lastUpdateTime,
        @JsonProperty("aliases") List<EntityAlias> aliases) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntityAlias(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("mount_accessor") String mountAccessor,
            @JsonProperty("mount_type") String mountType,
            @JsonProperty("mount_path") String mountPath) {
    }
}
