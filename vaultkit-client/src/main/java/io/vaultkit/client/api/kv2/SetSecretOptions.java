package io.vaultkit.client.api.kv2;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Write options.
 *
 * @param cas check-and-set: the write only succeeds if the current version equals this
 *            value; 0 only allows creating a new secret
 */
public record SetSecretOptions(@JsonProperty("cas") Integer cas) {

    public static SetSecretOptions checkAndSet(int version) {
        return new SetSecretOptions(version);
    }
}
