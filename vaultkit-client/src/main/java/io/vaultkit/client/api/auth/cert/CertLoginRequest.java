package io.vaultkit.client.api.auth.cert;

import io.vaultkit.endpoint.VaultEndpoint;

/**
 * Logs in with the client's TLS certificate.
 *
 * @param mount the auth mount, usually {@code cert}
 * @param name  the certificate role to match against, or null to try every role
 */
@VaultEndpoint(path = "auth/{self.mount}/login", method = "POST")
public record CertLoginRequest(String mount, String name) implements CertLoginRequestEndpoint {
}
