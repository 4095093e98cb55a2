package io.vaultkit.client.api.auth.ldap;

import io.vaultkit.endpoint.VaultEndpoint;

@VaultEndpoint(path = "auth/{self.mount}/login/{self.username}", method = "POST")
public record LdapLoginRequest(String mount, String username, String password)
        implements LdapLoginRequestEndpoint {

    @Override
    public String toString() {
        return "LdapLoginRequest[mount=" + mount + ", username=" + username + ", password=***]";
    }
}
