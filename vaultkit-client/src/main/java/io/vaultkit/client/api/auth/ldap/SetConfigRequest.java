package io.vaultkit.client.api.auth.ldap;

import io.vaultkit.endpoint.VaultEndpoint;
import java.util.List;

/**
 * Configures the LDAP connection and user/group lookup.
 *
 * @param url         comma-separated LDAP URLs, e.g. {@code ldaps://ldap.example.com}
 * @param userdn      base DN for user search
 * @param userattr    attribute matched against the login username, e.g. {@code uid}
 * @param groupdn     base DN for group search
 * @param groupfilter Go template filter for group membership
 * @param groupattr   attribute holding the group name, e.g. {@code cn}
 * @param binddn      DN used for searches
 * @param bindpass    password for {@code binddn}
 * @param upndomain   userPrincipalDomain for Active Directory binds
 * @param starttls    issue a StartTLS command after connecting
 * @param insecureTls skip certificate verification of the LDAP server
 */
@VaultEndpoint(path = "auth/{self.mount}/config", method = "POST", builder = true)
public record SetConfigRequest(
        String mount,
        String url,
        String userdn,
        String userattr,
        String groupdn,
        String groupfilter,
        String groupattr,
        String binddn,
        String bindpass,
        String upndomain,
        Boolean starttls,
        Boolean insecureTls,
        List<String> tokenPolicies) implements SetConfigRequestEndpoint {

    @Override
    public String toString() {
        return "SetConfigRequest[mount=" + mount + ", url=" + url + ", userdn=" + userdn + ", binddn=" + binddn
                + ", bindpass=***]";
    }
}
