package com.flagship.cashback_ledger.api;

import lombok.Value;

import java.util.Set;

/**
 * Already-authenticated caller. Credentials are checked upstream.
 */
@Value
public class RequesterIdentity {
    String accountId;
    Set<String> roles;

    public static RequesterIdentity of(String accountId, String... roles) {
        return new RequesterIdentity(accountId, Set.of(roles));
    }

    public static RequesterIdentity system() {
        return new RequesterIdentity("system", Set.of("system"));
    }

    public boolean hasRole(String role) {
        return roles != null && roles.contains(role);
    }
}
