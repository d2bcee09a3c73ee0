package com.gatehouse.client;

@FunctionalInterface
public interface PrincipalChangeListener {

    /**
     * @param principal the new principal, {@code null} once signed out
     */
    void onPrincipalChange(AccountPrincipal principal);
}
