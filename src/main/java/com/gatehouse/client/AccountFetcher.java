package com.gatehouse.client;

import java.util.Optional;

/**
 * Remote "who am I" check used to restore a session.
 */
public interface AccountFetcher {

    Optional<AccountPrincipal> fetch(AuthStateConfig config, String token);
}
