package com.cardroll.api;

/**
 * Request headers shared by the REST controllers.
 */
public final class ApiHeaders {

    /**
     * Identity of the calling player, set by the authentication layer in front of this service.
     */
    public static final String PLAYER_ID = "X-Player-Id";

    private ApiHeaders() {
    }
}
