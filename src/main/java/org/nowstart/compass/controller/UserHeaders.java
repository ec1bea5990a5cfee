package org.nowstart.compass.controller;

/**
 * Header carrying the authenticated user id, set by the gateway in front of the service.
 */
final class UserHeaders {

    static final String USER_ID = "X-User-Id";

    private UserHeaders() {
    }
}
