package com.routedesk.support.routing.error;

/**
 * Base exception for routing failures. The message is a snake_case error code.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String code) {
        super(code);
    }

    public RoutingException(String code, Throwable cause) {
        super(code, cause);
    }

    public String code() {
        return getMessage();
    }
}
