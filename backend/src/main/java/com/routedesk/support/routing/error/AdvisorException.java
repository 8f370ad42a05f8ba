package com.routedesk.support.routing.error;

/**
 * Upstream error, timeout or malformed response from the routing advisor.
 */
public class AdvisorException extends RoutingException {

    public AdvisorException(String detail) {
        super(detail);
    }

    public AdvisorException(String detail, Throwable cause) {
        super(detail, cause);
    }
}
