package com.routedesk.support.routing.error;

/**
 * The rule or ticket store could not be reached.
 */
public class StoreUnavailableException extends RoutingException {

    private final String store;

    public StoreUnavailableException(String store, Throwable cause) {
        super("store_unavailable", cause);
        this.store = store;
    }

    public String store() {
        return store;
    }
}
