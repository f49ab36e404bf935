package com.routecast.common.exception;

public class RoutingEngineException extends RuntimeException {
    private final String routeKey;

    public RoutingEngineException(String message) {
        super(message);
        this.routeKey = null;
    }

    public RoutingEngineException(String routeKey, String message) {
        super("[" + routeKey + "] " + message);
        this.routeKey = routeKey;
    }

    public RoutingEngineException(String routeKey, String message, Throwable cause) {
        super(routeKey == null ? message : "[" + routeKey + "] " + message, cause);
        this.routeKey = routeKey;
    }

    /** @return the route this failure belongs to, or {@code null} for engine-wide failures */
    public String getRouteKey() {
        return routeKey;
    }
}
