package com.relay.broker.routing;

public record RoutingStats(int inFlightRequests, int queuedMessages, int queuedClients) {}
