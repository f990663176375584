package com.relay.broker.popup;

public record PopupStats(int total, int active, int resolved, int timedOut, int cancelled, int waitingClients) {}
