package com.relay.broker.popup;

public enum PopupStatus {
    PENDING   ("pending"),
    RESOLVED  ("resolved"),
    CANCELLED ("cancelled"),
    TIMED_OUT ("timeout");

    public final String wireName;

    PopupStatus(String wireName) { this.wireName = wireName; }

    public boolean isTerminal() { return this != PENDING; }
}
