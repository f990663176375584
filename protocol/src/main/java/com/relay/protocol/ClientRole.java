package com.relay.protocol;

/**
 * Role assigned to a client at identification.
 *
 * Wire names follow the identify handshake's {@code clientType} field.
 * Unknown or missing types map to REQUESTER.
 */
public enum ClientRole {
    REQUESTER ("ai_client",       "requester"),
    RESPONDER ("vscode_instance", "responder");

    public final String wireName;
    private final String alias;

    ClientRole(String wireName, String alias) {
        this.wireName = wireName;
        this.alias    = alias;
    }

    public static ClientRole fromClientType(String clientType) {
        if (clientType == null) return REQUESTER;
        for (ClientRole r : values()) {
            if (r.wireName.equals(clientType) || r.alias.equals(clientType)) return r;
        }
        return REQUESTER;
    }

    /** Strict lookup used for routing targets; returns null when the name is not a role. */
    public static ClientRole fromWireName(String name) {
        if (name == null) return null;
        for (ClientRole r : values()) {
            if (r.wireName.equals(name) || r.alias.equals(name)) return r;
        }
        return null;
    }
}
