package io.trading.marketsync.protocol.model;

public enum AuthStatus {
    AUTHENTICATED,
    ANONYMOUS,
    FAILED;

    public static AuthStatus fromString(String value) {
        if (value == null) {
            return FAILED;
        }
        return switch (value) {
            case "authenticated" -> AUTHENTICATED;
            case "anonymous" -> ANONYMOUS;
            default -> FAILED;
        };
    }
}
