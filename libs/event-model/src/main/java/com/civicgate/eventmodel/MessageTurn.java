package com.civicgate.eventmodel;

/**
 * One conversation turn attached to a checkpoint.
 *
 * @param turn    turn number, unique per session
 * @param role    speaker role (for example "user", "assistant")
 * @param content arbitrary JSON-compatible content
 */
public record MessageTurn(int turn, String role, Object content) {

    public MessageTurn {
        if (turn < 0) {
            throw new IllegalArgumentException("turn must be >= 0");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be null or blank");
        }
    }
}
