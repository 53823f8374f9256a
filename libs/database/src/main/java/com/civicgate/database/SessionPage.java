package com.civicgate.database;

import com.civicgate.eventmodel.SessionSnapshot;

import java.util.List;

/**
 * One page of sessions, newest first.
 */
public record SessionPage(List<SessionSnapshot> sessions, int limit, int offset) {

    public SessionPage {
        sessions = List.copyOf(sessions);
    }
}
