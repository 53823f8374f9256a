package com.civicgate.database;

import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;

import java.util.List;

/**
 * Everything recorded for one session.
 *
 * @param session  the session row, null if the id is unknown
 * @param events   events ordered by sequence number, a result right after its call
 * @param messages conversation turns ordered by turn number
 */
public record SessionTimeline(SessionSnapshot session, List<TelemetryEvent> events, List<MessageTurn> messages) {

    public SessionTimeline {
        events = List.copyOf(events);
        messages = List.copyOf(messages);
    }
}
