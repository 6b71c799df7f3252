package com.realtycrm.mlssync.dto.property;

import com.realtycrm.mlssync.model.ChangeEventType;
import com.realtycrm.mlssync.model.PropertyChangeEvent;

import java.time.Instant;

public record PropertyChangeEventView(ChangeEventType eventType, String oldValue, String newValue, String syncRunId,
                                      Instant occurredAt) {

    public static PropertyChangeEventView from(final PropertyChangeEvent event) {
        return new PropertyChangeEventView(event.getEventType(), event.getOldValue(), event.getNewValue(),
                                           event.getSyncRunId(), event.getOccurredAt());
    }
}
