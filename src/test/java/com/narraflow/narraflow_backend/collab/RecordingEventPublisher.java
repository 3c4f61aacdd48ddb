package com.narraflow.narraflow_backend.collab;

import com.narraflow.narraflow_backend.engine.FlowEventPublisher;
import com.narraflow.narraflow_backend.model.collab.FlowEvent;
import com.narraflow.narraflow_backend.model.collab.FlowEventType;

import java.util.ArrayList;
import java.util.List;

/** Keeps published events in memory instead of sending them to a broker. */
class RecordingEventPublisher extends FlowEventPublisher {

    private final List<FlowEvent> events = new ArrayList<>();

    RecordingEventPublisher() {
        super(null, null);
    }

    @Override
    public synchronized void publish(FlowEvent event) {
        events.add(event);
    }

    synchronized List<FlowEvent> events() {
        return List.copyOf(events);
    }

    synchronized List<FlowEvent> eventsOfType(FlowEventType type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }

    synchronized void clear() {
        events.clear();
    }
}
