package com.example.exod_detector.model;

import java.util.List;

/**
 * Events grouped per tile plus the event list header.
 *
 * @param header        header of the event list.
 * @param eventsPerTile one ordered event list per tile, indexed by tile id.
 */
public record ObservationData(ObservationHeader header, List<List<Event>> eventsPerTile) {

    public ObservationData {
        eventsPerTile = eventsPerTile.stream().map(List::copyOf).toList();
    }

    public int tileCount() {
        return eventsPerTile.size();
    }

    public double firstEventTime() {
        return eventsPerTile.stream().flatMap(List::stream).mapToDouble(Event::time).min()
                .orElseThrow(() -> new IllegalStateException("Observation has no events"));
    }

    public double lastEventTime() {
        return eventsPerTile.stream().flatMap(List::stream).mapToDouble(Event::time).max()
                .orElseThrow(() -> new IllegalStateException("Observation has no events"));
    }
}
