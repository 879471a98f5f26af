package com.kiln.ui;

import java.util.List;
import java.util.Objects;

/**
 * One machine-readable UI event.
 *
 * @param timestamp seconds since the epoch
 * @param target    build name that produced the event; empty for host-level events
 * @param type      event type (e.g. {@code ui}, {@code artifact})
 * @param data      event fields, in order; null fields become empty strings
 */
public record UiEvent(long timestamp, String target, String type, List<String> data) {

    /** Event type used for say/message/error output. */
    public static final String TYPE_UI = "ui";

    public UiEvent {
        target = target != null ? target : "";
        Objects.requireNonNull(type, "type");
        data = data != null ? data.stream().map(d -> d != null ? d : "").toList() : List.of();
    }
}
