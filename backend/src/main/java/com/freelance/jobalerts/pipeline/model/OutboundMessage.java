package com.freelance.jobalerts.pipeline.model;

import java.util.List;

public record OutboundMessage(
    String text,
    List<ActionLink> links
) {
    public OutboundMessage {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
