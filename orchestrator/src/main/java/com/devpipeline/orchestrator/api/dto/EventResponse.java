package com.devpipeline.orchestrator.api.dto;

import com.devpipeline.orchestrator.model.ExecutionEvent;

import java.time.Instant;

public record EventResponse(
        long    sequence,
        String  type,
        String  stageName,
        String  detail,
        Instant occurredAt
) {
    public static EventResponse from(ExecutionEvent event) {
        return new EventResponse(
                event.getId() == null ? 0L : event.getId(),
                event.getType().name(),
                event.getStageName(),
                event.getDetail(),
                event.getOccurredAt()
        );
    }
}
