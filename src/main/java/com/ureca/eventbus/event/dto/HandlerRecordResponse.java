package com.ureca.eventbus.event.dto;

import com.ureca.eventbus.handler.entity.HandlerRecord;
import com.ureca.eventbus.handler.entity.HandlerStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record HandlerRecordResponse(
        UUID subscriptionId,
        HandlerStatus status,
        int retryCount,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        LocalDateTime nextAttemptAt,
        String errorMessage
) {
    public static HandlerRecordResponse from(HandlerRecord record) {
        return new HandlerRecordResponse(
                record.getSubscriptionId(),
                record.getStatus(),
                record.getRetryCount(),
                record.getStartedAt(),
                record.getCompletedAt(),
                record.getNextAttemptAt(),
                record.getErrorMessage()
        );
    }
}
