package com.ureca.eventbus.handler.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * (이벤트, 구독) 단위 처리 기록이자 멱등성 키
 * <p>
 * 행은 HandlerRecordRepository 의 INSERT ... ON CONFLICT DO NOTHING 으로만 생성
 * next_attempt_at: 시도 중이면 시도 임대 만료 시각, 재시도 대기면 다음 시도 가능 시각
 */
@Entity
@Table(
        name = "event_handlers",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_handler_event_subscription",
                columnNames = {"event_id", "subscription_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HandlerRecord {

    @Id
    private UUID id;

    @Column(nullable = false)
    private UUID eventId;

    @Column(nullable = false)
    private UUID subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private HandlerStatus status;

    @Column(nullable = false)
    private Integer retryCount;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime nextAttemptAt;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
