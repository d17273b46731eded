package com.ureca.eventbus.event.entity;

import com.ureca.eventbus.event.exception.IllegalEventStateException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 발행된 이벤트 한 건
 * <p>
 * 상태 변경은 EventRepository 의 조건부 UPDATE 로만 일어난다
 * (claim 을 가진 워커만 변경, 역행 금지)
 * locked_by / locked_until 은 claim 임대 정보로 만료되면 다른 워커가 다시 가져간다
 * 반납 후에는 locked_by 가 비고 locked_until 은 다음 재조정 확인 시각
 */
@Entity
@Table(name = "events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, length = 100)
    private String eventSource;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> payload;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Column(length = 64)
    private String companyId;

    @Column(length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventStatus status;

    @Column(nullable = false)
    private Integer retryCount;

    @Column(nullable = false)
    private Integer maxRetries;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private LocalDateTime lastErrorAt;

    @Column(length = 100)
    private String lockedBy;

    private LocalDateTime lockedUntil;

    @Builder
    private Event(String eventType, String eventSource, Map<String, Object> payload,
                  String tenantId, String companyId, String userId,
                  Integer maxRetries, LocalDateTime createdAt, LocalDateTime expiresAt) {
        this.eventType = eventType;
        this.eventSource = eventSource;
        this.payload = payload;
        this.tenantId = tenantId;
        this.companyId = companyId;
        this.userId = userId;
        this.status = EventStatus.PENDING;
        this.retryCount = 0;
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    // 팩토리 메서드
    public static Event create(String eventType, String eventSource, Map<String, Object> payload,
                               String tenantId, String companyId, String userId,
                               Duration ttl, int maxRetries, LocalDateTime now) {
        return Event.builder()
                .eventType(eventType)
                .eventSource(eventSource)
                .payload(payload == null ? new HashMap<>() : new HashMap<>(payload))
                .tenantId(tenantId)
                .companyId(companyId)
                .userId(userId)
                .maxRetries(maxRetries)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
    }

    // 첫 번째 세그먼트 (order.created -> order)
    public String getCategory() {
        int dot = eventType.indexOf('.');
        return dot < 0 ? eventType : eventType.substring(0, dot);
    }

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * 메모리상 상태 전이 (조건부 UPDATE 성공 후 엔티티를 맞출 때 사용)
     * 종료 상태 최초 진입 시에만 processedAt 기록
     */
    public void transitionTo(EventStatus next, LocalDateTime now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalEventStateException(id, status, next);
        }
        this.status = next;
        if (next.isTerminal() && this.processedAt == null) {
            this.processedAt = now;
        }
    }
}
