package com.ureca.eventbus.subscription.entity;

import com.ureca.eventbus.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * 모듈이 등록한 이벤트 구독
 * <p>
 * (subscriber_name, handler_name) 기준 upsert, 버스가 삭제하지 않음
 * callback_address 가 있으면 원격 전달, 없으면 로컬 핸들러 호출
 */
@Entity
@Table(
        name = "event_subscriptions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_subscription_subscriber_handler",
                columnNames = {"subscriber_name", "handler_name"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventSubscription extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String subscriberName;

    @Column(nullable = false, length = 200)
    private String handlerName;

    @Column(nullable = false)
    private String pattern;

    @Column(length = 64)
    private String tenantId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> filterConditions;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DeliveryMode deliveryMode;

    @Column(nullable = false)
    private int maxRetryAttempts;

    @Column(nullable = false)
    private int retryDelaySeconds;

    @Column(length = 500)
    private String callbackAddress;

    private LocalDateTime lastTriggeredAt;

    @Column(nullable = false)
    private long totalEventsProcessed;

    @Column(nullable = false)
    private long totalEventsFailed;

    @Builder
    private EventSubscription(String subscriberName, String handlerName, String pattern,
                              String tenantId, Map<String, Object> filterConditions,
                              int priority, DeliveryMode deliveryMode,
                              int maxRetryAttempts, int retryDelaySeconds, String callbackAddress) {
        this.subscriberName = subscriberName;
        this.handlerName = handlerName;
        this.pattern = pattern;
        this.tenantId = tenantId;
        this.filterConditions = filterConditions;
        this.active = true;
        this.priority = priority;
        this.deliveryMode = deliveryMode;
        this.maxRetryAttempts = maxRetryAttempts;
        this.retryDelaySeconds = retryDelaySeconds;
        this.callbackAddress = callbackAddress;
        this.totalEventsProcessed = 0;
        this.totalEventsFailed = 0;
    }

    // 재등록 시 선언 내용 갱신 (활성 여부와 통계는 유지)
    public void updateRegistration(String pattern, String tenantId, Map<String, Object> filterConditions,
                                   int priority, DeliveryMode deliveryMode,
                                   int maxRetryAttempts, int retryDelaySeconds, String callbackAddress) {
        this.pattern = pattern;
        this.tenantId = tenantId;
        this.filterConditions = filterConditions;
        this.priority = priority;
        this.deliveryMode = deliveryMode;
        this.maxRetryAttempts = maxRetryAttempts;
        this.retryDelaySeconds = retryDelaySeconds;
        this.callbackAddress = callbackAddress;
    }

    public void activate() {
        this.active = true;
    }

    public void deactivate() {
        this.active = false;
    }

    public boolean isRemote() {
        return callbackAddress != null && !callbackAddress.isBlank();
    }

    public boolean isAsync() {
        return deliveryMode == DeliveryMode.ASYNC;
    }

    public Duration getRetryDelay() {
        return Duration.ofSeconds(retryDelaySeconds);
    }
}
