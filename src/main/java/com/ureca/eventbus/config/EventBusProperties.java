package com.ureca.eventbus.config;

import com.ureca.eventbus.event.store.DurabilityMode;
import com.ureca.eventbus.handler.service.BackoffType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * eventbus.* 설정 바인딩
 * 스케줄 주기처럼 어노테이션에서 직접 쓰는 값은 @Value 로 읽는다
 */
@ConfigurationProperties(prefix = "eventbus")
public record EventBusProperties(
        Store store,
        Publisher publisher,
        Listener listener,
        Reconciliation reconciliation,
        Dispatch dispatch,
        RetryPolicy retry,
        Cleanup cleanup
) {
    public record Store(
            DurabilityMode durability
    ) {
    }

    public record Publisher(
            String defaultSource,
            Duration defaultTtl,
            int defaultMaxRetries
    ) {
    }

    public record Listener(
            boolean enabled,
            List<String> channels,
            long pollTimeoutMs,
            long reconnectInitialBackoffMs,
            long reconnectMaxBackoffMs
    ) {
    }

    public record Reconciliation(
            int batchSize,
            Duration lease,
            Duration idleRecheck,
            long failureMaxBackoffMs
    ) {
    }

    public record Dispatch(
            Duration localTimeout,
            Duration attemptLease,
            Duration remoteConnectTimeout,
            Duration remoteReadTimeout
    ) {
    }

    public record RetryPolicy(
            BackoffType backoff,
            double multiplier,
            Duration maxDelay
    ) {
    }

    public record Cleanup(
            Duration retention,
            int batchSize,
            boolean archiveEnabled
    ) {
    }
}
