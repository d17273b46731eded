package com.ureca.eventbus.subscription.service;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.routing.SubscriptionMatcher;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.event.SubscriptionChangedEvent;
import com.ureca.eventbus.subscription.repository.EventSubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 활성 구독 메모리 캐시
 * <p>
 * 주기적으로 전체를 다시 읽고, 이 프로세스에서 구독이 바뀌면 즉시 무효화
 * 다른 인스턴스의 변경은 다음 갱신 주기에 반영된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionCache {

    private final EventSubscriptionRepository subscriptionRepository;

    private final AtomicReference<Map<UUID, EventSubscription>> snapshot = new AtomicReference<>();

    @Scheduled(fixedDelayString = "${eventbus.subscription.cache-refresh-ms}")
    public void refresh() {
        try {
            Map<UUID, EventSubscription> loaded = load();
            snapshot.set(loaded);
            log.debug("[Subscription Cache] 갱신 완료. 활성 구독 수: {}", loaded.size());
        } catch (DataAccessException e) {
            // 이전 스냅샷 유지
            log.warn("[Subscription Cache] 갱신 실패, 이전 스냅샷 사용. error: {}", e.getMessage());
        }
    }

    public void invalidate() {
        snapshot.set(null);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSubscriptionChanged(SubscriptionChangedEvent event) {
        invalidate();
        log.debug("[Subscription Cache] 무효화. subscriptionId: {}", event.subscriptionId());
    }

    // 이벤트를 받아야 하는 활성 구독 (정렬 전)
    public List<EventSubscription> findMatching(Event event) {
        return current().values().stream()
                .filter(subscription -> SubscriptionMatcher.matches(subscription, event))
                .toList();
    }

    // 활성 구독만 조회됨
    public Optional<EventSubscription> find(UUID subscriptionId) {
        return Optional.ofNullable(current().get(subscriptionId));
    }

    private Map<UUID, EventSubscription> current() {
        Map<UUID, EventSubscription> current = snapshot.get();
        if (current == null) {
            current = load();
            snapshot.compareAndSet(null, current);
        }
        return current;
    }

    private Map<UUID, EventSubscription> load() {
        Map<UUID, EventSubscription> loaded = new LinkedHashMap<>();
        for (EventSubscription subscription : subscriptionRepository.findAllByActiveTrue()) {
            loaded.put(subscription.getId(), subscription);
        }
        return Collections.unmodifiableMap(loaded);
    }
}
