package com.ureca.eventbus.event.service;

import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.event.dto.EventDraft;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.exception.EventPublishException;
import com.ureca.eventbus.event.exception.InvalidEventRequestException;
import com.ureca.eventbus.event.exception.InvalidEventTypeException;
import com.ureca.eventbus.event.repository.EventRepository;
import com.ureca.eventbus.event.signal.EventPublishedSignal;
import com.ureca.eventbus.routing.PatternMatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 이벤트 발행
 * <p>
 * 호출자 트랜잭션이 있으면 참여하여 비즈니스 변경과 함께 커밋되고, 없으면 자체 트랜잭션으로 커밋
 * 커밋 이후 EventSignalListener 가 NOTIFY 를 보낸다
 * 저장 실패는 EventPublishException 으로 호출자에게 전달
 */
@Slf4j
@Service
public class EventPublisher {

    private final EventRepository eventRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final EventBusProperties.Publisher defaults;

    public EventPublisher(
            EventRepository eventRepository,
            ApplicationEventPublisher applicationEventPublisher,
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry,
            EventBusProperties properties
    ) {
        this.eventRepository = eventRepository;
        this.applicationEventPublisher = applicationEventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.meterRegistry = meterRegistry;
        this.defaults = properties.publisher();
    }

    public UUID publish(String eventType, Map<String, Object> payload, String tenantId,
                        String companyId, String userId, String source, Duration ttl) {
        return publish(eventType, payload, tenantId, companyId, userId, source, ttl, null);
    }

    public UUID publish(String eventType, Map<String, Object> payload, String tenantId,
                        String companyId, String userId, String source, Duration ttl, Integer maxRetries) {
        return publish(new EventDraft(eventType, payload, tenantId, companyId, userId, source, ttl, maxRetries));
    }

    /**
     * 단건 발행
     *
     * @param draft 발행할 이벤트
     * @return 저장된 이벤트 ID
     * @throws InvalidEventTypeException    이벤트 타입 형식 오류
     * @throws InvalidEventRequestException tenantId 누락, ttl 또는 maxRetries 범위 오류
     * @throws EventPublishException        저장(커밋) 실패
     */
    public UUID publish(EventDraft draft) {
        Event event = toEvent(draft, LocalDateTime.now());
        execute(draft.eventType(), () -> List.of(store(event)));

        log.info("[Publish] 이벤트 발행. eventId: {}, eventType: {}, tenantId: {}",
                event.getId(), event.getEventType(), event.getTenantId());
        return event.getId();
    }

    /**
     * 일괄 발행 (한 트랜잭션, 커밋 후 이벤트마다 NOTIFY)
     * 하나라도 검증에 실패하면 아무것도 저장하지 않는다
     *
     * @param drafts   발행할 이벤트 목록 (tenantId, source 가 없으면 인자 값 사용)
     * @param tenantId 기본 테넌트
     * @param source   기본 발행 모듈
     * @return 입력 순서대로 저장된 이벤트 ID
     */
    public List<UUID> publishBatch(List<EventDraft> drafts, String tenantId, String source) {
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now();
        List<Event> events = new ArrayList<>(drafts.size());
        for (EventDraft draft : drafts) {
            events.add(toEvent(draft.withRouting(tenantId, source), now));
        }

        List<UUID> ids = execute("batch(" + events.size() + ")",
                () -> events.stream().map(this::store).toList());

        log.info("[Publish] 일괄 발행. 건수: {}, tenantId: {}", ids.size(), tenantId);
        return ids;
    }

    private UUID store(Event event) {
        eventRepository.save(event);
        applicationEventPublisher.publishEvent(
                new EventPublishedSignal(event.getId(), event.getEventType(), event.getCategory()));
        return event.getId();
    }

    private List<UUID> execute(String eventType, Supplier<List<UUID>> work) {
        try {
            List<UUID> ids = transactionTemplate.execute(status -> work.get());
            Counter.builder("event_bus_events_published_total")
                    .tag("result", "success")
                    .register(meterRegistry).increment(ids == null ? 0 : ids.size());
            return ids;
        } catch (DataAccessException | TransactionException e) {
            Counter.builder("event_bus_events_published_total")
                    .tag("result", "fail")
                    .register(meterRegistry).increment();
            log.error("[Publish] 이벤트 저장 실패. eventType: {}, error: {}", eventType, e.getMessage());
            throw new EventPublishException(eventType, e);
        }
    }

    private Event toEvent(EventDraft draft, LocalDateTime now) {
        if (!PatternMatcher.isValidEventType(draft.eventType())) {
            throw new InvalidEventTypeException(draft.eventType());
        }
        if (draft.tenantId() == null || draft.tenantId().isBlank()) {
            throw new InvalidEventRequestException("tenantId 는 필수입니다. eventType: " + draft.eventType());
        }

        Duration ttl = draft.ttl() != null ? draft.ttl() : defaults.defaultTtl();
        if (ttl.isZero() || ttl.isNegative()) {
            throw new InvalidEventRequestException("ttl 은 0보다 커야 합니다. ttl: " + ttl);
        }

        int maxRetries = draft.maxRetries() != null ? draft.maxRetries() : defaults.defaultMaxRetries();
        if (maxRetries < 0) {
            throw new InvalidEventRequestException("maxRetries 는 0 이상이어야 합니다. maxRetries: " + maxRetries);
        }

        String source = draft.source() != null && !draft.source().isBlank()
                ? draft.source()
                : defaults.defaultSource();

        return Event.create(draft.eventType(), source, draft.payload(), draft.tenantId(),
                draft.companyId(), draft.userId(), ttl, maxRetries, now);
    }
}
