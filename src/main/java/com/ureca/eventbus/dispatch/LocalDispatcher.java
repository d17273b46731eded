package com.ureca.eventbus.dispatch;

import com.ureca.eventbus.config.AsyncConfig;
import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.dispatch.exception.PermanentHandlerException;
import com.ureca.eventbus.event.dto.EventMessage;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.service.LocalHandlerTable;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 프로세스 내 핸들러 호출
 * <p>
 * 핸들러는 Dispatch Executor 에서 실행되고 호출별 타임아웃을 넘기면 인터럽트 후 실패 처리
 * 타임아웃, 일반 예외: 재시도 대상 / PermanentHandlerException: 즉시 실패
 */
@Slf4j
@Component
public class LocalDispatcher implements Dispatcher {

    private final LocalHandlerTable handlerTable;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;
    private final MeterRegistry meterRegistry;

    public LocalDispatcher(
            LocalHandlerTable handlerTable,
            @Qualifier(AsyncConfig.DISPATCH_EXECUTOR_NAME) AsyncTaskExecutor executor,
            EventBusProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.handlerTable = handlerTable;
        this.executor = executor;
        this.timeout = properties.dispatch().localTimeout();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean canDispatch(EventSubscription subscription) {
        return !subscription.isRemote() && handlerTable.contains(subscription.getHandlerName());
    }

    @Override
    public DispatchOutcome dispatch(EventSubscription subscription, Event event) {
        Optional<EventHandler> handler = handlerTable.find(subscription.getHandlerName());
        if (handler.isEmpty()) {
            log.warn("[Local Dispatch] 핸들러 미등록. handlerName: {}, eventId: {}",
                    subscription.getHandlerName(), event.getId());
            return record(DispatchOutcome.transientFailure(
                    "handler not registered in this process: " + subscription.getHandlerName()), null);
        }

        EventMessage message = EventMessage.from(event);
        Timer.Sample sample = Timer.start(meterRegistry);

        Future<?> future;
        try {
            future = executor.submit(() -> {
                handler.get().handle(message);
                return null;
            });
        } catch (TaskRejectedException e) {
            log.warn("[Local Dispatch] Executor 포화로 실행 거절. handlerName: {}, eventId: {}",
                    subscription.getHandlerName(), event.getId());
            return record(DispatchOutcome.transientFailure("dispatch executor saturated"), sample);
        }

        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[Local Dispatch] 성공. handlerName: {}, eventId: {}",
                    subscription.getHandlerName(), event.getId());
            return record(DispatchOutcome.succeeded(), sample);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Local Dispatch] 타임아웃. handlerName: {}, eventId: {}, timeout: {}ms",
                    subscription.getHandlerName(), event.getId(), timeout.toMillis());
            return record(DispatchOutcome.transientFailure(
                    "handler timed out after " + timeout.toMillis() + "ms"), sample);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PermanentHandlerException) {
                log.warn("[Local Dispatch] 재시도 불가 실패. handlerName: {}, eventId: {}, error: {}",
                        subscription.getHandlerName(), event.getId(), cause.getMessage());
                return record(DispatchOutcome.permanentFailure(cause.getMessage()), sample);
            }
            log.warn("[Local Dispatch] 핸들러 예외. handlerName: {}, eventId: {}, error: {}",
                    subscription.getHandlerName(), event.getId(), cause.toString());
            return record(DispatchOutcome.transientFailure(cause.toString()), sample);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return record(DispatchOutcome.transientFailure("dispatch interrupted"), sample);
        }
    }

    private DispatchOutcome record(DispatchOutcome outcome, Timer.Sample sample) {
        if (sample != null) {
            sample.stop(Timer.builder("event_bus_dispatch_duration")
                    .tag("mode", "local")
                    .register(meterRegistry));
        }
        Counter.builder("event_bus_dispatch_total")
                .tag("mode", "local")
                .tag("result", resultTag(outcome))
                .register(meterRegistry).increment();
        return outcome;
    }

    static String resultTag(DispatchOutcome outcome) {
        if (outcome.success()) {
            return "success";
        }
        return outcome.retryable() ? "retryable" : "permanent";
    }
}
