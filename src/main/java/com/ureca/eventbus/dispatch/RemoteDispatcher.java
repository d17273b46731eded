package com.ureca.eventbus.dispatch;

import com.ureca.eventbus.dispatch.dto.RemoteDispatchRequest;
import com.ureca.eventbus.dispatch.dto.RemoteDispatchResponse;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * callback_address 로 이벤트 전달
 * <p>
 * 요청: {event_id, event_type, payload, tenant_id}
 * 응답: {success, error}
 * 4xx 는 재시도 불가, 5xx, 연결 실패, 타임아웃, success=false 는 재시도 대상
 * 타임아웃은 RestClientConfig 공통 설정을 따른다
 */
@Slf4j
@Component
public class RemoteDispatcher implements Dispatcher {

    private final RestClient restClient;
    private final MeterRegistry meterRegistry;

    public RemoteDispatcher(RestClient.Builder restClientBuilder, MeterRegistry meterRegistry) {
        this.restClient = restClientBuilder.build();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean canDispatch(EventSubscription subscription) {
        return subscription.isRemote();
    }

    @Override
    public DispatchOutcome dispatch(EventSubscription subscription, Event event) {
        Timer.Sample sample = Timer.start(meterRegistry);
        DispatchOutcome outcome = call(subscription, event);

        sample.stop(Timer.builder("event_bus_dispatch_duration")
                .tag("mode", "remote")
                .register(meterRegistry));
        Counter.builder("event_bus_dispatch_total")
                .tag("mode", "remote")
                .tag("result", LocalDispatcher.resultTag(outcome))
                .register(meterRegistry).increment();

        return outcome;
    }

    private DispatchOutcome call(EventSubscription subscription, Event event) {
        String address = subscription.getCallbackAddress();
        try {
            RemoteDispatchResponse response = restClient.post()
                    .uri(address)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(RemoteDispatchRequest.from(event))
                    .retrieve()
                    .body(RemoteDispatchResponse.class);

            if (response == null) {
                log.warn("[Remote Dispatch] 응답 본문 없음. address: {}, eventId: {}", address, event.getId());
                return DispatchOutcome.transientFailure("empty response from " + address);
            }

            if (!response.success()) {
                log.warn("[Remote Dispatch] 구독자 처리 실패 응답. address: {}, eventId: {}, error: {}",
                        address, event.getId(), response.error());
                return DispatchOutcome.transientFailure(
                        response.error() != null ? response.error() : "subscriber reported failure");
            }

            log.debug("[Remote Dispatch] 성공. address: {}, eventId: {}", address, event.getId());
            return DispatchOutcome.succeeded();

        } catch (HttpClientErrorException e) {
            log.warn("[Remote Dispatch] 4xx 응답, 재시도 불가. address: {}, eventId: {}, status: {}",
                    address, event.getId(), e.getStatusCode());
            return DispatchOutcome.permanentFailure("HTTP " + e.getStatusCode().value() + " from " + address);

        } catch (RestClientException e) {
            // 5xx, 연결 실패, 읽기 타임아웃, 본문 파싱 실패
            log.warn("[Remote Dispatch] 호출 실패, 재시도 대상. address: {}, eventId: {}, error: {}",
                    address, event.getId(), e.getMessage());
            return DispatchOutcome.transientFailure(e.getMessage());
        }
    }
}
