package com.ureca.eventbus.dispatch;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.support.fixture.EventFixture;
import com.ureca.eventbus.support.fixture.SubscriptionFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * RemoteDispatcher 단위 테스트
 * <p>
 * 요청 본문 형식, 응답 상태별 재시도 분류
 */
@DisplayName("RemoteDispatcher 테스트")
class RemoteDispatcherTest {

    private static final String CALLBACK = "http://billing.internal/events";

    private MockRestServiceServer mockServer;
    private RemoteDispatcher remoteDispatcher;
    private SimpleMeterRegistry meterRegistry;

    private final Event event = EventFixture.pendingWithId("order.created");
    private final EventSubscription subscription = SubscriptionFixture.remote("billingHook", "order.*", CALLBACK);

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        mockServer = MockRestServiceServer.bindTo(builder).build();
        meterRegistry = new SimpleMeterRegistry();
        remoteDispatcher = new RemoteDispatcher(builder, meterRegistry);
    }

    @Test
    @DisplayName("성공 : success=true 응답 -> 성공, 요청 본문에 이벤트 정보 포함")
    void successResponse() {
        // given
        mockServer.expect(requestTo(CALLBACK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.event_id").value(event.getId().toString()))
                .andExpect(jsonPath("$.event_type").value("order.created"))
                .andExpect(jsonPath("$.tenant_id").value(EventFixture.TENANT_ID))
                .andExpect(jsonPath("$.payload.orderId").value(100))
                .andRespond(withSuccess("{\"success\":true}", MediaType.APPLICATION_JSON));

        // when
        DispatchOutcome outcome = remoteDispatcher.dispatch(subscription, event);

        // then
        assertThat(outcome.success()).isTrue();
        assertThat(meterRegistry.get("event_bus_dispatch_total")
                .tag("mode", "remote").tag("result", "success").counter().count()).isEqualTo(1.0);
        mockServer.verify();
    }

    @Test
    @DisplayName("실패 : success=false 응답 -> 재시도 대상, 구독자 에러 메시지 보존")
    void failureResponse_retryable() {
        // given
        mockServer.expect(requestTo(CALLBACK))
                .andRespond(withSuccess("{\"success\":false,\"error\":\"ledger locked\"}", MediaType.APPLICATION_JSON));

        // when
        DispatchOutcome outcome = remoteDispatcher.dispatch(subscription, event);

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.retryable()).isTrue();
        assertThat(outcome.error()).isEqualTo("ledger locked");
    }

    @Test
    @DisplayName("실패 : 5xx -> 재시도 대상")
    void serverError_retryable() {
        // given
        mockServer.expect(requestTo(CALLBACK)).andRespond(withServerError());

        // when
        DispatchOutcome outcome = remoteDispatcher.dispatch(subscription, event);

        // then
        assertThat(outcome.retryable()).isTrue();
    }

    @Test
    @DisplayName("실패 : 4xx -> 재시도 불가")
    void clientError_permanent() {
        // given
        mockServer.expect(requestTo(CALLBACK)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        // when
        DispatchOutcome outcome = remoteDispatcher.dispatch(subscription, event);

        // then
        assertThat(outcome.success()).isFalse();
        assertThat(outcome.retryable()).isFalse();
        assertThat(outcome.error()).contains("400");
    }

    @Test
    @DisplayName("성공 : callback_address 가 있는 구독만 원격 전달 대상")
    void canDispatch() {
        assertThat(remoteDispatcher.canDispatch(subscription)).isTrue();
        assertThat(remoteDispatcher.canDispatch(SubscriptionFixture.local("local", "order.*", 5))).isFalse();
    }
}
