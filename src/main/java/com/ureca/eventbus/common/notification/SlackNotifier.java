package com.ureca.eventbus.common.notification;

import com.ureca.eventbus.common.notification.dto.SlackMessage;
import com.ureca.eventbus.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 운영 알림 Slack 전송
 * <p>
 * 알림 전용 Executor 에서 비동기 실행
 * RestClientException 은 retry.slack 정책으로 재시도, 최종 실패는 로그만 남김
 */
@Slf4j
@Component
public class SlackNotifier {

    private final RestClient restClient;

    public SlackNotifier(
            RestClient.Builder restClientBuilder,
            @Value("${slack.webhook.url}") String webhookUrl
    ) {
        this.restClient = restClientBuilder
                .baseUrl(webhookUrl)
                .build();
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR_NAME)
    @Retryable(
            retryFor = {RestClientException.class},
            maxAttemptsExpression = "${retry.slack.max-attempts}",
            backoff = @Backoff(delayExpression = "${retry.slack.delay}",
                    multiplierExpression = "${retry.slack.multiplier}")
    )
    public void sendAsync(SlackMessage message) {
        restClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .toBodilessEntity();

        log.info("[Slack] 알림 전송 완료. text: {}", message.text());
    }

    // 알림 실패가 이벤트 처리에 영향 주지 않도록 로그만
    @Recover
    public void recover(RestClientException e, SlackMessage message) {
        log.error("[Slack] 재시도 후 최종 실패. error: {}, text: {}",
                e.getMessage(), message.text());
    }
}
