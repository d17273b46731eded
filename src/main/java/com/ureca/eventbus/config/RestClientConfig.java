package com.ureca.eventbus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClient 공통 설정
 * 원격 구독 콜백과 Slack 알림이 같은 타임아웃을 사용
 */
@Configuration
public class RestClientConfig {

    @Bean
    public ClientHttpRequestFactory clientHttpRequestFactory(EventBusProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.dispatch().remoteConnectTimeout());
        factory.setReadTimeout(properties.dispatch().remoteReadTimeout());
        return factory;
    }

    // 주입받을 때마다 새 인스턴스 (baseUrl 등 상태 격리)
    @Bean
    @Scope("prototype")
    public RestClient.Builder restClientBuilder(ClientHttpRequestFactory requestFactory) {
        return RestClient.builder()
                .requestFactory(requestFactory);
    }
}
