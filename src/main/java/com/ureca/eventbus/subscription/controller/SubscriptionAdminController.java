package com.ureca.eventbus.subscription.controller;

import com.ureca.eventbus.common.ApiResponse;
import com.ureca.eventbus.subscription.dto.SubscriptionResponse;
import com.ureca.eventbus.subscription.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

import static com.ureca.eventbus.common.BaseCode.SUBSCRIPTION_ACTIVATED;
import static com.ureca.eventbus.common.BaseCode.SUBSCRIPTION_DEACTIVATED;
import static com.ureca.eventbus.common.BaseCode.SUBSCRIPTION_LIST_SUCCESS;

@Slf4j
@RestController
@RequiredArgsConstructor
public class SubscriptionAdminController implements SubscriptionAdminSwagger {

    private final SubscriptionService subscriptionService;

    @Override
    public ResponseEntity<ApiResponse<List<SubscriptionResponse>>> getSubscriptions() {
        return ResponseEntity.ok(ApiResponse.of(SUBSCRIPTION_LIST_SUCCESS, subscriptionService.findAll()));
    }

    @Override
    public ResponseEntity<ApiResponse<SubscriptionResponse>> activate(@PathVariable UUID subscriptionId) {
        log.info("[구독 관리] 활성화 요청. subscriptionId: {}", subscriptionId);
        return ResponseEntity.ok(ApiResponse.of(SUBSCRIPTION_ACTIVATED, subscriptionService.activate(subscriptionId)));
    }

    @Override
    public ResponseEntity<ApiResponse<SubscriptionResponse>> deactivate(@PathVariable UUID subscriptionId) {
        log.info("[구독 관리] 비활성화 요청. subscriptionId: {}", subscriptionId);
        return ResponseEntity.ok(ApiResponse.of(SUBSCRIPTION_DEACTIVATED, subscriptionService.deactivate(subscriptionId)));
    }
}
