package com.ureca.eventbus.subscription.controller;

import com.ureca.eventbus.common.ApiResponse;
import com.ureca.eventbus.subscription.dto.SubscriptionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;
import java.util.UUID;

@Tag(name = "이벤트 버스 구독", description = "구독 조회 및 활성화 관리 API")
@RequestMapping("/api/event-bus/subscriptions")
public interface SubscriptionAdminSwagger {

    @Operation(summary = "구독 목록 조회", description = "비활성 구독을 포함한 전체 구독과 전달 통계를 조회합니다.")
    @GetMapping
    ResponseEntity<ApiResponse<List<SubscriptionResponse>>> getSubscriptions();

    @Operation(summary = "구독 활성화", description = "비활성 구독을 다시 매칭 대상에 포함합니다.")
    @PatchMapping("/{subscriptionId}/activate")
    ResponseEntity<ApiResponse<SubscriptionResponse>> activate(@PathVariable UUID subscriptionId);

    @Operation(summary = "구독 비활성화",
            description = "구독을 매칭 대상에서 제외합니다. 구독 행과 이미 생성된 핸들러 기록은 유지됩니다.")
    @PatchMapping("/{subscriptionId}/deactivate")
    ResponseEntity<ApiResponse<SubscriptionResponse>> deactivate(@PathVariable UUID subscriptionId);
}
