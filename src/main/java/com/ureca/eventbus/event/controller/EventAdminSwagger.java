package com.ureca.eventbus.event.controller;

import com.ureca.eventbus.common.ApiResponse;
import com.ureca.eventbus.event.dto.EventDetailResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.UUID;

@Tag(name = "이벤트 버스 이벤트", description = "이벤트 처리 상태 조회 API")
@RequestMapping("/api/event-bus")
public interface EventAdminSwagger {

    @Operation(summary = "이벤트 상세 조회",
            description = "이벤트와 구독별 핸들러 기록을 조회합니다. 없는 이벤트면 404 를 반환합니다.")
    @GetMapping("/events/{eventId}")
    ResponseEntity<ApiResponse<EventDetailResponse>> getEvent(@PathVariable UUID eventId);
}
