package com.ureca.eventbus.event.controller;

import com.ureca.eventbus.common.ApiResponse;
import com.ureca.eventbus.event.dto.EventDetailResponse;
import com.ureca.eventbus.event.service.EventQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

import static com.ureca.eventbus.common.BaseCode.EVENT_FOUND;

@RestController
@RequiredArgsConstructor
public class EventAdminController implements EventAdminSwagger {

    private final EventQueryService eventQueryService;

    @Override
    public ResponseEntity<ApiResponse<EventDetailResponse>> getEvent(@PathVariable UUID eventId) {
        return ResponseEntity.ok(ApiResponse.of(EVENT_FOUND, eventQueryService.getEvent(eventId)));
    }
}
