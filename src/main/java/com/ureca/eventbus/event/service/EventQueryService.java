package com.ureca.eventbus.event.service;

import com.ureca.eventbus.event.dto.EventDetailResponse;
import com.ureca.eventbus.event.dto.HandlerRecordResponse;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.exception.EventNotFoundException;
import com.ureca.eventbus.event.repository.EventRepository;
import com.ureca.eventbus.handler.repository.HandlerRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EventQueryService {

    private final EventRepository eventRepository;
    private final HandlerRecordRepository handlerRecordRepository;

    public EventDetailResponse getEvent(UUID eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));

        List<HandlerRecordResponse> handlers = handlerRecordRepository.findAllByEventId(eventId).stream()
                .map(HandlerRecordResponse::from)
                .toList();

        return EventDetailResponse.of(event, handlers);
    }
}
