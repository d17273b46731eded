package com.ureca.eventbus.subscription.service;

import com.ureca.eventbus.dispatch.EventHandler;
import com.ureca.eventbus.subscription.exception.DuplicateHandlerException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * handler_name 으로 찾는 프로세스 내 핸들러 테이블
 */
@Component
public class LocalHandlerTable {

    private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();

    /**
     * 핸들러 등록
     * 같은 인스턴스 재등록은 무시, 다른 핸들러가 이미 있으면 예외
     */
    public void register(String handlerName, EventHandler handler) {
        EventHandler existing = handlers.putIfAbsent(handlerName, handler);
        if (existing != null && existing != handler) {
            throw new DuplicateHandlerException(handlerName);
        }
    }

    public void unregister(String handlerName, EventHandler handler) {
        handlers.remove(handlerName, handler);
    }

    public Optional<EventHandler> find(String handlerName) {
        return Optional.ofNullable(handlers.get(handlerName));
    }

    public boolean contains(String handlerName) {
        return handlers.containsKey(handlerName);
    }
}
