package com.ureca.eventbus.dispatch;

import com.ureca.eventbus.subscription.entity.EventSubscription;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 구독별 Dispatcher 선택 (callback_address 유무)
 */
@Component
@RequiredArgsConstructor
public class DispatcherResolver {

    private final LocalDispatcher localDispatcher;
    private final RemoteDispatcher remoteDispatcher;

    public Dispatcher resolve(EventSubscription subscription) {
        return subscription.isRemote() ? remoteDispatcher : localDispatcher;
    }
}
