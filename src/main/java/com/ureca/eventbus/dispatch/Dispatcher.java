package com.ureca.eventbus.dispatch;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.subscription.entity.EventSubscription;

/**
 * 구독 한 건에 이벤트 한 건을 전달
 * 예외를 던지지 않고 결과를 DispatchOutcome 으로 돌려준다
 */
public interface Dispatcher {

    // 이 프로세스에서 해당 구독을 전달할 수 있는지
    boolean canDispatch(EventSubscription subscription);

    DispatchOutcome dispatch(EventSubscription subscription, Event event);
}
