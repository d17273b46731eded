package com.ureca.eventbus.event.signal;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * NOTIFY 채널 이름 규칙
 * events, events:{eventType}, events:{category}
 */
public final class NotificationChannels {

    public static final String BASE_CHANNEL = "events";

    // PostgreSQL 식별자 최대 길이 (NAMEDATALEN - 1)
    static final int MAX_CHANNEL_BYTES = 63;

    private NotificationChannels() {
    }

    public static List<String> of(EventPublishedSignal signal) {
        Set<String> channels = new LinkedHashSet<>();
        channels.add(BASE_CHANNEL);
        channels.add(BASE_CHANNEL + ":" + signal.eventType());
        channels.add(BASE_CHANNEL + ":" + signal.category());

        List<String> valid = new ArrayList<>();
        for (String channel : channels) {
            if (channel.getBytes(StandardCharsets.UTF_8).length <= MAX_CHANNEL_BYTES) {
                valid.add(channel);
            }
        }
        return valid;
    }
}
