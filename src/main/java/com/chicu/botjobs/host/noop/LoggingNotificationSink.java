package com.chicu.botjobs.host.noop;

import com.chicu.botjobs.host.NotificationSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@ConditionalOnMissingBean(NotificationSink.class)
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(String channelId, String text) {
        log.info("📨 [{}] {}", channelId, text);
    }
}
