package com.chicu.botjobs.host;

/** Отправка текста в канал, fire-and-forget */
public interface NotificationSink {

    void send(String channelId, String text);
}
