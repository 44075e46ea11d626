package org.nowstart.trendband.venue;

public interface NotificationSink {

    void send(String message);
}
