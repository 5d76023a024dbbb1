package com.bank.lending.domain.notification;

import java.util.List;

/**
 * Broadcast of live-update events (admin dashboards, applicant portal).
 * Not part of the correctness-critical path.
 */
public interface RealtimeNotifier {

    void publish(String eventName, List<String> channels, Object payload);
}
