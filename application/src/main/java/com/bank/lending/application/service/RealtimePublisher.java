package com.bank.lending.application.service;

import com.bank.lending.domain.notification.RealtimeNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Publishes live-update events once the surrounding transaction has committed.
 * Outside a transaction the event is published immediately. Publishing failures are logged only.
 */
@Service
public class RealtimePublisher {

    private static final Logger log = LoggerFactory.getLogger(RealtimePublisher.class);

    private final RealtimeNotifier realtimeNotifier;

    public RealtimePublisher(RealtimeNotifier realtimeNotifier) {
        this.realtimeNotifier = realtimeNotifier;
    }

    public void publishAfterCommit(String eventName, List<String> channels, Object payload) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(eventName, channels, payload);
                }
            });
            return;
        }
        publish(eventName, channels, payload);
    }

    private void publish(String eventName, List<String> channels, Object payload) {
        try {
            realtimeNotifier.publish(eventName, channels, payload);
            log.debug("Published {} to {}", eventName, channels);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} to {}", eventName, channels, e);
        }
    }
}
