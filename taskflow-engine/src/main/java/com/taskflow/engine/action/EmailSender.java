package com.taskflow.engine.action;

/**
 * Outbound port for email delivery.
 */
public interface EmailSender {

    /**
     * @throws RuntimeException if delivery fails; the failure is treated as transient
     */
    void send(String to, String subject, String body);
}
