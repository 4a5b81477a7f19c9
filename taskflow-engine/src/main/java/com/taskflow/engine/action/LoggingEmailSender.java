package com.taskflow.engine.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sender used when no mail transport is configured: records the message in the log.
 */
public class LoggingEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public void send(String to, String subject, String body) {
        log.info("Email to={} subject='{}' ({} chars)", to, subject, body == null ? 0 : body.length());
    }
}
