package com.smartfix.notification.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Delivery channel stub. Push and email providers plug in here.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    public void sendPush(String recipientId, String title, String body) {
        log.info("[PUSH] recipient={} title='{}' body='{}'", recipientId, title, body);
    }

    public void sendEmail(String recipientId, String subject, String body) {
        log.info("[EMAIL] recipient={} subject='{}'", recipientId, subject);
    }
}
