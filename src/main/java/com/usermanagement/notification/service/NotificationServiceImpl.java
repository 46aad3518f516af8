package com.usermanagement.notification.service;

import com.usermanagement.notification.config.NotificationProperties;
import com.usermanagement.notification.domain.UserAccount;
import com.usermanagement.notification.domain.UserRole;
import com.usermanagement.notification.event.EventPayloads;
import com.usermanagement.notification.event.EventType;
import com.usermanagement.notification.messaging.producer.EventSink;
import com.usermanagement.notification.messaging.producer.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    private final EventSink eventSink;
    private final DirectEmailSender directEmailSender;
    private final NotificationProperties properties;

    @Override
    public NotificationOutcome sendVerificationEmail(UserAccount user) {
        return notify(EventType.EMAIL_VERIFICATION, user, () -> EventPayloads.emailVerification(user));
    }

    @Override
    public NotificationOutcome sendAccountLockedNotification(UserAccount user) {
        return notify(EventType.ACCOUNT_LOCKED, user, () -> EventPayloads.accountLocked(user));
    }

    @Override
    public NotificationOutcome sendAccountUnlockedNotification(UserAccount user) {
        return notify(EventType.ACCOUNT_UNLOCKED, user, () -> EventPayloads.accountUnlocked(user));
    }

    @Override
    public NotificationOutcome sendRoleUpgradeNotification(UserAccount user, UserRole newRole) {
        return notify(EventType.ROLE_UPGRADE, user, () -> EventPayloads.roleUpgrade(user, newRole));
    }

    @Override
    public NotificationOutcome sendProfessionalStatusNotification(UserAccount user) {
        return notify(EventType.PROFESSIONAL_STATUS_UPGRADE, user, () -> EventPayloads.professionalStatus(user));
    }

    private NotificationOutcome notify(EventType eventType, UserAccount user,
                                       Supplier<Map<String, Object>> payloadSupplier) {
        Map<String, Object> payload = null;
        String error;
        try {
            payload = payloadSupplier.get();
            PublishResult result = eventSink.publish(eventType, payload);
            if (result.isSuccess()) {
                log.info("{} queued for {}", eventType.getDescription(), payload.get(EventPayloads.EMAIL));
                return result.isCaptured() ? NotificationOutcome.CAPTURED : NotificationOutcome.PUBLISHED;
            }
            error = result.getErrorMessage();
        } catch (Exception e) {
            log.error("Error publishing {} for user {}: {}", eventType, userId(user), e.getMessage(), e);
            error = e.getMessage();
        }

        return applyFallback(eventType, user, payload, error);
    }

    private NotificationOutcome applyFallback(EventType eventType, UserAccount user,
                                              Map<String, Object> payload, String error) {
        FallbackPolicy policy = properties.fallbackFor(eventType);
        if (policy != FallbackPolicy.DIRECT_SEND || payload == null) {
            log.error("Failed to publish {} for user {}, notification dropped: {}",
                    eventType, userId(user), error);
            return NotificationOutcome.DROPPED;
        }

        log.warn("Failed to publish {} for user {} ({}), sending directly", eventType, userId(user), error);
        try {
            directEmailSender.send(eventType, payload);
            return NotificationOutcome.FALLBACK_SENT;
        } catch (Exception e) {
            log.error("Fallback email for {} to user {} failed: {}", eventType, userId(user), e.getMessage(), e);
            return NotificationOutcome.FALLBACK_FAILED;
        }
    }

    private static Object userId(UserAccount user) {
        return user != null ? user.getId() : null;
    }
}
