package com.usermanagement.notification.service;

import com.usermanagement.notification.domain.UserAccount;
import com.usermanagement.notification.domain.UserRole;

/**
 * Entry point for account lifecycle notifications. None of the methods throw; the returned
 * outcome tells whether the event was published, captured, sent directly or dropped.
 */
public interface NotificationService {

    NotificationOutcome sendVerificationEmail(UserAccount user);

    NotificationOutcome sendAccountLockedNotification(UserAccount user);

    NotificationOutcome sendAccountUnlockedNotification(UserAccount user);

    NotificationOutcome sendRoleUpgradeNotification(UserAccount user, UserRole newRole);

    NotificationOutcome sendProfessionalStatusNotification(UserAccount user);
}
