package com.usermanagement.notification.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * The user fields notification payloads are built from. The account itself is owned by the
 * user-management application.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    private UUID id;

    private String email;

    private String firstName;

    private String lastName;

    private String verificationToken;

    @Builder.Default
    private UserRole role = UserRole.AUTHENTICATED;

    private boolean professional;
}
