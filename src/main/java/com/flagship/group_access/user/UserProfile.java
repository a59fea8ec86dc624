package com.flagship.group_access.user;

import lombok.Value;

/**
 * Display metadata reported by the platform with each interaction. Everything except the id may be null.
 */
@Value
public class UserProfile {
    long userId;
    String username;
    String firstName;
    String lastName;
    String languageCode;

    public static UserProfile idOnly(long userId) {
        return new UserProfile(userId, null, null, null, null);
    }
}
