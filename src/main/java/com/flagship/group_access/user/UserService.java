package com.flagship.group_access.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;

/**
 * Registry of group members.
 *
 * {@link #touch} is an upsert: concurrent first payments for a new user both succeed and
 * end with one row. Non-null profile fields overwrite stored ones, nulls keep what is there.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final JdbcTemplate jdbcTemplate;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional
    public void touch(UserProfile profile) {
        Timestamp now = Timestamp.from(clock.instant());
        jdbcTemplate.update(
            "INSERT INTO users (user_id, username, first_name, last_name, language_code, active, created_at, last_seen_at) " +
            "VALUES (?, ?, ?, ?, ?, TRUE, ?, ?) " +
            "ON CONFLICT (user_id) DO UPDATE SET " +
            "  username = COALESCE(EXCLUDED.username, users.username), " +
            "  first_name = COALESCE(EXCLUDED.first_name, users.first_name), " +
            "  last_name = COALESCE(EXCLUDED.last_name, users.last_name), " +
            "  language_code = COALESCE(EXCLUDED.language_code, users.language_code), " +
            "  active = TRUE, " +
            "  last_seen_at = EXCLUDED.last_seen_at",
            profile.getUserId(),
            profile.getUsername(),
            profile.getFirstName(),
            profile.getLastName(),
            profile.getLanguageCode(),
            now,
            now
        );
    }

    /**
     * Locks the user row for the rest of the caller's transaction.
     *
     * @throws IllegalArgumentException if the user has never been seen
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UserEntity lock(long userId) {
        return userRepository.findByIdForUpdate(userId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown user: " + userId));
    }

    /**
     * Marks the member inactive, e.g. after the platform reports the bot was blocked.
     */
    @Transactional
    public boolean deactivate(long userId) {
        return userRepository.findById(userId)
            .map(user -> {
                user.deactivate();
                log.info("User deactivated: userId={}", userId);
                return true;
            })
            .orElse(false);
    }
}
