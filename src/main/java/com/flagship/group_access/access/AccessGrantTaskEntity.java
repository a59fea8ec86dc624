package com.flagship.group_access.access;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per user in access_grant_tasks.
 */
@Entity
@Table(name = "access_grant_tasks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccessGrantTaskEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccessGrantStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccessGrantTaskEntity fromDomain(AccessGrantTask task) {
        AccessGrantTaskEntity entity = new AccessGrantTaskEntity();
        entity.userId = task.getUserId();
        entity.updateFromDomain(task);
        return entity;
    }

    public AccessGrantTask toDomain() {
        return new AccessGrantTask(userId, status, attemptCount, lastAttemptAt, nextAttemptAt, lastError);
    }

    void updateFromDomain(AccessGrantTask task) {
        this.status = task.getStatus();
        this.attemptCount = task.getAttemptCount();
        this.lastAttemptAt = task.getLastAttemptAt();
        this.nextAttemptAt = task.getNextAttemptAt();
        this.lastError = task.getLastError();
    }
}
