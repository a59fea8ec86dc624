package com.flagship.group_access.exemption;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Grandfathered or staff member. The entry counts while {@code revokedAt} is null.
 * Entries are maintained by the access-control tooling, this service only reads them.
 */
@Entity
@Table(name = "whitelist")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WhitelistEntity {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "source", nullable = false, length = 50)
    private String source;

    @Column(name = "note")
    private String note;

    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;
}
