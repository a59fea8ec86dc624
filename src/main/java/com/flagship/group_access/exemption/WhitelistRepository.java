package com.flagship.group_access.exemption;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WhitelistRepository extends JpaRepository<WhitelistEntity, Long> {

    boolean existsByUserIdAndRevokedAtIsNull(Long userId);
}
