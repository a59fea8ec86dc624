package com.flagship.group_access.access;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccessGrantTaskRepository extends JpaRepository<AccessGrantTaskEntity, Long> {

    long countByStatus(AccessGrantStatus status);
}
