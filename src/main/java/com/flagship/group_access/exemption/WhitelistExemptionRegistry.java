package com.flagship.group_access.exemption;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class WhitelistExemptionRegistry implements ExemptionRegistry {

    private final WhitelistRepository repository;

    @Override
    @Transactional(readOnly = true)
    public boolean isExempt(long userId) {
        return repository.existsByUserIdAndRevokedAtIsNull(userId);
    }
}
