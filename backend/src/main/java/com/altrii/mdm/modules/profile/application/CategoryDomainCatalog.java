package com.altrii.mdm.modules.profile.application;

import java.util.LinkedHashSet;
import java.util.Set;

import com.altrii.mdm.modules.device.domain.BlockCategory;
import com.altrii.mdm.modules.device.infrastructure.persistence.BlockedDomainRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class CategoryDomainCatalog {

    private final BlockedDomainRepository blockedDomainRepository;

    public CategoryDomainCatalog(BlockedDomainRepository blockedDomainRepository) {
        this.blockedDomainRepository = blockedDomainRepository;
    }

    @Transactional(readOnly = true)
    public Set<String> domainsFor(Set<BlockCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(blockedDomainRepository.findDomainsByCategories(categories));
    }
}
