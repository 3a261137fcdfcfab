package com.altrii.mdm.modules.device.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.altrii.mdm.modules.device.domain.BlockCategory;
import com.altrii.mdm.modules.device.domain.BlockedDomain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BlockedDomainRepository extends JpaRepository<BlockedDomain, Long> {

    @Query("select distinct d.domain from BlockedDomain d where d.category in :categories order by d.domain")
    List<String> findDomainsByCategories(@Param("categories") Collection<BlockCategory> categories);
}
