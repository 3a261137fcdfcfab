package com.altrii.mdm.modules.device.infrastructure.persistence;

import java.util.List;

import com.altrii.mdm.modules.device.domain.BlockedApp;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface BlockedAppRepository extends JpaRepository<BlockedApp, Long> {

    @Query("select b.bundleIdentifier from BlockedApp b")
    List<String> findAllBundleIdentifiers();
}
