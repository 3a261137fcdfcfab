package com.altrii.mdm.modules.profile.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.modules.profile.domain.SupervisionProfile;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SupervisionProfileRepository extends JpaRepository<SupervisionProfile, UUID> {

    Optional<SupervisionProfile> findByDeviceIdAndProfileIdentifier(String deviceId, String profileIdentifier);

    Optional<SupervisionProfile> findByProfileUuid(UUID profileUuid);

    Optional<SupervisionProfile> findFirstByDeviceIdOrderByUpdatedAtDesc(String deviceId);
}
