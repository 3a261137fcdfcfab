package com.altrii.mdm.modules.command.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.altrii.mdm.modules.command.domain.CommandStatus;
import com.altrii.mdm.modules.command.domain.MdmCommand;
import com.altrii.mdm.modules.command.domain.RequestType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MdmCommandRepository extends JpaRepository<MdmCommand, Long> {

    Optional<MdmCommand> findByCommandUuid(UUID commandUuid);

    List<MdmCommand> findByDeviceIdAndStatusInOrderByIdAsc(String deviceId, Collection<CommandStatus> statuses);

    long countByDeviceIdAndStatusIn(String deviceId, Collection<CommandStatus> statuses);

    List<MdmCommand> findByDeviceIdAndRequestTypeAndStatusInOrderByIdDesc(
            String deviceId,
            RequestType requestType,
            Collection<CommandStatus> statuses,
            Pageable pageable
    );
}
