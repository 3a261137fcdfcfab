package com.altrii.mdm.modules.command.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "mdm_commands")
public class MdmCommand extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "command_uuid", nullable = false, unique = true, updatable = false, columnDefinition = "uuid")
    private UUID commandUuid;

    @Column(name = "device_id", nullable = false, updatable = false, length = 64)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, updatable = false, length = 40)
    private RequestType requestType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CommandStatus status;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "acknowledged_at")
    private OffsetDateTime acknowledgedAt;

    @Column(name = "response_status", length = 32)
    private String responseStatus;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "response_data", columnDefinition = "jsonb")
    private Map<String, Object> responseData;

    protected MdmCommand() {
    }

    public static MdmCommand pending(String deviceId, RequestType requestType, Map<String, Object> payload) {
        MdmCommand command = new MdmCommand();
        command.commandUuid = UUID.randomUUID();
        command.deviceId = deviceId;
        command.requestType = requestType;
        command.payload = payload;
        command.status = CommandStatus.PENDING;
        return command;
    }

    public void markSent(OffsetDateTime now) {
        if (status == CommandStatus.PENDING) {
            status = CommandStatus.SENT;
            sentAt = now;
        }
    }

    public void acknowledge(OffsetDateTime now, Map<String, Object> response) {
        complete(CommandStatus.ACKNOWLEDGED, CommandResponseStatus.ACKNOWLEDGED, now, response);
    }

    public void fail(CommandResponseStatus reported, OffsetDateTime now, Map<String, Object> response) {
        complete(CommandStatus.FAILED, reported, now, response);
    }

    public void cancel() {
        status = CommandStatus.CANCELLED;
    }

    private void complete(CommandStatus terminal, CommandResponseStatus reported, OffsetDateTime now,
                          Map<String, Object> response) {
        if (!status.isOutstanding()) {
            throw new IllegalStateException("Command " + commandUuid + " is already " + status);
        }
        status = terminal;
        acknowledgedAt = now;
        responseStatus = reported.wireName();
        responseData = response;
    }

    public Long getId() {
        return id;
    }

    public UUID getCommandUuid() {
        return commandUuid;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public RequestType getRequestType() {
        return requestType;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public CommandStatus getStatus() {
        return status;
    }

    public OffsetDateTime getSentAt() {
        return sentAt;
    }

    public OffsetDateTime getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public String getResponseStatus() {
        return responseStatus;
    }

    public Map<String, Object> getResponseData() {
        return responseData;
    }
}
