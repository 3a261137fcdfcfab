package com.altrii.mdm.modules.device.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import com.altrii.mdm.global.jpa.AbstractTimestampedEntity;

@Entity
@Table(name = "blocked_apps")
public class BlockedApp extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "bundle_identifier", nullable = false, unique = true, length = 255)
    private String bundleIdentifier;

    @Column(name = "app_name", length = 255)
    private String appName;

    @Column(name = "reason", length = 120)
    private String reason;

    public Long getId() {
        return id;
    }

    public String getBundleIdentifier() {
        return bundleIdentifier;
    }

    public void setBundleIdentifier(String bundleIdentifier) {
        this.bundleIdentifier = bundleIdentifier;
    }

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
