package com.pcoptimizer.licensing.model.entity;

import com.pcoptimizer.licensing.model.ValidationLogEntry;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "license_validation_logs", indexes = @Index(name = "idx_validation_date", columnList = "validationDate"))
public class ValidationLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // plain column, the log outlives license rows
    private Long licenseId;

    @Column(nullable = false, length = 200, updatable = false)
    private String licenseKey;

    @Column(length = 100, updatable = false)
    private String hardwareFingerprint;

    @Column(nullable = false, updatable = false)
    private Instant validationDate;

    @Column(nullable = false, updatable = false)
    private boolean successful;

    @Column(length = 500, updatable = false)
    private String errorMessage;

    @Column(length = 50, updatable = false)
    private String ipAddress;

    protected ValidationLogEntity() {}

    public static ValidationLogEntity of(ValidationLogEntry entry) {
        ValidationLogEntity e = new ValidationLogEntity();
        e.licenseId = entry.licenseId();
        e.licenseKey = truncate(entry.licenseKey() == null ? "" : entry.licenseKey(), 200);
        e.hardwareFingerprint = truncate(entry.hardwareFingerprint(), 100);
        e.validationDate = LicenseEntity.micros(entry.validationDate());
        e.successful = entry.successful();
        e.errorMessage = truncate(entry.errorMessage(), 500);
        e.ipAddress = truncate(entry.ipAddress(), 50);
        return e;
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    public Long getLicenseId() { return licenseId; }
    public String getLicenseKey() { return licenseKey; }
    public boolean isSuccessful() { return successful; }
    public String getErrorMessage() { return errorMessage; }
    public String getIpAddress() { return ipAddress; }
}
