package com.pcoptimizer.licensing.model.entity;

import com.pcoptimizer.licensing.model.Activation;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "license_activations", indexes = {
        @Index(name = "idx_activation_fingerprint", columnList = "hardwareFingerprint"),
        @Index(name = "idx_activation_license", columnList = "license_id")
})
public class ActivationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "license_id", nullable = false, updatable = false)
    private LicenseEntity license;

    @Column(nullable = false, length = 100, updatable = false)
    private String hardwareFingerprint;

    @Column(length = 100)
    private String machineName;

    @Column(nullable = false, updatable = false)
    private Instant firstActivated;

    @Column(nullable = false)
    private Instant lastSeen;

    @Column(length = 50)
    private String productVersion;

    protected ActivationEntity() {}

    public static ActivationEntity of(LicenseEntity license, Activation a) {
        ActivationEntity e = new ActivationEntity();
        e.license = license;
        e.hardwareFingerprint = a.hardwareFingerprint();
        e.machineName = truncate(a.machineName(), 100);
        e.firstActivated = LicenseEntity.micros(a.firstActivated());
        e.lastSeen = LicenseEntity.micros(a.lastSeen());
        e.productVersion = truncate(a.productVersion(), 50);
        return e;
    }

    public void touch(Activation a) {
        this.machineName = truncate(a.machineName(), 100);
        this.lastSeen = LicenseEntity.micros(a.lastSeen());
        this.productVersion = truncate(a.productVersion(), 50);
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    public Activation toActivation() {
        return new Activation(id, license.getId(), hardwareFingerprint, machineName,
                firstActivated, lastSeen, productVersion);
    }
}
