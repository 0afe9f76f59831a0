package com.pcoptimizer.licensing.model.entity;

import com.pcoptimizer.licensing.model.License;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "licenses", indexes = @Index(name = "idx_license_key", columnList = "licenseKey", unique = true))
public class LicenseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200, updatable = false)
    private String licenseKey;

    @Column(nullable = false, length = 300)
    private String customerName;

    @Column(length = 320)
    private String customerEmail;

    @Column(nullable = false)
    private int maxActivations = 1;

    @Column(nullable = false, updatable = false)
    private Instant creationDate;

    @Column(nullable = false, updatable = false)
    private Instant expirationDate;

    @Column(nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "license", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<ActivationEntity> activations = new ArrayList<>();

    protected LicenseEntity() {}

    public static LicenseEntity from(License l) {
        LicenseEntity e = new LicenseEntity();
        e.licenseKey = l.licenseKey();
        e.customerName = l.customerName();
        e.customerEmail = l.customerEmail();
        e.maxActivations = l.maxActivations();
        e.creationDate = micros(l.creationDate());
        e.expirationDate = micros(l.expirationDate());
        e.active = l.active();
        return e;
    }

    public License toLicense() {
        return new License(id, licenseKey, customerName, customerEmail, maxActivations,
                creationDate, expirationDate, active);
    }

    public Long getId() { return id; }

    // columns hold microseconds; the returned license must equal what a later read gives back
    static Instant micros(Instant t) {
        return t == null ? null : t.truncatedTo(ChronoUnit.MICROS);
    }
}
