package com.pcoptimizer.licensing.api;

import com.pcoptimizer.licensing.dto.BulkGenerateRequest;
import com.pcoptimizer.licensing.dto.BulkGenerateResponse;
import com.pcoptimizer.licensing.dto.GenerateLicenseRequest;
import com.pcoptimizer.licensing.dto.GenerateLicenseResponse;
import com.pcoptimizer.licensing.dto.HealthResponse;
import com.pcoptimizer.licensing.dto.ValidateRequest;
import com.pcoptimizer.licensing.dto.ValidateResponse;
import com.pcoptimizer.licensing.model.StorageStatus;
import com.pcoptimizer.licensing.model.ValidationVerdict;
import com.pcoptimizer.licensing.service.LicenseIssuingService;
import com.pcoptimizer.licensing.service.LicenseValidationService;
import com.pcoptimizer.licensing.store.LicenseStore;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

@RestController
@RequestMapping(value = "/api/license", produces = MediaType.APPLICATION_JSON_VALUE)
public class LicenseController {

    static final String VERSION = "2.1";

    private final LicenseValidationService validation;
    private final LicenseIssuingService issuing;
    private final LicenseStore store;
    private final Clock clock;

    public LicenseController(LicenseValidationService validation,
                             LicenseIssuingService issuing,
                             LicenseStore store,
                             Clock clock) {
        this.validation = validation;
        this.issuing = issuing;
        this.store = store;
        this.clock = clock;
    }

    // --- VALIDATE -------------------------------------------------------------

    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValidateResponse validate(@RequestBody ValidateRequest request, HttpServletRequest http) {
        ValidationVerdict v = validation.validate(request, clientIp(http));
        return new ValidateResponse(v.valid(), v.customerName(), v.expirationDate(),
                v.remainingActivations(), v.errorMessage());
    }

    // --- GENERATE (ADMIN) -----------------------------------------------------

    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GenerateLicenseResponse generate(@RequestBody GenerateLicenseRequest request, HttpServletRequest http) {
        return issuing.generate(request, clientIp(http));
    }

    @PostMapping(value = "/generate/bulk", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BulkGenerateResponse generateBulk(@RequestBody BulkGenerateRequest request, HttpServletRequest http) {
        return issuing.generateBulk(request, clientIp(http));
    }

    // --- HEALTH ---------------------------------------------------------------

    @GetMapping("/health")
    public HealthResponse health() {
        StorageStatus s = store.status();
        return new HealthResponse(
                s.reachable() ? "Healthy" : "Degraded",
                s.durable() ? "durable" : "fallback",
                s.reachable(),
                s.totalLicenses(),
                s.activeLicenses(),
                clock.instant(),
                VERSION
        );
    }

    // --- HELPERS --------------------------------------------------------------

    static String clientIp(HttpServletRequest http) {
        String forwarded = http.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return http.getRemoteAddr();
    }
}
