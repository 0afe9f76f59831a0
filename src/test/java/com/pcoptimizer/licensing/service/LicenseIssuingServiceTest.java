package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.config.AppProperties;
import com.pcoptimizer.licensing.dto.ApiException;
import com.pcoptimizer.licensing.dto.BulkGenerateRequest;
import com.pcoptimizer.licensing.dto.BulkGenerateResponse;
import com.pcoptimizer.licensing.dto.GenerateLicenseRequest;
import com.pcoptimizer.licensing.dto.GenerateLicenseResponse;
import com.pcoptimizer.licensing.model.License;
import com.pcoptimizer.licensing.store.DuplicateLicenseKeyException;
import com.pcoptimizer.licensing.store.LicenseStore;
import com.pcoptimizer.licensing.store.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link LicenseIssuingService}.
 */
class LicenseIssuingServiceTest {

    private static final String SECRET = "admin-secret";

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-10T08:00:00Z"), ZoneOffset.UTC);
    private final AppProperties props = new AppProperties(SECRET, null, null);

    private LicenseStore store;
    private LicenseIssuingService service;

    @BeforeEach
    void setUp() {
        store = mock(LicenseStore.class);
        when(store.isDurable()).thenReturn(true);
        AtomicLong ids = new AtomicLong();
        when(store.insert(any())).thenAnswer(inv -> ((License) inv.getArgument(0)).withId(ids.incrementAndGet()));
        service = newService(store);
    }

    private LicenseIssuingService newService(LicenseStore s) {
        return new LicenseIssuingService(s, new LicenseKeyGenerator(props, clock),
                new AdminSecretVerifier(props), props, clock);
    }

    @Test
    @DisplayName("generate issues a single-machine license with the requested validity")
    void generate_success() {
        GenerateLicenseResponse r = service.generate(
                new GenerateLicenseRequest(SECRET, "  Jane Doe ", "jane@example.com", 30), "127.0.0.1");

        assertTrue(r.success());
        assertEquals("Jane Doe", r.customerName());
        assertEquals(30, r.validityDays());
        assertEquals(clock.instant(), r.creationDate());
        assertEquals(clock.instant().plus(Duration.ofDays(30)), r.expirationDate());
        assertTrue(r.licenseKey().matches("PCOPT-260210(-[A-Z0-9]{4}){4}"));
        verify(store).insert(argThat(l -> l.maxActivations() == 1 && l.active()
                && "jane@example.com".equals(l.customerEmail())));
    }

    @Test
    @DisplayName("wrong secret is unauthorized and never reaches storage")
    void generate_wrongSecret_unauthorized() {
        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest("wrong", "X", null, 30), "1.1.1.1"));

        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("secret is checked before the customer name")
    void generate_wrongSecretAndBlankName_unauthorized() {
        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest("wrong", "", null, 0), null));

        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
    }

    @Test
    @DisplayName("blank customer name is a bad request and creates nothing")
    void generate_blankName_badRequest() {
        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest(SECRET, "", null, 30), null));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        assertEquals("CUSTOMER_NAME_REQUIRED", e.getCode());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("customer name longer than 250 characters is rejected")
    void generate_longName_badRequest() {
        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest(SECRET, "n".repeat(251), null, 30), null));

        assertEquals("CUSTOMER_NAME_TOO_LONG", e.getCode());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5, 3651})
    @DisplayName("validity days outside 1..3650 are rejected")
    void generate_validityOutOfRange_badRequest(int days) {
        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest(SECRET, "X", null, days), null));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        assertEquals("VALIDITY_DAYS_OUT_OF_RANGE", e.getCode());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("validity bounds 1 and 3650 are accepted; missing validity defaults to a year")
    void generate_validityBounds_accepted() {
        assertTrue(service.generate(new GenerateLicenseRequest(SECRET, "X", null, 1), null).success());
        assertTrue(service.generate(new GenerateLicenseRequest(SECRET, "X", null, 3650), null).success());
        assertEquals(365, service.generate(new GenerateLicenseRequest(SECRET, "X", null, null), null).validityDays());
    }

    @Test
    @DisplayName("fallback store makes generation unavailable")
    void generate_notDurable_serviceUnavailable() {
        when(store.isDurable()).thenReturn(false);

        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest(SECRET, "X", null, 30), null));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, e.getStatus());
        verify(store, never()).insert(any());
    }

    @Test
    @DisplayName("a duplicate key is regenerated once")
    void generate_duplicateOnce_retries() {
        doThrow(new DuplicateLicenseKeyException("K", null))
                .doAnswer(inv -> ((License) inv.getArgument(0)).withId(7L))
                .when(store).insert(any());

        GenerateLicenseResponse r = service.generate(new GenerateLicenseRequest(SECRET, "X", null, 30), null);

        assertTrue(r.success());
        verify(store, times(2)).insert(any());
    }

    @Test
    @DisplayName("duplicate keys on every attempt surface as a collision error")
    void generate_duplicateEveryTime_fails() {
        doThrow(new DuplicateLicenseKeyException("K", null)).when(store).insert(any());

        var e = assertThrows(ApiException.class, () ->
                service.generate(new GenerateLicenseRequest(SECRET, "X", null, 30), null));

        assertEquals("LICENSE_KEY_COLLISION", e.getCode());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, e.getStatus());
        verify(store, times(2)).insert(any());
    }

    @Test
    @DisplayName("storage outage during insert propagates")
    void generate_storageDown_propagates() {
        doThrow(new StorageUnavailableException("down")).when(store).insert(any());

        assertThrows(StorageUnavailableException.class, () ->
                service.generate(new GenerateLicenseRequest(SECRET, "X", null, 30), null));
    }

    @Test
    @DisplayName("bulk generation returns one result per license in order")
    void generateBulk_success() {
        BulkGenerateResponse r = service.generateBulk(new BulkGenerateRequest(SECRET, "Acme", 3, 90), null);

        assertEquals(3, r.requested());
        assertEquals(3, r.generated());
        assertEquals(0, r.failed());
        assertEquals("Acme #1", r.licenses().get(0).customerName());
        assertEquals("Acme #3", r.licenses().get(2).customerName());
        assertEquals(3, r.licenses().stream().map(GenerateLicenseResponse::licenseKey).distinct().count());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1001})
    @DisplayName("bulk count outside 1..1000 is rejected")
    void generateBulk_countOutOfRange(int count) {
        var e = assertThrows(ApiException.class, () ->
                service.generateBulk(new BulkGenerateRequest(SECRET, "Acme", count, 30), null));

        assertEquals("COUNT_OUT_OF_RANGE", e.getCode());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("bulk generation reports which entries failed after a storage outage")
    void generateBulk_outage_reportsPartialFailure() {
        doAnswer(inv -> ((License) inv.getArgument(0)).withId(1L))
                .doThrow(new StorageUnavailableException("down"))
                .when(store).insert(any());

        BulkGenerateResponse r = service.generateBulk(new BulkGenerateRequest(SECRET, "Acme", 4, 30), null);

        assertEquals(1, r.generated());
        assertEquals(3, r.failed());
        assertTrue(r.licenses().get(0).success());
        assertFalse(r.licenses().get(1).success());
        assertFalse(r.licenses().get(3).success());
        assertNotNull(r.licenses().get(3).message());
        verify(store, times(2)).insert(any());
    }

    @Test
    @DisplayName("bulk generation that persists nothing reports the storage outage")
    void generateBulk_outageOnFirstInsert_throws() {
        doThrow(new StorageUnavailableException("down")).when(store).insert(any());

        assertThrows(StorageUnavailableException.class,
                () -> service.generateBulk(new BulkGenerateRequest(SECRET, "Acme", 3, 30), null));
        verify(store, times(1)).insert(any());
    }

    @Test
    @DisplayName("bulk generation requires the admin secret")
    void generateBulk_wrongSecret() {
        var e = assertThrows(ApiException.class, () ->
                service.generateBulk(new BulkGenerateRequest("nope", "Acme", 2, 30), null));

        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
        verifyNoInteractions(store);
    }
}
