package com.pcoptimizer.licensing.service;

import com.pcoptimizer.licensing.model.ValidationLogEntry;
import com.pcoptimizer.licensing.store.LicenseStore;
import com.pcoptimizer.licensing.store.StorageUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link AuditLog}.
 */
class AuditLogTest {

    private final ValidationLogEntry entry =
            new ValidationLogEntry(1L, "KEY", "HW", Instant.now(), true, null, "127.0.0.1");

    @Test
    @DisplayName("append writes the entry to the store")
    void append_delegatesToStore() {
        LicenseStore store = mock(LicenseStore.class);

        new AuditLog(store).append(entry);

        verify(store).appendLog(entry);
    }

    @Test
    @DisplayName("append swallows store failures")
    void append_storeFails_doesNotThrow() {
        LicenseStore store = mock(LicenseStore.class);
        doThrow(new StorageUnavailableException("down")).when(store).appendLog(any());

        assertDoesNotThrow(() -> new AuditLog(store).append(entry));
    }

    @Test
    @DisplayName("appendDuringOutage makes a single attempt and swallows its failure")
    void appendDuringOutage_singleAttempt() {
        LicenseStore store = mock(LicenseStore.class);
        doThrow(new StorageUnavailableException("down")).when(store).appendLogOnce(any());

        assertDoesNotThrow(() -> new AuditLog(store).appendDuringOutage(entry));

        verify(store).appendLogOnce(entry);
        verify(store, never()).appendLog(any());
    }
}
