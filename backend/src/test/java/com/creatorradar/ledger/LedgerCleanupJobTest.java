package com.creatorradar.ledger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerCleanupJobTest {

    @Mock
    IdempotencyLedger ledger;

    @Test
    void usesConfiguredRetentionAndSwallowsStorageErrors() {
        LedgerProperties properties = new LedgerProperties();
        properties.setRetention(Duration.ofDays(7));
        when(ledger.cleanup(Duration.ofDays(7))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> new LedgerCleanupJob(ledger, properties).runScheduled()).doesNotThrowAnyException();
        verify(ledger).cleanup(Duration.ofDays(7));
    }
}
