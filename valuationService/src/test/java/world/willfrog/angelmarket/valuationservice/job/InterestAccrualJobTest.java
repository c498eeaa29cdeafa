package world.willfrog.angelmarket.valuationservice.job;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.angelmarket.valuationservice.config.ValuationProperties;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.engine.ConvertibleInstrumentEngine;
import world.willfrog.angelmarket.valuationservice.exception.InstrumentConflictException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InterestAccrualJobTest {

    @Mock
    private ConvertibleInstrumentEngine instrumentEngine;

    private InterestAccrualJob job;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-12-15T00:05:00Z"), ZoneOffset.UTC);
        job = new InterestAccrualJob(instrumentEngine, new ValuationProperties(), clock);
    }

    private static ConvertibleInstrumentPo instrument(long id, LocalDate maturity) {
        ConvertibleInstrumentPo po = new ConvertibleInstrumentPo();
        po.setId(id);
        po.setMaturityDate(maturity);
        return po;
    }

    @Test
    void runOnce_shouldAccrueEachInstrumentAndCountMaturityAlerts() {
        // Arrange
        when(instrumentEngine.listActive()).thenReturn(List.of(
                instrument(1L, LocalDate.of(2026, 6, 1)),
                instrument(2L, LocalDate.of(2026, 1, 1)),
                instrument(3L, LocalDate.of(2025, 12, 1)),
                instrument(4L, LocalDate.of(2026, 1, 1)),
                instrument(5L, LocalDate.of(2026, 1, 1))));
        // 其余工具走默认返回值，这里只约定失败的两个
        lenient().when(instrumentEngine.accrueInterest(4L)).thenThrow(new InstrumentConflictException(4L));
        lenient().when(instrumentEngine.accrueInterest(5L)).thenThrow(new IllegalStateException("db down"));

        // Act
        InterestAccrualJob.AccrualRunSummary summary = job.runOnce();

        // Assert
        assertThat(summary.processed()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.maturingSoon()).isEqualTo(1);
        assertThat(summary.overdue()).isEqualTo(1);
        verify(instrumentEngine).accrueInterest(1L);
        verify(instrumentEngine).accrueInterest(2L);
        verify(instrumentEngine).accrueInterest(3L);
    }

    @Test
    void runOnce_withNoActiveInstruments_shouldReturnEmptySummary() {
        when(instrumentEngine.listActive()).thenReturn(List.of());

        InterestAccrualJob.AccrualRunSummary summary = job.runOnce();

        assertThat(summary).isEqualTo(new InterestAccrualJob.AccrualRunSummary(0, 0, 0, 0));
    }
}
