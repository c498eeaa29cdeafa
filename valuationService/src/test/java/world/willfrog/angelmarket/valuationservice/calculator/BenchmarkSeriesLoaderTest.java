package world.willfrog.angelmarket.valuationservice.calculator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.angelmarket.valuationservice.domain.PricePoint;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.mapper.BenchmarkDataMapper;
import world.willfrog.angelmarket.valuationservice.model.BenchmarkSeries;
import world.willfrog.angelmarket.valuationservice.model.PeriodReturn;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BenchmarkSeriesLoaderTest {

    @Mock
    private BenchmarkDataMapper benchmarkDataMapper;

    @InjectMocks
    private BenchmarkSeriesLoader loader;

    private static PricePoint close(String date, String value) {
        PricePoint point = new PricePoint();
        point.setTradeDate(LocalDate.parse(date));
        point.setClose(new BigDecimal(value));
        return point;
    }

    @Test
    void loadIndexReturns_onNonTradingDay_shouldCarryLastClose() {
        // Arrange
        LocalDate jan = LocalDate.of(2024, 1, 31);
        LocalDate feb = LocalDate.of(2024, 2, 29);
        LocalDate mar = LocalDate.of(2024, 3, 31);
        when(benchmarkDataMapper.findLastCloseBefore("SPX", jan)).thenReturn(null);
        when(benchmarkDataMapper.listIndexCloses("SPX", jan, mar)).thenReturn(List.of(
                close("2024-01-31", "100"),
                close("2024-02-29", "110"),
                close("2024-03-29", "121")));

        // Act
        BenchmarkSeries series = loader.loadIndexReturns("SPX", List.of(jan, feb, mar));

        // Assert
        assertThat(series.name()).isEqualTo("SPX");
        assertThat(series.returns()).extracting(PeriodReturn::date).containsExactly(feb, mar);
        assertThat(series.returns()).extracting(PeriodReturn::value).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("0.1"), new BigDecimal("0.1"));
    }

    @Test
    void loadIndexReturns_whenFirstDateIsHoliday_shouldUsePriorClose() {
        // Arrange
        LocalDate newYear = LocalDate.of(2024, 1, 1);
        LocalDate jan = LocalDate.of(2024, 1, 31);
        when(benchmarkDataMapper.findLastCloseBefore("SPX", newYear)).thenReturn(close("2023-12-29", "200"));
        when(benchmarkDataMapper.listIndexCloses("SPX", newYear, jan)).thenReturn(List.of(close("2024-01-31", "210")));

        // Act
        BenchmarkSeries series = loader.loadIndexReturns("SPX", List.of(newYear, jan));

        // Assert
        assertThat(series.returns()).hasSize(1);
        assertThat(series.returns().get(0).value()).isEqualByComparingTo("0.05");
    }

    @Test
    void loadIndexReturns_withoutObservations_shouldReturnEmptySeries() {
        BenchmarkSeries series = loader.loadIndexReturns("SPX", List.of());

        assertThat(series.returns()).isEmpty();
        verifyNoInteractions(benchmarkDataMapper);
    }

    @Test
    void loadIndexReturns_blankCode_shouldNameField() {
        assertThatThrownBy(() -> loader.loadIndexReturns(" ", List.of(LocalDate.of(2024, 1, 1))))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("indexCode");
    }
}
