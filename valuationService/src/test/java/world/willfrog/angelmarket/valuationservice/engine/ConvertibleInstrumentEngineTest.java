package world.willfrog.angelmarket.valuationservice.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.angelmarket.common.dto.ResponseCode;
import world.willfrog.angelmarket.valuationservice.domain.CompoundingMode;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentStatus;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentType;
import world.willfrog.angelmarket.valuationservice.domain.SafeType;
import world.willfrog.angelmarket.valuationservice.exception.InstrumentConflictException;
import world.willfrog.angelmarket.valuationservice.exception.InsufficientRepaymentException;
import world.willfrog.angelmarket.valuationservice.exception.InvalidInstrumentStateException;
import world.willfrog.angelmarket.valuationservice.exception.ResourceNotFoundException;
import world.willfrog.angelmarket.valuationservice.exception.ValidationException;
import world.willfrog.angelmarket.valuationservice.mapper.ConvertibleInstrumentMapper;
import world.willfrog.angelmarket.valuationservice.model.ConversionResult;
import world.willfrog.angelmarket.valuationservice.model.FinancingRound;
import world.willfrog.angelmarket.valuationservice.model.InstrumentTerms;
import world.willfrog.angelmarket.valuationservice.model.RepaymentResult;
import world.willfrog.angelmarket.valuationservice.support.MutableClock;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConvertibleInstrumentEngineTest {

    private static final OffsetDateTime ISSUED_AT = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private ConvertibleInstrumentMapper instrumentMapper;

    private MutableClock clock;
    private ConvertibleInstrumentEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(ISSUED_AT.toInstant());
        engine = new ConvertibleInstrumentEngine(instrumentMapper, clock);
    }

    private InstrumentTerms.InstrumentTermsBuilder noteTerms() {
        return InstrumentTerms.builder()
                .investmentId(10L)
                .startupId(20L)
                .investorId(30L)
                .instrumentType(InstrumentType.NOTE)
                .principal(new BigDecimal("100000"))
                .interestRate(new BigDecimal("8"))
                .issueDate(LocalDate.of(2024, 1, 1))
                .maturityDate(LocalDate.of(2026, 1, 1));
    }

    private ConvertibleInstrumentPo activeNote() {
        ConvertibleInstrumentPo po = new ConvertibleInstrumentPo();
        po.setId(1L);
        po.setInstrumentType(InstrumentType.NOTE);
        po.setPrincipal(new BigDecimal("100000"));
        po.setInterestRate(new BigDecimal("8"));
        po.setCompounding(CompoundingMode.SIMPLE);
        po.setIssueDate(LocalDate.of(2024, 1, 1));
        po.setMaturityDate(LocalDate.of(2026, 1, 1));
        po.setAccruedInterest(BigDecimal.ZERO);
        po.setLastAccrualAt(ISSUED_AT);
        po.setStatus(InstrumentStatus.ACTIVE);
        po.setVersion(0);
        return po;
    }

    private ConvertibleInstrumentPo activeSafe(BigDecimal discountRate, BigDecimal valuationCap) {
        ConvertibleInstrumentPo po = activeNote();
        po.setInstrumentType(InstrumentType.SAFE);
        po.setSafeType(SafeType.POST_MONEY);
        po.setInterestRate(BigDecimal.ZERO);
        po.setDiscountRate(discountRate);
        po.setValuationCap(valuationCap);
        return po;
    }

    @Test
    void createInstrument_withNoteTerms_shouldApplyDefaultsAndInsert() {
        // Arrange
        doAnswer(invocation -> {
            ConvertibleInstrumentPo po = invocation.getArgument(0);
            po.setId(5L);
            return 1;
        }).when(instrumentMapper).insert(any(ConvertibleInstrumentPo.class));

        // Act
        ConvertibleInstrumentPo created = engine.createInstrument(noteTerms().build());

        // Assert
        assertThat(created.getId()).isEqualTo(5L);
        assertThat(created.getStatus()).isEqualTo(InstrumentStatus.ACTIVE);
        assertThat(created.getCompounding()).isEqualTo(CompoundingMode.SIMPLE);
        assertThat(created.getSecurityType()).isEqualTo("Preferred");
        assertThat(created.getAutoConversion()).isTrue();
        assertThat(created.getAccruedInterest()).isEqualByComparingTo("0");
        assertThat(created.getLastAccrualAt()).isEqualTo(ISSUED_AT);
        assertThat(created.getVersion()).isZero();
        assertThat(created.getSafeType()).isNull();
    }

    @Test
    void createInstrument_safeWithoutSafeType_shouldDefaultToPostMoney() {
        // Arrange
        InstrumentTerms terms = noteTerms()
                .instrumentType(InstrumentType.SAFE)
                .interestRate(null)
                .valuationCap(new BigDecimal("5000000"))
                .build();

        // Act
        ConvertibleInstrumentPo created = engine.createInstrument(terms);

        // Assert
        assertThat(created.getSafeType()).isEqualTo(SafeType.POST_MONEY);
        assertThat(created.getInterestRate()).isEqualByComparingTo("0");
        verify(instrumentMapper).insert(created);
    }

    @Test
    void createInstrument_withNonPositivePrincipal_shouldNameField() {
        InstrumentTerms terms = noteTerms().principal(BigDecimal.ZERO).build();

        assertThatThrownBy(() -> engine.createInstrument(terms))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("principal");
        verifyNoInteractions(instrumentMapper);
    }

    @Test
    void createInstrument_withMaturityBeforeIssue_shouldNameField() {
        InstrumentTerms terms = noteTerms().maturityDate(LocalDate.of(2023, 12, 31)).build();

        assertThatThrownBy(() -> engine.createInstrument(terms))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("maturityDate");
    }

    @Test
    void createInstrument_withDiscountAboveHundred_shouldNameField() {
        InstrumentTerms terms = noteTerms().discountRate(new BigDecimal("120")).build();

        assertThatThrownBy(() -> engine.createInstrument(terms))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("discountRate");
    }

    @Test
    void createInstrument_noteWithoutInterestRate_shouldNameField() {
        InstrumentTerms terms = noteTerms().interestRate(null).build();

        assertThatThrownBy(() -> engine.createInstrument(terms))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("interestRate");
    }

    @Test
    void createInstrument_safeWithoutCapOrDiscount_shouldBeRejected() {
        InstrumentTerms terms = noteTerms().instrumentType(InstrumentType.SAFE).interestRate(null).build();

        assertThatThrownBy(() -> engine.createInstrument(terms))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("valuationCap");
    }

    @Test
    void createInstrument_safeWithInterest_shouldBeRejected() {
        InstrumentTerms terms = noteTerms()
                .instrumentType(InstrumentType.SAFE)
                .discountRate(new BigDecimal("20"))
                .build();

        assertThatThrownBy(() -> engine.createInstrument(terms))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("interestRate");
    }

    @Test
    void getInstrument_whenMissing_shouldThrowNotFound() {
        when(instrumentMapper.findById(99L)).thenReturn(null);

        assertThatThrownBy(() -> engine.getInstrument(99L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void accrueInterest_simpleAfter180Days_shouldMatchActualOver365() {
        // Arrange
        when(instrumentMapper.findById(1L)).thenReturn(activeNote());
        when(instrumentMapper.updateAccrual(eq(1L), eq(0), any(), any(), any())).thenReturn(1);
        clock.advance(Duration.ofDays(180));

        // Act
        ConvertibleInstrumentPo accrued = engine.accrueInterest(1L);

        // Assert
        assertThat(accrued.getAccruedInterest()).isEqualByComparingTo("3945.20547945");
        assertThat(accrued.getAccruedInterest().setScale(2, RoundingMode.HALF_UP))
                .isEqualByComparingTo("3945.21");
        assertThat(accrued.getLastAccrualAt()).isEqualTo(ISSUED_AT.plusDays(180));
        assertThat(accrued.getVersion()).isEqualTo(1);
    }

    @Test
    void accrueInterest_compound_shouldGrowOnPrincipalPlusAccrued() {
        // Arrange
        ConvertibleInstrumentPo po = activeNote();
        po.setInterestRate(new BigDecimal("10"));
        po.setCompounding(CompoundingMode.COMPOUND);
        po.setAccruedInterest(new BigDecimal("1000"));
        when(instrumentMapper.findById(1L)).thenReturn(po);
        when(instrumentMapper.updateAccrual(eq(1L), eq(0), any(), any(), any())).thenReturn(1);
        clock.advance(Duration.ofDays(365));

        // Act
        ConvertibleInstrumentPo accrued = engine.accrueInterest(1L);

        // Assert
        assertThat(accrued.getAccruedInterest()).isCloseTo(new BigDecimal("11100"), within(new BigDecimal("0.0001")));
    }

    @Test
    void accrueInterest_calledTwiceAtSameInstant_shouldNotAddInterestOrWrite() {
        // Arrange
        ConvertibleInstrumentPo po = activeNote();
        po.setAccruedInterest(new BigDecimal("10.00000000"));
        po.setLastAccrualAt(ISSUED_AT);
        when(instrumentMapper.findById(1L)).thenReturn(po);

        // Act
        ConvertibleInstrumentPo result = engine.accrueInterest(1L);

        // Assert
        assertThat(result.getAccruedInterest()).isEqualByComparingTo("10");
        verify(instrumentMapper, never()).updateAccrual(anyLong(), anyInt(), any(), any(), any());
    }

    @Test
    void accrueInterest_withFractionalSeconds_shouldCarryRemainderToNextAccrual() {
        // Arrange
        ConvertibleInstrumentPo po = activeNote();
        when(instrumentMapper.findById(1L)).thenReturn(po);
        when(instrumentMapper.updateAccrual(eq(1L), anyInt(), any(), any(), any())).thenReturn(1);

        // Act
        clock.advance(Duration.ofMillis(1500));
        ConvertibleInstrumentPo first = engine.accrueInterest(1L);
        OffsetDateTime firstCutoff = first.getLastAccrualAt();
        clock.advance(Duration.ofMillis(500));
        ConvertibleInstrumentPo second = engine.accrueInterest(1L);

        // Assert
        assertThat(firstCutoff).isEqualTo(ISSUED_AT.plusSeconds(1));
        assertThat(second.getLastAccrualAt()).isEqualTo(ISSUED_AT.plusSeconds(2));
        assertThat(second.getAccruedInterest()).isEqualByComparingTo(
                InterestAccrualCalculator.simpleInterest(new BigDecimal("100000"), new BigDecimal("8"), 2L));
        verify(instrumentMapper).updateAccrual(eq(1L), eq(0), any(), eq(ISSUED_AT.plusSeconds(1)),
                eq(ISSUED_AT.plusNanos(1_500_000_000L)));
    }

    @Test
    void accrueInterest_underOneSecond_shouldNotWrite() {
        // Arrange
        when(instrumentMapper.findById(1L)).thenReturn(activeNote());
        clock.advance(Duration.ofMillis(999));

        // Act
        ConvertibleInstrumentPo result = engine.accrueInterest(1L);

        // Assert
        assertThat(result.getLastAccrualAt()).isEqualTo(ISSUED_AT);
        verify(instrumentMapper, never()).updateAccrual(anyLong(), anyInt(), any(), any(), any());
    }

    @Test
    void accrueInterest_whenClockBehindLastAccrual_shouldNotDecrease() {
        // Arrange
        ConvertibleInstrumentPo po = activeNote();
        po.setAccruedInterest(new BigDecimal("50"));
        po.setLastAccrualAt(ISSUED_AT.plusDays(10));
        when(instrumentMapper.findById(1L)).thenReturn(po);

        // Act
        ConvertibleInstrumentPo result = engine.accrueInterest(1L);

        // Assert
        assertThat(result.getAccruedInterest()).isEqualByComparingTo("50");
        verify(instrumentMapper, never()).updateAccrual(anyLong(), anyInt(), any(), any(), any());
    }

    @Test
    void accrueInterest_onConvertedInstrument_shouldThrowInvalidState() {
        ConvertibleInstrumentPo po = activeNote();
        po.setStatus(InstrumentStatus.CONVERTED);
        when(instrumentMapper.findById(1L)).thenReturn(po);
        clock.advance(Duration.ofDays(1));

        assertThatThrownBy(() -> engine.accrueInterest(1L))
                .isInstanceOf(InvalidInstrumentStateException.class)
                .extracting("code").isEqualTo(ResponseCode.INVALID_STATE);
    }

    @Test
    void calculateConversionPrice_withCapAndDiscount_shouldTakeLowest() {
        // Arrange
        when(instrumentMapper.findById(1L))
                .thenReturn(activeSafe(new BigDecimal("20"), new BigDecimal("5000000")));
        FinancingRound round = new FinancingRound(new BigDecimal("2.00"), new BigDecimal("10000000"), null);

        // Act
        BigDecimal price = engine.calculateConversionPrice(1L, round);

        // Assert
        assertThat(price).isEqualByComparingTo("0.50");
    }

    @Test
    void calculateConversionPrice_discountOnly_shouldApplyDiscount() {
        when(instrumentMapper.findById(1L)).thenReturn(activeSafe(new BigDecimal("20"), null));

        BigDecimal price = engine.calculateConversionPrice(1L, new FinancingRound(new BigDecimal("2.00"), null, null));

        assertThat(price).isEqualByComparingTo("1.60");
    }

    @Test
    void calculateConversionPrice_capWithoutShareBasis_shouldNameField() {
        when(instrumentMapper.findById(1L)).thenReturn(activeSafe(null, new BigDecimal("5000000")));
        FinancingRound round = new FinancingRound(new BigDecimal("2.00"), null, null);

        assertThatThrownBy(() -> engine.calculateConversionPrice(1L, round))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("fullyDilutedShares");
    }

    @Test
    void calculateConversionPrice_withZeroRoundPrice_shouldNameField() {
        when(instrumentMapper.findById(1L)).thenReturn(activeSafe(new BigDecimal("20"), null));
        FinancingRound round = new FinancingRound(BigDecimal.ZERO, null, null);

        assertThatThrownBy(() -> engine.calculateConversionPrice(1L, round))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("pricePerShare");
    }

    @Test
    void convert_shouldFloorSharesAndMarkConverted() {
        // Arrange
        when(instrumentMapper.findById(1L))
                .thenReturn(activeSafe(null, new BigDecimal("3000000")));
        when(instrumentMapper.markConverted(eq(1L), eq(0), any(), any(), any(), anyLong(), any())).thenReturn(1);
        FinancingRound round = new FinancingRound(new BigDecimal("1.00"), new BigDecimal("10000000"), null);

        // Act
        ConversionResult result = engine.convert(1L, round);

        // Assert
        assertThat(result.conversionPrice()).isEqualByComparingTo("0.3");
        assertThat(result.totalAmount()).isEqualByComparingTo("100000");
        assertThat(result.shares()).isEqualTo(333333L);
        ArgumentCaptor<Long> shares = ArgumentCaptor.forClass(Long.class);
        verify(instrumentMapper).markConverted(eq(1L), eq(0), any(), any(), any(), shares.capture(), any());
        assertThat(shares.getValue()).isEqualTo(333333L);
    }

    @Test
    void convert_note_shouldIncludeFinalAccrualInConvertedAmount() {
        // Arrange
        ConvertibleInstrumentPo po = activeNote();
        po.setDiscountRate(new BigDecimal("20"));
        when(instrumentMapper.findById(1L)).thenReturn(po);
        when(instrumentMapper.markConverted(eq(1L), eq(0), any(), any(), any(), anyLong(), any())).thenReturn(1);
        clock.advance(Duration.ofDays(180));

        // Act
        ConversionResult result = engine.convert(1L, new FinancingRound(new BigDecimal("2.00"), null, null));

        // Assert
        assertThat(result.accruedInterest()).isEqualByComparingTo("3945.20547945");
        assertThat(result.totalAmount()).isEqualByComparingTo("103945.20547945");
        assertThat(result.conversionPrice()).isEqualByComparingTo("1.60");
        assertThat(result.shares()).isEqualTo(64965L);
    }

    @Test
    void convert_whenAlreadyRepaid_shouldThrowInvalidStateWithoutWrite() {
        ConvertibleInstrumentPo po = activeSafe(new BigDecimal("20"), null);
        po.setStatus(InstrumentStatus.REPAID);
        when(instrumentMapper.findById(1L)).thenReturn(po);
        FinancingRound round = new FinancingRound(new BigDecimal("2.00"), null, null);

        assertThatThrownBy(() -> engine.convert(1L, round))
                .isInstanceOf(InvalidInstrumentStateException.class);
        verify(instrumentMapper, never()).markConverted(anyLong(), anyInt(), any(), any(), any(), anyLong(), any());
    }

    @Test
    void convert_whenOtherWriterConvertedFirst_shouldThrowInvalidState() {
        // Arrange
        ConvertibleInstrumentPo converted = activeSafe(new BigDecimal("20"), null);
        converted.setStatus(InstrumentStatus.CONVERTED);
        converted.setVersion(1);
        when(instrumentMapper.findById(1L)).thenReturn(activeSafe(new BigDecimal("20"), null), converted);
        when(instrumentMapper.markConverted(eq(1L), eq(0), any(), any(), any(), anyLong(), any())).thenReturn(0);

        // Act & Assert
        assertThatThrownBy(() -> engine.convert(1L, new FinancingRound(new BigDecimal("2.00"), null, null)))
                .isInstanceOf(InvalidInstrumentStateException.class);
    }

    @Test
    void accrueInterest_whenVersionMovedConcurrently_shouldThrowConflict() {
        // Arrange
        ConvertibleInstrumentPo newer = activeNote();
        newer.setVersion(1);
        when(instrumentMapper.findById(1L)).thenReturn(activeNote(), newer);
        when(instrumentMapper.updateAccrual(eq(1L), eq(0), any(), any(), any())).thenReturn(0);
        clock.advance(Duration.ofDays(1));

        // Act & Assert
        assertThatThrownBy(() -> engine.accrueInterest(1L))
                .isInstanceOf(InstrumentConflictException.class)
                .extracting("code").isEqualTo(ResponseCode.CONCURRENT_MODIFICATION);
    }

    @Test
    void repay_belowTotalOwed_shouldThrowWithoutWrite() {
        // Arrange
        when(instrumentMapper.findById(1L)).thenReturn(activeNote());
        clock.advance(Duration.ofDays(180));

        // Act & Assert
        assertThatThrownBy(() -> engine.repay(1L, new BigDecimal("103945.20")))
                .isInstanceOfSatisfying(InsufficientRepaymentException.class,
                        e -> assertThat(e.getTotalOwed()).isEqualByComparingTo("103945.21"));
        verify(instrumentMapper, never()).markRepaid(anyLong(), anyInt(), any(), any(), any(), any());
    }

    @Test
    void repay_withOverpayment_shouldMarkRepaidAndReportSurplus() {
        // Arrange
        when(instrumentMapper.findById(1L)).thenReturn(activeNote());
        when(instrumentMapper.markRepaid(eq(1L), eq(0), any(), any(), any(), any())).thenReturn(1);
        clock.advance(Duration.ofDays(180));

        // Act
        RepaymentResult result = engine.repay(1L, new BigDecimal("104000.00"));

        // Assert
        assertThat(result.totalOwed()).isEqualByComparingTo("103945.21");
        assertThat(result.overpayment()).isEqualByComparingTo("54.79");
        verify(instrumentMapper).markRepaid(eq(1L), eq(0), any(), eq(ISSUED_AT.plusDays(180)),
                eq(new BigDecimal("104000.00")), any());
    }

    @Test
    void repay_withNonPositiveAmount_shouldNameField() {
        assertThatThrownBy(() -> engine.repay(1L, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("repaymentAmount");
        verifyNoInteractions(instrumentMapper);
    }

    @Test
    void checkQualifiedFinancing_shouldCompareAgainstThreshold() {
        ConvertibleInstrumentPo po = activeNote();
        po.setQualifiedFinancingThreshold(new BigDecimal("1000000"));
        when(instrumentMapper.findById(1L)).thenReturn(po);

        assertThat(engine.checkQualifiedFinancing(1L, new BigDecimal("1000000"))).isTrue();
        assertThat(engine.checkQualifiedFinancing(1L, new BigDecimal("999999.99"))).isFalse();
    }

    @Test
    void checkQualifiedFinancing_withoutThreshold_shouldAlwaysQualify() {
        when(instrumentMapper.findById(1L)).thenReturn(activeNote());

        assertThat(engine.checkQualifiedFinancing(1L, new BigDecimal("1"))).isTrue();
    }

    @Test
    void listMaturingWithin_shouldQueryFromClockDate() {
        // Arrange
        clock.set(Instant.parse("2025-12-15T10:00:00Z"));
        ConvertibleInstrumentPo po = activeNote();
        when(instrumentMapper.listActiveMaturingOnOrBefore(LocalDate.of(2026, 1, 14))).thenReturn(List.of(po));

        // Act
        List<ConvertibleInstrumentPo> maturing = engine.listMaturingWithin(30);

        // Assert
        assertThat(maturing).containsExactly(po);
    }

    @Test
    void listMaturingWithin_negativeDays_shouldNameField() {
        assertThatThrownBy(() -> engine.listMaturingWithin(-1))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("days");
    }
}
