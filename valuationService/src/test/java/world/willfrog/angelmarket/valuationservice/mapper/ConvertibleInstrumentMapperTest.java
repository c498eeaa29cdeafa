package world.willfrog.angelmarket.valuationservice.mapper;

import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import world.willfrog.angelmarket.valuationservice.domain.CompoundingMode;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentStatus;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@MybatisTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ConvertibleInstrumentMapperTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private ConvertibleInstrumentMapper instrumentMapper;

    private ConvertibleInstrumentPo insertNote(long startupId, LocalDate maturity) {
        ConvertibleInstrumentPo po = new ConvertibleInstrumentPo();
        po.setInvestmentId(100L);
        po.setStartupId(startupId);
        po.setInvestorId(300L);
        po.setInstrumentType(InstrumentType.NOTE);
        po.setPrincipal(new BigDecimal("100000.00"));
        po.setInterestRate(new BigDecimal("8"));
        po.setIssueDate(LocalDate.of(2024, 1, 1));
        po.setMaturityDate(maturity);
        po.setCompounding(CompoundingMode.SIMPLE);
        po.setAutoConversion(true);
        po.setSecurityType("Preferred");
        po.setProRataRight(false);
        po.setMfnProvision(false);
        po.setAccruedInterest(BigDecimal.ZERO);
        po.setLastAccrualAt(NOW);
        po.setStatus(InstrumentStatus.ACTIVE);
        po.setVersion(0);
        po.setCreatedAt(NOW);
        po.setUpdatedAt(NOW);
        instrumentMapper.insert(po);
        return po;
    }

    @Test
    void insert_shouldGenerateIdAndRoundTripTerms() {
        ConvertibleInstrumentPo po = insertNote(200L, LocalDate.of(2026, 1, 1));

        ConvertibleInstrumentPo loaded = instrumentMapper.findById(po.getId());

        assertThat(po.getId()).isNotNull();
        assertThat(loaded.getInstrumentType()).isEqualTo(InstrumentType.NOTE);
        assertThat(loaded.getPrincipal()).isEqualByComparingTo("100000");
        assertThat(loaded.getStatus()).isEqualTo(InstrumentStatus.ACTIVE);
        assertThat(loaded.getLastAccrualAt().toInstant()).isEqualTo(NOW.toInstant());
    }

    @Test
    void updateAccrual_withStaleVersion_shouldUpdateNothing() {
        // Arrange
        ConvertibleInstrumentPo po = insertNote(200L, LocalDate.of(2026, 1, 1));
        OffsetDateTime later = NOW.plusDays(30);

        // Act
        int first = instrumentMapper.updateAccrual(po.getId(), 0, new BigDecimal("657.53424658"), later, later);
        int second = instrumentMapper.updateAccrual(po.getId(), 0, new BigDecimal("999"), later, later);

        // Assert
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        ConvertibleInstrumentPo loaded = instrumentMapper.findById(po.getId());
        assertThat(loaded.getVersion()).isEqualTo(1);
        assertThat(loaded.getAccruedInterest()).isEqualByComparingTo("657.53424658");
    }

    @Test
    void markRepaid_afterConversion_shouldUpdateNothing() {
        // Arrange
        ConvertibleInstrumentPo po = insertNote(200L, LocalDate.of(2026, 1, 1));
        OffsetDateTime later = NOW.plusDays(60);

        // Act
        int converted = instrumentMapper.markConverted(po.getId(), 0, BigDecimal.ZERO, later,
                new BigDecimal("0.50000000"), 200000L, later);
        int repaid = instrumentMapper.markRepaid(po.getId(), 1, BigDecimal.ZERO, later,
                new BigDecimal("100000.00"), later);

        // Assert
        assertThat(converted).isEqualTo(1);
        assertThat(repaid).isZero();
        ConvertibleInstrumentPo loaded = instrumentMapper.findById(po.getId());
        assertThat(loaded.getStatus()).isEqualTo(InstrumentStatus.CONVERTED);
        assertThat(loaded.getConvertedShares()).isEqualTo(200000L);
        assertThat(loaded.getRepaidAmount()).isNull();
    }

    @Test
    void listActiveMaturingOnOrBefore_shouldIncludeOverdueOrderedByMaturity() {
        // Arrange
        ConvertibleInstrumentPo later = insertNote(201L, LocalDate.of(2026, 1, 20));
        ConvertibleInstrumentPo overdue = insertNote(201L, LocalDate.of(2025, 11, 1));
        insertNote(201L, LocalDate.of(2027, 1, 1));

        // Act
        List<ConvertibleInstrumentPo> maturing = instrumentMapper.listActiveMaturingOnOrBefore(LocalDate.of(2026, 1, 31));

        // Assert
        assertThat(maturing).extracting(ConvertibleInstrumentPo::getId)
                .containsExactly(overdue.getId(), later.getId());
    }

    @Test
    void listActiveAutoConvertibleByStartup_shouldSkipManualInstruments() {
        // Arrange
        ConvertibleInstrumentPo auto = insertNote(202L, LocalDate.of(2026, 1, 1));
        ConvertibleInstrumentPo manual = new ConvertibleInstrumentPo();
        manual.setInvestmentId(101L);
        manual.setStartupId(202L);
        manual.setInstrumentType(InstrumentType.SAFE);
        manual.setPrincipal(new BigDecimal("50000.00"));
        manual.setInterestRate(BigDecimal.ZERO);
        manual.setIssueDate(LocalDate.of(2024, 1, 1));
        manual.setMaturityDate(LocalDate.of(2026, 1, 1));
        manual.setValuationCap(new BigDecimal("5000000"));
        manual.setCompounding(CompoundingMode.SIMPLE);
        manual.setAutoConversion(false);
        manual.setSecurityType("Preferred");
        manual.setProRataRight(false);
        manual.setMfnProvision(false);
        manual.setAccruedInterest(BigDecimal.ZERO);
        manual.setLastAccrualAt(NOW);
        manual.setStatus(InstrumentStatus.ACTIVE);
        manual.setVersion(0);
        manual.setCreatedAt(NOW);
        manual.setUpdatedAt(NOW);
        instrumentMapper.insert(manual);

        // Act
        List<ConvertibleInstrumentPo> candidates = instrumentMapper.listActiveAutoConvertibleByStartup(202L);

        // Assert
        assertThat(candidates).extracting(ConvertibleInstrumentPo::getId).containsExactly(auto.getId());
    }
}
