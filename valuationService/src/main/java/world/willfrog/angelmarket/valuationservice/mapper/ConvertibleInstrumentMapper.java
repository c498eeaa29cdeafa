package world.willfrog.angelmarket.valuationservice.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import world.willfrog.angelmarket.valuationservice.domain.ConvertibleInstrumentPo;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 可转换工具持久化。状态变更只走带 version 与 ACTIVE 条件的更新，返回 0 表示被其他写入方抢先。
 */
@Mapper
public interface ConvertibleInstrumentMapper {

    String COLUMNS = "id, investment_id, startup_id, investor_id, instrument_type, safe_type, principal, interest_rate, "
            + "issue_date, maturity_date, discount_rate, valuation_cap, qualified_financing_threshold, compounding, "
            + "auto_conversion, security_type, pro_rata_right, mfn_provision, document_url, accrued_interest, "
            + "last_accrual_at, status, conversion_price, converted_shares, converted_at, repaid_amount, repaid_at, "
            + "version, created_at, updated_at";

    @Insert("INSERT INTO convertible_instrument (investment_id, startup_id, investor_id, instrument_type, safe_type, "
            + "principal, interest_rate, issue_date, maturity_date, discount_rate, valuation_cap, "
            + "qualified_financing_threshold, compounding, auto_conversion, security_type, pro_rata_right, "
            + "mfn_provision, document_url, accrued_interest, last_accrual_at, status, version, created_at, updated_at) "
            + "VALUES (#{investmentId}, #{startupId}, #{investorId}, #{instrumentType}, #{safeType}, #{principal}, "
            + "#{interestRate}, #{issueDate}, #{maturityDate}, #{discountRate}, #{valuationCap}, "
            + "#{qualifiedFinancingThreshold}, #{compounding}, #{autoConversion}, #{securityType}, #{proRataRight}, "
            + "#{mfnProvision}, #{documentUrl}, #{accruedInterest}, #{lastAccrualAt}, #{status}, #{version}, "
            + "#{createdAt}, #{updatedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(ConvertibleInstrumentPo po);

    @Select("SELECT " + COLUMNS + " FROM convertible_instrument WHERE id = #{id}")
    ConvertibleInstrumentPo findById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM convertible_instrument WHERE startup_id = #{startupId} ORDER BY issue_date, id")
    List<ConvertibleInstrumentPo> listByStartup(@Param("startupId") Long startupId);

    @Select("SELECT " + COLUMNS + " FROM convertible_instrument WHERE investor_id = #{investorId} ORDER BY issue_date, id")
    List<ConvertibleInstrumentPo> listByInvestor(@Param("investorId") Long investorId);

    @Select("SELECT " + COLUMNS + " FROM convertible_instrument WHERE status = 'ACTIVE' ORDER BY id")
    List<ConvertibleInstrumentPo> listActive();

    @Select("SELECT " + COLUMNS + " FROM convertible_instrument WHERE status = 'ACTIVE' "
            + "AND maturity_date <= #{until} ORDER BY maturity_date, id")
    List<ConvertibleInstrumentPo> listActiveMaturingOnOrBefore(@Param("until") LocalDate until);

    @Select("SELECT " + COLUMNS + " FROM convertible_instrument WHERE startup_id = #{startupId} "
            + "AND status = 'ACTIVE' AND auto_conversion = TRUE ORDER BY issue_date, id")
    List<ConvertibleInstrumentPo> listActiveAutoConvertibleByStartup(@Param("startupId") Long startupId);

    @Update("UPDATE convertible_instrument SET accrued_interest = #{accruedInterest}, last_accrual_at = #{lastAccrualAt}, "
            + "version = version + 1, updated_at = #{updatedAt} "
            + "WHERE id = #{id} AND version = #{version} AND status = 'ACTIVE'")
    int updateAccrual(@Param("id") Long id,
                      @Param("version") Integer version,
                      @Param("accruedInterest") BigDecimal accruedInterest,
                      @Param("lastAccrualAt") OffsetDateTime lastAccrualAt,
                      @Param("updatedAt") OffsetDateTime updatedAt);

    @Update("UPDATE convertible_instrument SET accrued_interest = #{accruedInterest}, last_accrual_at = #{lastAccrualAt}, "
            + "status = 'CONVERTED', conversion_price = #{conversionPrice}, converted_shares = #{convertedShares}, "
            + "converted_at = #{convertedAt}, version = version + 1, updated_at = #{convertedAt} "
            + "WHERE id = #{id} AND version = #{version} AND status = 'ACTIVE'")
    int markConverted(@Param("id") Long id,
                      @Param("version") Integer version,
                      @Param("accruedInterest") BigDecimal accruedInterest,
                      @Param("lastAccrualAt") OffsetDateTime lastAccrualAt,
                      @Param("conversionPrice") BigDecimal conversionPrice,
                      @Param("convertedShares") Long convertedShares,
                      @Param("convertedAt") OffsetDateTime convertedAt);

    @Update("UPDATE convertible_instrument SET accrued_interest = #{accruedInterest}, last_accrual_at = #{lastAccrualAt}, "
            + "status = 'REPAID', repaid_amount = #{repaidAmount}, repaid_at = #{repaidAt}, "
            + "version = version + 1, updated_at = #{repaidAt} "
            + "WHERE id = #{id} AND version = #{version} AND status = 'ACTIVE'")
    int markRepaid(@Param("id") Long id,
                   @Param("version") Integer version,
                   @Param("accruedInterest") BigDecimal accruedInterest,
                   @Param("lastAccrualAt") OffsetDateTime lastAccrualAt,
                   @Param("repaidAmount") BigDecimal repaidAmount,
                   @Param("repaidAt") OffsetDateTime repaidAt);
}
