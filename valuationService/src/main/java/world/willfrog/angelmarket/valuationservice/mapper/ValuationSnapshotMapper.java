package world.willfrog.angelmarket.valuationservice.mapper;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.angelmarket.valuationservice.domain.SnapshotType;
import world.willfrog.angelmarket.valuationservice.domain.ValuationSnapshotPo;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface ValuationSnapshotMapper {

    String COLUMNS = "portfolio_id, snapshot_type, snapshot_date, total_value";

    /**
     * 分期收益使用的月度快照
     */
    @Select("SELECT " + COLUMNS + " FROM portfolio_valuation_snapshot "
            + "WHERE portfolio_id = #{portfolioId} AND snapshot_type = 'MONTHLY' "
            + "AND snapshot_date BETWEEN #{start} AND #{end} "
            + "ORDER BY snapshot_date")
    List<ValuationSnapshotPo> listByPortfolioBetween(@Param("portfolioId") Long portfolioId,
                                                     @Param("start") LocalDate start,
                                                     @Param("end") LocalDate end);

    @Select("SELECT " + COLUMNS + " FROM portfolio_valuation_snapshot "
            + "WHERE portfolio_id = #{portfolioId} AND snapshot_type = #{snapshotType} AND snapshot_date = #{snapshotDate}")
    ValuationSnapshotPo findOne(@Param("portfolioId") Long portfolioId,
                                @Param("snapshotType") SnapshotType snapshotType,
                                @Param("snapshotDate") LocalDate snapshotDate);

    @Insert("INSERT INTO portfolio_valuation_snapshot (" + COLUMNS + ") "
            + "VALUES (#{portfolioId}, #{snapshotType}, #{snapshotDate}, #{totalValue})")
    int insert(ValuationSnapshotPo snapshot);

    @Delete("DELETE FROM portfolio_valuation_snapshot "
            + "WHERE snapshot_type = #{snapshotType} AND snapshot_date < #{before}")
    int deleteBefore(@Param("snapshotType") SnapshotType snapshotType,
                     @Param("before") LocalDate before);
}
