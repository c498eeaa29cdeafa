package world.willfrog.angelmarket.valuationservice.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.angelmarket.valuationservice.domain.PricePoint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 基准数据：指数收盘价与同类组合收益样本
 */
@Mapper
public interface BenchmarkDataMapper {

    @Select("SELECT trade_date, close_price AS close FROM benchmark_index_quote "
            + "WHERE index_code = #{indexCode} AND trade_date BETWEEN #{start} AND #{end} ORDER BY trade_date")
    List<PricePoint> listIndexCloses(@Param("indexCode") String indexCode,
                                     @Param("start") LocalDate start,
                                     @Param("end") LocalDate end);

    @Select("SELECT trade_date, close_price AS close FROM benchmark_index_quote "
            + "WHERE index_code = #{indexCode} AND trade_date < #{date} ORDER BY trade_date DESC LIMIT 1")
    PricePoint findLastCloseBefore(@Param("indexCode") String indexCode, @Param("date") LocalDate date);

    @Select("SELECT total_return FROM peer_portfolio_return "
            + "WHERE cohort = #{cohort} AND portfolio_id <> #{portfolioId} "
            + "AND period_start >= #{start} AND period_end <= #{end} ORDER BY total_return")
    List<BigDecimal> listPeerReturns(@Param("cohort") String cohort,
                                     @Param("portfolioId") Long portfolioId,
                                     @Param("start") LocalDate start,
                                     @Param("end") LocalDate end);
}
