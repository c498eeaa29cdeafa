package world.willfrog.angelmarket.valuationservice.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.angelmarket.valuationservice.domain.InvestmentPo;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface InvestmentMapper {

    String COLUMNS = "id, portfolio_id, startup_id, startup_name, sector, amount, investment_date, current_valuation, status";

    @Select("SELECT COUNT(1) FROM investment WHERE portfolio_id = #{portfolioId}")
    long countByPortfolio(@Param("portfolioId") Long portfolioId);

    @Select("SELECT " + COLUMNS + " FROM investment WHERE portfolio_id = #{portfolioId} ORDER BY investment_date, id")
    List<InvestmentPo> listByPortfolio(@Param("portfolioId") Long portfolioId);

    @Select("SELECT " + COLUMNS + " FROM investment WHERE portfolio_id = #{portfolioId} "
            + "AND status IN ('APPROVED', 'COMPLETED') "
            + "AND investment_date BETWEEN #{start} AND #{end} ORDER BY investment_date, id")
    List<InvestmentPo> listActiveByPortfolioBetween(@Param("portfolioId") Long portfolioId,
                                                    @Param("start") LocalDate start,
                                                    @Param("end") LocalDate end);

    @Select("SELECT " + COLUMNS + " FROM investment WHERE portfolio_id = #{portfolioId} "
            + "AND status IN ('APPROVED', 'COMPLETED') "
            + "AND investment_date <= #{asOf} ORDER BY investment_date, id")
    List<InvestmentPo> listActiveByPortfolioAsOf(@Param("portfolioId") Long portfolioId,
                                                 @Param("asOf") LocalDate asOf);

    /**
     * 至少有一笔正金额有效投资的组合
     */
    @Select("SELECT DISTINCT portfolio_id FROM investment "
            + "WHERE status IN ('APPROVED', 'COMPLETED') AND amount > 0 ORDER BY portfolio_id")
    List<Long> listPortfolioIdsWithActiveInvestments();
}
