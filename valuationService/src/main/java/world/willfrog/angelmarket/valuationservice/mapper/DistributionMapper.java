package world.willfrog.angelmarket.valuationservice.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.angelmarket.valuationservice.domain.DistributionPo;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface DistributionMapper {

    @Select({"<script>",
            "SELECT id, investment_id, amount, distribution_date FROM investment_distribution",
            "WHERE distribution_date BETWEEN #{start} AND #{end}",
            "AND investment_id IN",
            "<foreach collection='investmentIds' item='investmentId' open='(' separator=',' close=')'>",
            "#{investmentId}",
            "</foreach>",
            "ORDER BY distribution_date, id",
            "</script>"})
    List<DistributionPo> listByInvestmentsBetween(@Param("investmentIds") List<Long> investmentIds,
                                                  @Param("start") LocalDate start,
                                                  @Param("end") LocalDate end);
}
