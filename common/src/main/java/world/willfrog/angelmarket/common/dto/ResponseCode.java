package world.willfrog.angelmarket.common.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 统一响应状态码枚举
 * <p>
 * 估值与转换引擎的每一类业务错误都有固定的状态码，调用方可据此分支处理。
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    /**
     * 成功响应
     */
    SUCCESS("200", "成功"),

    /**
     * 参数错误，工具条款或请求参数不合法
     */
    PARAM_ERROR("400", "参数错误"),

    /**
     * 数据未找到，工具或组合不存在
     */
    DATA_NOT_FOUND("404", "数据未找到"),

    /**
     * 并发修改冲突，乐观锁版本校验失败
     */
    CONCURRENT_MODIFICATION("4090", "数据已被并发修改"),

    /**
     * 业务处理异常
     */
    BUSINESS_ERROR("422", "业务处理异常"),

    /**
     * 工具状态不允许当前操作
     */
    INVALID_STATE("4220", "工具状态不允许该操作"),

    /**
     * 还款金额不足
     */
    INSUFFICIENT_REPAYMENT("4221", "还款金额不足"),

    /**
     * 对比数据不足
     */
    INSUFFICIENT_DATA("4222", "数据不足"),

    /**
     * 数值求解未收敛
     */
    NON_CONVERGENCE("4223", "数值求解未收敛"),

    /**
     * 系统内部错误
     */
    SYSTEM_ERROR("500", "系统内部错误"),

    /**
     * 数据库操作错误
     */
    DATABASE_ERROR("510", "数据库操作错误");

    /**
     * 状态码
     */
    private final String code;

    /**
     * 状态消息
     */
    private final String message;

    /**
     * 通过状态码获取枚举
     */
    public static ResponseCode getByCode(String code) {
        for (ResponseCode responseCode : values()) {
            if (responseCode.getCode().equals(code)) {
                return responseCode;
            }
        }
        return SYSTEM_ERROR;
    }
}
