package world.willfrog.angelmarket.valuationservice.exception;

import lombok.Getter;
import world.willfrog.angelmarket.common.dto.ResponseCode;

/**
 * 条款或参数不合法，field 为违反约束的字段名
 */
@Getter
public class ValidationException extends BizException {
    private final String field;

    public ValidationException(String field, String message) {
        super(ResponseCode.PARAM_ERROR, field + ": " + message);
        this.field = field;
    }
}
