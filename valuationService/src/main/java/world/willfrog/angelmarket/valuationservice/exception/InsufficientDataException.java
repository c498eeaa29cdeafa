package world.willfrog.angelmarket.valuationservice.exception;

import world.willfrog.angelmarket.common.dto.ResponseCode;

public class InsufficientDataException extends BizException {

    public InsufficientDataException(String message) {
        super(ResponseCode.INSUFFICIENT_DATA, message);
    }
}
