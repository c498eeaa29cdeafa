package world.willfrog.angelmarket.valuationservice.exception;

import world.willfrog.angelmarket.common.dto.ResponseCode;

public class ResourceNotFoundException extends BizException {

    public ResourceNotFoundException(String message) {
        super(ResponseCode.DATA_NOT_FOUND, message);
    }
}
