package world.willfrog.angelmarket.valuationservice.exception;

import lombok.Getter;
import world.willfrog.angelmarket.common.dto.ResponseCode;
import world.willfrog.angelmarket.valuationservice.domain.InstrumentStatus;

@Getter
public class InvalidInstrumentStateException extends BizException {
    private final Long instrumentId;
    private final InstrumentStatus status;

    public InvalidInstrumentStateException(Long instrumentId, InstrumentStatus status) {
        super(ResponseCode.INVALID_STATE, "工具 " + instrumentId + " 当前状态为 " + status + "，仅 ACTIVE 状态允许该操作");
        this.instrumentId = instrumentId;
        this.status = status;
    }
}
