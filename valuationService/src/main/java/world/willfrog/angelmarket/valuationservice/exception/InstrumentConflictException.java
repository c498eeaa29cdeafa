package world.willfrog.angelmarket.valuationservice.exception;

import lombok.Getter;
import world.willfrog.angelmarket.common.dto.ResponseCode;

/**
 * 另一个写入方先完成了对同一工具的修改，本次写入被乐观锁拒绝
 */
@Getter
public class InstrumentConflictException extends BizException {
    private final Long instrumentId;

    public InstrumentConflictException(Long instrumentId) {
        super(ResponseCode.CONCURRENT_MODIFICATION, "工具 " + instrumentId + " 已被并发修改，请重新读取后重试");
        this.instrumentId = instrumentId;
    }
}
