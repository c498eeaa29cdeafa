package world.willfrog.angelmarket.valuationservice.exception;

import lombok.Getter;
import world.willfrog.angelmarket.common.dto.ResponseCode;

@Getter
public class NonConvergenceException extends BizException {
    private final int iterations;

    public NonConvergenceException(String message, int iterations) {
        super(ResponseCode.NON_CONVERGENCE, message);
        this.iterations = iterations;
    }
}
