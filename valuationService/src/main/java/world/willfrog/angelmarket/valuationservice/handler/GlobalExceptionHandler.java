package world.willfrog.angelmarket.valuationservice.handler;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import world.willfrog.angelmarket.common.dto.ResponseCode;
import world.willfrog.angelmarket.common.dto.ResponseWrapper;
import world.willfrog.angelmarket.valuationservice.exception.BizException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BizException.class)
    public ResponseWrapper<Void> handleBizException(BizException ex) {
        log.info("Business rejection code={} message={}", ex.getCode().getCode(), ex.getMessage());
        return ResponseWrapper.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseWrapper<Void> handleValidations(Exception ex) {
        return ResponseWrapper.error(ResponseCode.PARAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseWrapper<Void> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseWrapper.error(ResponseCode.SYSTEM_ERROR, "系统异常，请稍后再试");
    }
}
