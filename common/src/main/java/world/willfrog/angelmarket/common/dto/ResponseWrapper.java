package world.willfrog.angelmarket.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应包装类
 * @param <T> 响应数据类型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseWrapper<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 响应状态码，取值见 {@link ResponseCode}
     */
    private String code;

    private String message;

    private T data;

    private long timestamp;

    /**
     * 成功响应
     */
    public static <T> ResponseWrapper<T> success(T data) {
        return ResponseWrapper.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .message(ResponseCode.SUCCESS.getMessage())
                .data(data)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    /**
     * 错误响应，使用状态码默认消息
     */
    public static <T> ResponseWrapper<T> error(ResponseCode responseCode) {
        return error(responseCode, responseCode.getMessage());
    }

    /**
     * 错误响应，自定义消息
     */
    public static <T> ResponseWrapper<T> error(ResponseCode responseCode, String message) {
        return ResponseWrapper.<T>builder()
                .code(responseCode.getCode())
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static <T> ResponseWrapper<T> notFound(String message) {
        return error(ResponseCode.DATA_NOT_FOUND, message);
    }

    public static <T> ResponseWrapper<T> paramError(String message) {
        return error(ResponseCode.PARAM_ERROR, message);
    }

    /**
     * 判断是否成功
     */
    public boolean isSuccess() {
        return ResponseCode.SUCCESS.getCode().equals(this.code);
    }
}
