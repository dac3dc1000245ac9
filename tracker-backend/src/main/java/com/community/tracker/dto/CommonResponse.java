package com.community.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 统一 API 响应格式
 *
 * @param <T> 数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 成功为 200，否则为错误对应的 HTTP 状态码
    private Integer code;

    // 失败时为错误类型名，成功时为 "OK"
    private String kind;

    private String message;

    private T data;

    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(200, "OK", "Request succeeded", data, Instant.now().toEpochMilli());
    }

    public static CommonResponse<Void> success() {
        return success(null);
    }

    public static <T> CommonResponse<T> error(Integer code, String kind, String message) {
        return new CommonResponse<>(code, kind, message, null, Instant.now().toEpochMilli());
    }
}
