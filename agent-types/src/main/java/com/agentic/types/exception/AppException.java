package com.agentic.types.exception;

import com.agentic.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载提交校验失败、注册冲突等同步拒绝的业务异常，包含异常码和异常描述信息。
 * 调用方需修正输入后再重试。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 按响应码创建异常，描述信息追加到响应码说明之后。
     *
     * @param responseCode 响应码
     * @param detail 附加描述
     */
    public AppException(ResponseCode responseCode, String detail) {
        this(responseCode.getCode(), detail == null ? responseCode.getInfo() : responseCode.getInfo() + ": " + detail);
    }

    /**
     * 判断异常是否对应给定响应码。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(this.code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    /**
     * 将异常转换为字符串表示。
     *
     * @return 包含异常码和描述信息的字符串
     */
    @Override
    public String toString() {
        return "com.agentic.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
