package com.example.seriesscan.common.exception;

public class BusinessException extends RuntimeException {

    public static final String SCAN_ROOT_NOT_FOUND = "SCAN_ROOT_NOT_FOUND";

    private final String code;

    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
