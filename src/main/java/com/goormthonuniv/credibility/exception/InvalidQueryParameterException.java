package com.goormthonuniv.credibility.exception;

/**
 * 조회 파라미터가 잘못됨 (알 수 없는 enum 값, 음수 limit/offset 등). 400 으로 응답한다.
 */
public class InvalidQueryParameterException extends IllegalArgumentException {

    public InvalidQueryParameterException(String message) {
        super(message);
    }

    public InvalidQueryParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
