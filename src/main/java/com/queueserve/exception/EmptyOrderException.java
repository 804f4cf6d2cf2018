package com.queueserve.exception;

public class EmptyOrderException extends BaseException {

    public EmptyOrderException(String message) {
        super(ErrorCode.EMPTY_ORDER, message);
    }
}
