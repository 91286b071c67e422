package com.chaincollector.exception;

public class SinkWriteException extends CollectionException {

    public SinkWriteException(String message, Throwable cause) {
        super(ErrorCode.SINK_ERROR, message, cause);
    }
}
