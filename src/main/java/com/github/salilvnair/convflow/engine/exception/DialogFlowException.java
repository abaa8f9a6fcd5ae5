package com.github.salilvnair.convflow.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class DialogFlowException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public DialogFlowException(DialogFlowErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public DialogFlowException(DialogFlowErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public DialogFlowException(DialogFlowErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public DialogFlowException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean hasCode(DialogFlowErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}
