package com.ferrybooking.common.exception;

import lombok.Getter;

/**
 * A notification that was already settled arrived again. Carries the result recorded the first time.
 */
@Getter
public class ReplayDetectedException extends BusinessException {
    private final transient Object previousResult;

    public ReplayDetectedException(String message, Object previousResult) {
        super(message, ErrorCode.REPLAY_DETECTED);
        this.previousResult = previousResult;
    }
}
