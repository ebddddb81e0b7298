package com.lgcns.sdp.dkg.exception;

import lombok.Getter;

/**
 * 관계 질의 / 렉시컬 추출 처리 중 발생하는 모든 실패의 상위 타입.
 * 실패는 항상 요청 단위이며 부분 결과를 대신하지 않는다.
 */
@Getter
public abstract class DkgQueryException extends RuntimeException {

    private final String errorCode;

    protected DkgQueryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DkgQueryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 호출자가 백오프 후 재시도해도 되는지 여부
     */
    public boolean isTransient() {
        return false;
    }
}
