package com.lgcns.sdp.dkg.exception;

public class StoreTimeoutException extends DkgQueryException {

    public StoreTimeoutException(String message, Throwable cause) {
        super("StoreTimeout", message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
