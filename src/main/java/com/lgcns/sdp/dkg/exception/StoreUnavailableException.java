package com.lgcns.sdp.dkg.exception;

public class StoreUnavailableException extends DkgQueryException {

    public StoreUnavailableException(String message, Throwable cause) {
        super("StoreUnavailable", message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
