package com.lgcns.sdp.dkg.exception;

public class StoreProtocolException extends DkgQueryException {

    public StoreProtocolException(String message) {
        super("StoreProtocolError", message);
    }

    public StoreProtocolException(String message, Throwable cause) {
        super("StoreProtocolError", message, cause);
    }
}
