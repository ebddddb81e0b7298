package com.lgcns.sdp.dkg.exception;

import lombok.Getter;

@Getter
public class InvalidQueryException extends DkgQueryException {

    private final String field;

    public InvalidQueryException(String field, String reason) {
        super("InvalidQuery", field + ": " + reason);
        this.field = field;
    }
}
