package com.lgcns.sdp.dkg.exception;

public class UnboundedUnconstrainedQueryException extends DkgQueryException {

    public UnboundedUnconstrainedQueryException() {
        super("UnboundedUnconstrainedQuery",
                "An unbounded path query needs a source, target or relation constraint");
    }
}
