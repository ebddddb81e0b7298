package com.lgcns.sdp.dkg.util;

import com.lgcns.sdp.dkg.exception.DkgQueryException;
import com.lgcns.sdp.dkg.exception.StoreProtocolException;
import com.lgcns.sdp.dkg.exception.StoreTimeoutException;
import com.lgcns.sdp.dkg.exception.StoreUnavailableException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.neo4j.driver.exceptions.ConnectionReadTimeoutException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * 저장소(Neo4jClient / Driver)에서 올라온 예외를 요청 단위 실패 분류로 변환
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreExceptionTranslator {

    private static final String TIMED_OUT_CODE = "Neo.ClientError.Transaction.TransactionTimedOut";
    private static final String TERMINATED_CODE = "Neo.ClientError.Transaction.Terminated";

    public static DkgQueryException translate(RuntimeException ex, String operation) {
        if (ex instanceof DkgQueryException dkgEx) {
            return dkgEx;
        }

        // 1. 원인 체인에서 드라이버 예외를 먼저 찾는다 (Spring 변환 전 원본 코드가 가장 정확함)
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof DkgQueryException wrapped) {
                return wrapped;
            }
            if (cause instanceof ConnectionReadTimeoutException) {
                return new StoreTimeoutException(operation + " timed out waiting for the graph store", ex);
            }
            if (cause instanceof ServiceUnavailableException || cause instanceof SessionExpiredException) {
                return new StoreUnavailableException(operation + " failed: graph store unavailable", ex);
            }
            if (cause instanceof Neo4jException neo4jEx && isTimeoutCode(neo4jEx.code())) {
                return new StoreTimeoutException(operation + " exceeded the configured deadline", ex);
            }
            if (cause instanceof TransientException) {
                return new StoreUnavailableException(operation + " failed with a transient store error", ex);
            }
        }

        // 2. Spring DataAccessException 계층
        if (ex instanceof QueryTimeoutException || ex instanceof TransactionTimedOutException) {
            return new StoreTimeoutException(operation + " exceeded the configured deadline", ex);
        }
        if (ex instanceof DataAccessResourceFailureException
                || ex instanceof CannotCreateTransactionException
                || ex instanceof TransientDataAccessException) {
            return new StoreUnavailableException(operation + " failed: graph store unavailable", ex);
        }

        return new StoreProtocolException(operation + " failed: " + ex.getMessage(), ex);
    }

    private static boolean isTimeoutCode(String code) {
        return code != null && (code.startsWith(TIMED_OUT_CODE) || code.equals(TERMINATED_CODE));
    }
}
