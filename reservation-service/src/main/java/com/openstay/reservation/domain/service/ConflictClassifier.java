package com.openstay.reservation.domain.service;

import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import org.springframework.dao.ConcurrencyFailureException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Decides whether a failed allocation lost a race (worth re-running), was refused a value
 * by the database, or hit a real fault.
 */
final class ConflictClassifier {

    /**
     * PostgreSQL: serialization_failure, deadlock_detected, lock_not_available, unique_violation.
     */
    private static final Set<String> CONFLICT_SQL_STATES = Set.of("40001", "40P01", "55P03", "23505");

    /** SQLSTATE class 22: data exception (overflow, string too long, bad format). */
    private static final String DATA_EXCEPTION_CLASS = "22";

    private static final int MAX_CAUSE_DEPTH = 16;

    private ConflictClassifier() {
    }

    static boolean isConcurrentConflict(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ConcurrencyFailureException
                    || current instanceof PessimisticLockException
                    || current instanceof LockTimeoutException) {
                return true;
            }
            if (current instanceof SQLException sqlException
                    && CONFLICT_SQL_STATES.contains(sqlException.getSQLState())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    static boolean isInvalidData(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SQLException sqlException
                    && sqlException.getSQLState() != null
                    && sqlException.getSQLState().startsWith(DATA_EXCEPTION_CLASS)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
