package com.theset.setlist.infrastructure.persistence;

import com.theset.setlist.domain.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PermissionDeniedDataAccessException;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Turns JDBC writes into tagged outcomes, separating missing privileges from every other failure.
 */
final class JdbcWrites {

    private static final Logger logger = LoggerFactory.getLogger(JdbcWrites.class);

    static final String INSUFFICIENT_PRIVILEGE = "42501";

    private JdbcWrites() {
    }

    static <T> WriteOutcome<T> write(String description, Supplier<T> statement) {
        try {
            return WriteOutcome.written(statement.get());
        } catch (DataAccessException e) {
            if (isPermissionDenied(e)) {
                logger.warn("Permission denied on {}: {}", description, e.getMostSpecificCause().getMessage());
                return WriteOutcome.permissionDenied(e);
            }
            logger.error("Database error on {}", description, e);
            return WriteOutcome.failed(e);
        }
    }

    static boolean isPermissionDenied(DataAccessException e) {
        if (e instanceof PermissionDeniedDataAccessException) {
            return true;
        }
        return e.getMostSpecificCause() instanceof SQLException sqlException
                && INSUFFICIENT_PRIVILEGE.equals(sqlException.getSQLState());
    }
}
