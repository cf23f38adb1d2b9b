package com.fieldlink.relation;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLSyntaxErrorException;

/**
 * Keeps HikariCP from evicting a relation connection for statement-level errors.
 *
 * <p>A bad extraction expression in the link schema fails every lookup against its relation with a
 * syntax or data error. The connection itself is healthy; evicting it would only churn the pool.
 */
public class RelationSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException
                || sqlException instanceof SQLDataException
                || sqlException instanceof SQLIntegrityConstraintViolationException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null) {
            // 0A feature not supported, 22 data exception, 23 constraint violation, 42 syntax error or access rule
            if (sqlState.startsWith("0A") || sqlState.startsWith("22")
                    || sqlState.startsWith("23") || sqlState.startsWith("42")) {
                return Override.DO_NOT_EVICT;
            }
        }

        return Override.CONTINUE_EVICT;
    }
}
