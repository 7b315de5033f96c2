package io.kneo.scheduler.service.sql.provider;

import java.sql.SQLException;

/**
 * A database driver bound at runtime. Each call to {@link #open(String)} hands out a fresh session
 * owned by the caller.
 */
public interface DbProvider {

    DbSession open(String connectionString) throws SQLException;
}
