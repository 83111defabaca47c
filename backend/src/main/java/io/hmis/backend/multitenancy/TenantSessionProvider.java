package io.hmis.backend.multitenancy;

import io.hmis.backend.exception.DataStoreException;
import io.hmis.backend.exception.ResourceConflictException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Function;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;
import org.springframework.stereotype.Component;
import org.springframework.web.ErrorResponseException;

/**
 * Scoped, schema-bound database sessions. Write work runs in one transaction on the primary store
 * and commits on normal completion; any exception rolls it back. Read work runs on the replica
 * unless the caller asks for the primary. The connection is released on every exit path, including
 * a failed reset of its transaction flags.
 *
 * <p>Storage exceptions leave here as typed errors: integrity violations as {@link
 * ResourceConflictException}, everything else as {@link DataStoreException}.
 */
@Component
public class TenantSessionProvider {

  private static final Logger log = LoggerFactory.getLogger(TenantSessionProvider.class);

  private static final SQLExceptionTranslator SQL_TRANSLATOR =
      new SQLErrorCodeSQLExceptionTranslator("PostgreSQL");

  private final DataSource primaryDataSource;
  private final DataSource readDataSource;
  private final SchemaRoutedConnectionProvider connectionProvider;

  public TenantSessionProvider(
      @Qualifier("appDataSource") DataSource primaryDataSource,
      @Qualifier("readDataSource") DataSource readDataSource,
      SchemaRoutedConnectionProvider connectionProvider) {
    this.primaryDataSource = primaryDataSource;
    this.readDataSource = readDataSource;
    this.connectionProvider = connectionProvider;
  }

  public <T> T inTransaction(TenantContext context, Function<TenantSession, T> work) {
    return execute(primaryDataSource, context, false, work);
  }

  public <T> T readOnly(TenantContext context, Function<TenantSession, T> work) {
    return readOnly(context, ReadPath.REPLICA, work);
  }

  public <T> T readOnly(TenantContext context, ReadPath path, Function<TenantSession, T> work) {
    DataSource dataSource = path == ReadPath.PRIMARY ? primaryDataSource : readDataSource;
    return execute(dataSource, context, true, work);
  }

  private <T> T execute(
      DataSource dataSource,
      TenantContext context,
      boolean readOnly,
      Function<TenantSession, T> work) {
    Connection connection = acquire(dataSource, context);
    try {
      connection.setAutoCommit(false);
      if (readOnly) {
        connection.setReadOnly(true);
      }
      T result = work.apply(new TenantSession(context, connection, readOnly));
      if (readOnly) {
        connection.rollback();
      } else {
        connection.commit();
      }
      return result;
    } catch (SQLException | RuntimeException e) {
      rollbackAfterFailure(connection, context, e);
      throw translate(e);
    } finally {
      release(connection, context, readOnly);
    }
  }

  private Connection acquire(DataSource dataSource, TenantContext context) {
    try {
      return connectionProvider.getConnection(dataSource, context.schemaName());
    } catch (SQLException e) {
      throw new DataStoreException(
          "Unable to open a session for schema " + context.schemaName(), e);
    }
  }

  private void rollbackAfterFailure(Connection connection, TenantContext context, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
      log.warn("Rollback failed: schema={}", context.schemaName(), rollbackFailure);
    }
  }

  private void release(Connection connection, TenantContext context, boolean readOnly) {
    try {
      if (readOnly) {
        connection.setReadOnly(false);
      }
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      log.warn("Failed to reset session connection: schema={}", context.schemaName(), e);
    } finally {
      try {
        connectionProvider.releaseConnection(connection);
      } catch (SQLException e) {
        log.warn("Failed to release session connection: schema={}", context.schemaName(), e);
      }
    }
  }

  static RuntimeException translate(Exception e) {
    if (e instanceof ErrorResponseException typed) {
      return typed;
    }
    if (e instanceof DataIntegrityViolationException integrity) {
      return new ResourceConflictException(
          "Constraint violation", integrity.getMostSpecificCause().getMessage(), integrity);
    }
    if (e instanceof DataAccessException dataAccess) {
      return new DataStoreException(dataAccess.getMostSpecificCause().getMessage(), dataAccess);
    }
    if (e instanceof SQLException sql) {
      return translate(SQL_TRANSLATOR.translate("tenant session", null, sql));
    }
    return (RuntimeException) e;
  }
}
