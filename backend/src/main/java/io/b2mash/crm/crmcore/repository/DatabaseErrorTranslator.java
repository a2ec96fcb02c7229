package io.b2mash.crm.crmcore.repository;

import io.b2mash.crm.crmcore.exception.DatabaseOperationException;
import io.b2mash.crm.crmcore.exception.ResourceConflictException;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import java.sql.SQLException;
import java.util.function.Supplier;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Converts PostgreSQL failures raised through Spring's {@link DataAccessException} hierarchy into
 * the domain exception types. No raw store exception escapes a repository.
 */
public final class DatabaseErrorTranslator {

  private static final Logger log = LoggerFactory.getLogger(DatabaseErrorTranslator.class);

  static final String FOREIGN_KEY_VIOLATION = "23503";
  static final String UNIQUE_VIOLATION = "23505";
  static final String CHECK_VIOLATION = "23514";
  static final String NOT_NULL_VIOLATION = "23502";
  static final String INVALID_TEXT_REPRESENTATION = "22P02";

  private DatabaseErrorTranslator() {}

  public static <T> T call(Supplier<T> operation) {
    try {
      return operation.get();
    } catch (DataAccessException e) {
      throw translate(e);
    }
  }

  public static void run(Runnable operation) {
    try {
      operation.run();
    } catch (DataAccessException e) {
      throw translate(e);
    }
  }

  public static RuntimeException translate(DataAccessException exception) {
    var sqlException = findSqlException(exception);
    String sqlState = sqlException != null ? sqlException.getSQLState() : null;
    ServerErrorMessage serverError =
        sqlException instanceof PSQLException psql ? psql.getServerErrorMessage() : null;

    if (sqlState == null) {
      log.warn("Database operation failed without SQL state: {}", exception.getMessage());
      return new DatabaseOperationException("Database operation failed", exception);
    }

    String constraint = serverError != null ? serverError.getConstraint() : null;
    String detail = serverError != null ? serverError.getDetail() : null;

    return switch (sqlState) {
      case FOREIGN_KEY_VIOLATION ->
          new ResourceConflictException(
              orDefault(constraint, "foreign_key"), foreignKeyMessage(constraint, detail));
      case UNIQUE_VIOLATION ->
          new ResourceConflictException(
              orDefault(constraint, "unique"), uniqueMessage(constraint, detail));
      case CHECK_VIOLATION ->
          new ResourceConflictException(orDefault(constraint, "check"), checkMessage(constraint));
      case NOT_NULL_VIOLATION -> {
        String column = serverError != null ? serverError.getColumn() : null;
        yield new ResourceConflictException(
            "not_null", "Required field '" + orDefault(column, "unknown") + "' cannot be null");
      }
      case INVALID_TEXT_REPRESENTATION ->
          ValidationFailedException.forField(
              "format",
              serverError != null && serverError.getMessage() != null
                  ? serverError.getMessage()
                  : "Invalid input format");
      default -> {
        log.warn(
            "Database operation failed: sqlState={}, message={}",
            sqlState,
            sqlException.getMessage());
        yield new DatabaseOperationException("Database operation failed", exception);
      }
    };
  }

  private static String foreignKeyMessage(String constraint, String detail) {
    if (mentions(constraint, detail, "company_id")) {
      return "Referenced company does not exist";
    }
    if (mentions(constraint, detail, "contact_id")) {
      return "Referenced contact does not exist";
    }
    return "Referenced record does not exist";
  }

  private static String uniqueMessage(String constraint, String detail) {
    if (mentions(constraint, detail, "email")) {
      return "Email address already exists";
    }
    if (mentions(constraint, detail, "name")) {
      return "Name already exists";
    }
    return "Duplicate value violates a unique constraint";
  }

  private static String checkMessage(String constraint) {
    if (mentions(constraint, null, "probability")) {
      return "Probability must be between 0 and 100";
    }
    if (mentions(constraint, null, "status")) {
      return "Invalid status value";
    }
    return "Value violates check constraint " + orDefault(constraint, "unknown");
  }

  private static boolean mentions(String constraint, String detail, String token) {
    return (constraint != null && constraint.contains(token))
        || (detail != null && detail.contains(token));
  }

  private static String orDefault(String value, String fallback) {
    return value != null && !value.isBlank() ? value : fallback;
  }

  private static SQLException findSqlException(Throwable throwable) {
    SQLException found = null;
    for (Throwable t = throwable; t != null && t.getCause() != t; t = t.getCause()) {
      if (t instanceof PSQLException psql) {
        return psql;
      }
      if (found == null && t instanceof SQLException sql) {
        found = sql;
      }
    }
    return found;
  }
}
