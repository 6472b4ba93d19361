package org.monetdb.client.exception;

import java.sql.SQLException;
import org.monetdb.client.model.enums.MonetDriverErrorCode;

/** Base class of all errors raised by the client. */
public class MonetSQLException extends SQLException {

  private final MonetDriverErrorCode errorCode;

  public MonetSQLException(String reason, MonetDriverErrorCode errorCode) {
    super(reason, errorCode.name());
    this.errorCode = errorCode;
  }

  public MonetSQLException(String reason, Throwable cause, MonetDriverErrorCode errorCode) {
    super(reason, errorCode.name(), cause);
    this.errorCode = errorCode;
  }

  public MonetDriverErrorCode getDriverErrorCode() {
    return errorCode;
  }
}
