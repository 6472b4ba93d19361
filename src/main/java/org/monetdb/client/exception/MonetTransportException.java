package org.monetdb.client.exception;

import org.monetdb.client.model.enums.MonetDriverErrorCode;

/**
 * Exception for connection level failures: socket errors, timeouts and lost sessions.
 *
 * <p>A connection that raised this exception has to be recreated.
 */
public class MonetTransportException extends MonetSQLException {

  public MonetTransportException(String message) {
    super(message, MonetDriverErrorCode.TRANSPORT_ERROR);
  }

  public MonetTransportException(String message, Throwable cause) {
    super(message, cause, MonetDriverErrorCode.TRANSPORT_ERROR);
  }
}
