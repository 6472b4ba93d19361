package org.monetdb.client.exception;

import org.monetdb.client.model.enums.MonetDriverErrorCode;

/**
 * Raised when the server sends a malformed or unexpected response. Fatal to the result set being
 * read; never retried.
 */
public class MonetProtocolException extends MonetSQLException {

  public MonetProtocolException(String message) {
    super(message, MonetDriverErrorCode.PROTOCOL_ERROR);
  }

  public MonetProtocolException(String message, Throwable cause) {
    super(message, cause, MonetDriverErrorCode.PROTOCOL_ERROR);
  }
}
