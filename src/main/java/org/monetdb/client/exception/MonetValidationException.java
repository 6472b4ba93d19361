package org.monetdb.client.exception;

import org.monetdb.client.model.enums.MonetDriverErrorCode;

/**
 * Raised when the caller breaks the contract of an API: an out of range setting, position or
 * offset, or a read on a cursor that cannot be read from.
 */
public class MonetValidationException extends MonetSQLException {

  public MonetValidationException(String message) {
    super(message, MonetDriverErrorCode.INPUT_VALIDATION_ERROR);
  }

  public MonetValidationException(String message, MonetDriverErrorCode errorCode) {
    super(message, errorCode);
  }
}
