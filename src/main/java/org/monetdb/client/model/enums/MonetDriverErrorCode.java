package org.monetdb.client.model.enums;

/**
 * Driver-side error codes. The enum name doubles as the SQL state of the {@link
 * org.monetdb.client.exception.MonetSQLException} that carries it.
 */
public enum MonetDriverErrorCode {
  CONNECTION_CLOSED,
  CURSOR_CLOSED,
  INVALID_STATE,
  INPUT_VALIDATION_ERROR,
  PROTOCOL_ERROR,
  TRANSPORT_ERROR,
  HANDSHAKE_ERROR,
  RESULT_SET_ERROR
}
