package org.monetdb.client.dbclient;

import java.util.List;
import java.util.Set;
import org.monetdb.client.common.ResultEncoding;
import org.monetdb.client.exception.MonetSQLException;
import org.monetdb.client.model.core.QueryResponse;
import org.monetdb.client.model.core.RowBatch;

/**
 * The protocol transport of one session. Owns the socket, the login handshake, line framing and
 * value decoding; the fetch logic above it only decides which rows to ask for.
 *
 * <p>Implementations are not reentrant: a single request may be outstanding at a time, and a
 * result set's rows must be requested through the connection that produced it.
 */
public interface IMonetClient {

  /**
   * Opens the connection up to the server challenge.
   *
   * @return the binary export level announced by the server, 0 if it cannot export binary
   * @throws MonetSQLException if the server cannot be reached or sends a malformed challenge
   */
  int challenge() throws MonetSQLException;

  /**
   * Completes the login, passing the options in the given order.
   *
   * @param options the session options, in table order
   * @return the keys the server applied during the handshake; the caller sets the others itself
   * @throws MonetSQLException if authentication or negotiation fails
   */
  Set<HandshakeOptionKey> negotiate(List<HandshakeOption> options) throws MonetSQLException;

  /**
   * Sends a low level command and returns the raw response.
   *
   * @throws MonetSQLException if the transport fails or the server reports an error
   */
  String command(String command) throws MonetSQLException;

  /**
   * Runs a query and returns its header together with the rows delivered in the first response.
   *
   * @param sql the query text
   * @param replySize rows the server will include in the first response, -1 for all of them
   * @throws MonetSQLException if the transport fails or the server reports an error
   */
  QueryResponse executeQuery(String sql, int replySize) throws MonetSQLException;

  /**
   * Retrieves rows {@code [start, start + count)} of a result set kept on the server.
   *
   * @throws MonetSQLException if the transport fails or the server reports an error
   */
  RowBatch fetchRange(int resultId, long start, long count, ResultEncoding encoding)
      throws MonetSQLException;

  /**
   * Releases the server side copy of a result set.
   *
   * @throws MonetSQLException if the transport fails
   */
  void closeResult(int resultId) throws MonetSQLException;

  /** Whether the server can deliver result batches in binary form. */
  boolean supportsBinary();

  void setSocketTimeout(int timeoutMillis) throws MonetSQLException;

  int getSocketTimeout() throws MonetSQLException;

  void close() throws MonetSQLException;

  boolean isClosed();
}
