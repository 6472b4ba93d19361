package org.monetdb.client.api.impl;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.monetdb.client.api.internal.IMonetConnectionContext;
import org.monetdb.client.dbclient.HandshakeOption;
import org.monetdb.client.dbclient.HandshakeOptionKey;
import org.monetdb.client.dbclient.IMonetClient;
import org.monetdb.client.exception.MonetSQLException;
import org.monetdb.client.exception.MonetValidationException;
import org.monetdb.client.model.core.QueryResponse;
import org.monetdb.client.model.core.RowBatch;
import org.monetdb.client.model.enums.MonetDriverErrorCode;

/** Unit tests for MonetConnection: handshake, settings and lifecycle. */
@ExtendWith(MockitoExtension.class)
public class MonetConnectionTest {

  private static final int ONE_HOUR_EAST = 3600;

  @Mock private IMonetClient client;
  @Mock private IMonetConnectionContext connectionContext;

  @BeforeEach
  void setUp() throws MonetSQLException {
    lenient().when(connectionContext.getBinaryLevel()).thenReturn(1);
    lenient().when(connectionContext.getReplySize()).thenReturn(100);
    lenient().when(connectionContext.getMaxPrefetch()).thenReturn(2500);
    lenient().when(connectionContext.getAutoCommit()).thenReturn(false);
    lenient().when(connectionContext.getConnectTimeout()).thenReturn(-1);
    lenient().when(client.challenge()).thenReturn(1);
    lenient()
        .when(client.negotiate(anyList()))
        .thenReturn(EnumSet.allOf(HandshakeOptionKey.class));
    lenient()
        .when(client.executeQuery(anyString(), anyInt()))
        .thenReturn(new QueryResponse(0, 0, 0, new RowBatch(0, Collections.emptyList(), false)));
  }

  private MonetConnection connect() throws MonetSQLException {
    return new MonetConnection(client, connectionContext, ONE_HOUR_EAST);
  }

  @SuppressWarnings("unchecked")
  private List<HandshakeOption> capturedOptions() throws MonetSQLException {
    ArgumentCaptor<List<HandshakeOption>> captor = ArgumentCaptor.forClass(List.class);
    verify(client).negotiate(captor.capture());
    return captor.getValue();
  }

  @Test
  void testHandshakeOptionsInTableOrder() throws MonetSQLException {
    MonetConnection connection = connect();

    assertEquals(
        List.of(
            new HandshakeOption(HandshakeOptionKey.AUTO_COMMIT, false),
            new HandshakeOption(HandshakeOptionKey.REPLY_SIZE, 100),
            new HandshakeOption(HandshakeOptionKey.SIZE_HEADER, true),
            new HandshakeOption(HandshakeOptionKey.TIME_ZONE, ONE_HOUR_EAST)),
        capturedOptions());
    verify(client, never()).command(anyString());
    verify(client, never()).executeQuery(anyString(), anyInt());

    assertFalse(connection.getAutoCommit());
    assertTrue(connection.getSizeHeader());
    assertEquals(100, connection.getCurrentReplySize());
    assertEquals(ONE_HOUR_EAST, connection.getTimeZoneSecondsEast());
    assertEquals(1, connection.getServerBinaryExportLevel());
  }

  @Test
  void testOptionsNotAcceptedAreAppliedAfterHandshake() throws MonetSQLException {
    when(client.negotiate(anyList())).thenReturn(EnumSet.of(HandshakeOptionKey.AUTO_COMMIT));

    MonetConnection connection = connect();

    InOrder inOrder = inOrder(client);
    inOrder.verify(client).negotiate(anyList());
    inOrder.verify(client).command("Xreply_size 100");
    inOrder.verify(client).command("Xsizeheader 1");
    inOrder.verify(client).executeQuery("SET TIME ZONE INTERVAL '+01:00' HOUR TO MINUTE;", 100);
    verify(client, never()).command("Xauto_commit 0");
    assertTrue(connection.getSizeHeader());
    assertEquals(ONE_HOUR_EAST, connection.getTimeZoneSecondsEast());
  }

  @Test
  void testUnlimitedReplySizeAnnouncesSmallBatchWithBinary() throws MonetSQLException {
    when(connectionContext.getReplySize()).thenReturn(-1);

    connect();

    assertEquals(
        new HandshakeOption(HandshakeOptionKey.REPLY_SIZE, 10), capturedOptions().get(1));
  }

  @Test
  void testUnlimitedReplySizeKeptWithoutServerBinary() throws MonetSQLException {
    when(connectionContext.getReplySize()).thenReturn(-1);
    when(client.challenge()).thenReturn(0);

    connect();

    assertEquals(
        new HandshakeOption(HandshakeOptionKey.REPLY_SIZE, -1), capturedOptions().get(1));
  }

  @Test
  void testUnlimitedReplySizeKeptWhenBinaryDisabled() throws MonetSQLException {
    when(connectionContext.getReplySize()).thenReturn(-1);
    when(connectionContext.getBinaryLevel()).thenReturn(0);

    MonetConnection connection = connect();

    assertEquals(
        new HandshakeOption(HandshakeOptionKey.REPLY_SIZE, -1), capturedOptions().get(1));
    assertFalse(connection.getBinary());
  }

  @Test
  void testConnectTimeoutApplied() throws MonetSQLException {
    when(connectionContext.getConnectTimeout()).thenReturn(5000);

    when(client.getSocketTimeout()).thenReturn(0);

    connect();

    InOrder inOrder = inOrder(client);
    inOrder.verify(client).getSocketTimeout();
    inOrder.verify(client).setSocketTimeout(5000);
    inOrder.verify(client).challenge();
    inOrder.verify(client).negotiate(anyList());
    inOrder.verify(client).setSocketTimeout(0);
  }

  @Test
  void testConnectTimeoutRestoredWhenHandshakeFails() throws MonetSQLException {
    when(connectionContext.getConnectTimeout()).thenReturn(5000);
    when(client.getSocketTimeout()).thenReturn(30000);
    when(client.negotiate(anyList()))
        .thenThrow(new MonetSQLException("login refused", MonetDriverErrorCode.HANDSHAKE_ERROR));

    assertThrows(MonetSQLException.class, this::connect);

    InOrder inOrder = inOrder(client);
    inOrder.verify(client).setSocketTimeout(5000);
    inOrder.verify(client).setSocketTimeout(30000);
  }

  @Test
  void testNoConnectTimeoutLeavesSocketTimeoutAlone() throws MonetSQLException {
    connect();

    verify(client, never()).setSocketTimeout(anyInt());
    verify(client, never()).getSocketTimeout();
  }

  @Test
  void testSettingsValidatedWithoutServerRoundTrip() throws MonetSQLException {
    MonetConnection connection = connect();

    assertThrows(MonetValidationException.class, () -> connection.setReplySize(0));
    assertThrows(MonetValidationException.class, () -> connection.setMaxPrefetch(-2));
    assertEquals(100, connection.getReplySize());
    assertEquals(2500, connection.getMaxPrefetch());

    connection.setReplySize(-1);
    connection.setMaxPrefetch(0);
    connection.setBinary(false);
    assertEquals(-1, connection.getReplySize());
    assertEquals(0, connection.getMaxPrefetch());
    assertFalse(connection.getBinary());
    verify(client, never()).command(anyString());
  }

  @Test
  void testSetAutoCommitSendsCommand() throws MonetSQLException {
    MonetConnection connection = connect();

    connection.setAutoCommit(true);

    verify(client).command("Xauto_commit 1");
    assertTrue(connection.getAutoCommit());
  }

  @Test
  void testSetTimeZoneWestOfUtc() throws MonetSQLException {
    MonetConnection connection = connect();

    connection.setTimeZone(-(4 * 3600 + 30 * 60));

    verify(client).executeQuery("SET TIME ZONE INTERVAL '-04:30' HOUR TO MINUTE;", 100);
    assertEquals(-(4 * 3600 + 30 * 60), connection.getTimeZoneSecondsEast());
  }

  @Test
  void testCursorKeepsSettingsOfItsCreation() throws MonetSQLException {
    MonetConnection connection = connect();
    MonetCursor before = connection.cursor();

    connection.setReplySize(50);
    MonetCursor after = connection.cursor();

    assertEquals(100, before.getArraySize());
    assertEquals(100, before.getReplySize());
    assertEquals(50, after.getArraySize());
  }

  @Test
  void testCommitAndRollbackRunStatements() throws MonetSQLException {
    MonetConnection connection = connect();

    connection.commit();
    connection.rollback();

    InOrder inOrder = inOrder(client);
    inOrder.verify(client).executeQuery("COMMIT", 100);
    inOrder.verify(client).executeQuery("ROLLBACK", 100);
  }

  @Test
  void testCloseRollsBackAndClosesTransport() throws MonetSQLException {
    MonetConnection connection = connect();

    connection.close();

    InOrder inOrder = inOrder(client);
    inOrder.verify(client).executeQuery("ROLLBACK", 100);
    inOrder.verify(client).close();
    assertTrue(connection.isClosed());

    assertDoesNotThrow(connection::close);
    verify(client, times(1)).close();
    MonetSQLException useAfterClose = assertThrows(MonetSQLException.class, connection::cursor);
    assertEquals(MonetDriverErrorCode.CONNECTION_CLOSED, useAfterClose.getDriverErrorCode());
  }

  @Test
  void testExplicitCloseInsideTryWithResources() throws MonetSQLException {
    try (MonetConnection connection = connect()) {
      connection.close();
      assertTrue(connection.isClosed());
    }

    verify(client, times(1)).executeQuery("ROLLBACK", 100);
    verify(client, times(1)).close();
  }

  @Test
  void testCloseWithAutoCommitSkipsRollback() throws MonetSQLException {
    when(connectionContext.getAutoCommit()).thenReturn(true);
    MonetConnection connection = connect();

    connection.close();

    verify(client, never()).executeQuery(anyString(), anyInt());
    verify(client).close();
  }

  @Test
  void testCloseClosesTransportWhenRollbackFails() throws MonetSQLException {
    MonetConnection connection = connect();
    when(client.executeQuery(eq("ROLLBACK"), anyInt()))
        .thenThrow(new MonetSQLException("boom", MonetDriverErrorCode.TRANSPORT_ERROR));

    assertThrows(MonetSQLException.class, connection::close);

    verify(client).close();
    assertTrue(connection.isClosed());
  }

  @Test
  void testSocketTimeoutDelegates() throws MonetSQLException {
    MonetConnection connection = connect();
    when(client.getSocketTimeout()).thenReturn(1234);

    connection.setSocketTimeout(1234);

    verify(client).setSocketTimeout(1234);
    assertEquals(1234, connection.getSocketTimeout());
  }
}
