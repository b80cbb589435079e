package io.clinic.jdbc.tx;

import io.clinic.ClinicError;
import io.clinic.Outcome;
import io.clinic.jdbc.ClinicStoreException;
import io.clinic.jdbc.DataSourceConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTransactionRunnerTest {

  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionRunner runner;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:runner_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    txContext = new ThreadLocalTxContext();
    runner = new JdbcTransactionRunner(
        new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), txContext));
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE notes (id INT PRIMARY KEY)");
    }
  }

  @Test
  void successCommits() throws SQLException {
    Outcome<Integer> outcome = runner.inTransaction(conn -> {
      assertSame(conn, txContext.currentConnection());
      insertNote(conn, 7);
      return Outcome.success(7);
    });

    assertTrue(outcome.isSuccess());
    assertEquals(7, outcome.value());
    assertEquals(1, countNotes());
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void failureOutcomeRollsBack() throws SQLException {
    Outcome<Integer> outcome = runner.inTransaction(conn -> {
      insertNote(conn, 7);
      return Outcome.failure(new ClinicError.ValidationError("field", "bad"));
    });

    assertFalse(outcome.isSuccess());
    assertEquals(0, countNotes());
  }

  @Test
  void exceptionRollsBackAndPropagates() throws SQLException {
    IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
        runner.inTransaction(conn -> {
          insertNote(conn, 7);
          throw new IllegalStateException("boom");
        }));

    assertEquals("boom", thrown.getMessage());
    assertEquals(0, countNotes());
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void sqlFailureOnBeginBecomesStoreException() {
    JdbcTransactionRunner broken = new JdbcTransactionRunner(new JdbcTransactionManager(() -> {
      throw new SQLException("pool exhausted");
    }, txContext));

    ClinicStoreException thrown = assertThrows(ClinicStoreException.class, () ->
        broken.inTransaction(conn -> Outcome.success(1)));
    assertEquals("pool exhausted", thrown.getCause().getMessage());
  }

  private static void insertNote(Connection conn, int id) {
    try (Statement st = conn.createStatement()) {
      st.executeUpdate("INSERT INTO notes (id) VALUES (" + id + ")");
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
  }

  private int countNotes() throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM notes")) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
