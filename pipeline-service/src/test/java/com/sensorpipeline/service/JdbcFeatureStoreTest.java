package com.sensorpipeline.service;

import com.sensorpipeline.core.buffer.StorageException;
import com.sensorpipeline.core.model.FeatureVector;
import com.sensorpipeline.core.model.Reading;
import com.sensorpipeline.core.model.SensorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link JdbcFeatureStore} against mocked JDBC objects.
 */
@ExtendWith(MockitoExtension.class)
class JdbcFeatureStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;

    private static FeatureVector vector(int second, Double zScore) {
        Reading reading = Reading.builder()
                .wellId("Well_01")
                .sensorType(SensorType.MOTOR_TEMPERATURE)
                .value(70.0 + second)
                .unit("C")
                .quality(100)
                .timestamp(T0.plusSeconds(second))
                .build();
        return FeatureVector.builder().reading(reading).windowCount(1).zScore(zScore).build();
    }

    private void givenConnection() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.prepareStatement(JdbcFeatureStore.UPSERT_SQL)).thenReturn(statement);
    }

    @Test
    @DisplayName("Should upsert a batch in one transaction")
    void shouldUpsertBatchInTransaction() throws Exception {
        givenConnection();
        JdbcFeatureStore store = new JdbcFeatureStore(dataSource);

        store.bulkInsert(List.of(vector(0, null), vector(1, 1.5)));

        verify(statement, times(2)).addBatch();
        verify(statement, times(2)).setString(1, "Well_01");
        verify(statement, times(2)).setString(2, "motor_temperature");
        verify(statement).setObject(3, OffsetDateTime.ofInstant(T0, ZoneOffset.UTC));
        verify(statement).setNull(5, Types.DOUBLE);
        verify(statement).setDouble(5, 1.5);
        InOrder order = inOrder(connection, statement);
        order.verify(connection).setAutoCommit(false);
        order.verify(statement).executeBatch();
        order.verify(connection).commit();
        order.verify(connection).setAutoCommit(true);
        order.verify(connection).close();
        verify(connection, never()).rollback();
    }

    @Test
    @DisplayName("Stores the full feature vector as JSON")
    void shouldStoreFeaturesAsJson() throws Exception {
        givenConnection();
        JdbcFeatureStore store = new JdbcFeatureStore(dataSource);

        store.bulkInsert(List.of(vector(0, 2.0)));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(statement).setString(eq(8), json.capture());
        assertThat(json.getValue()).contains("\"well_id\":\"Well_01\"");
    }

    @Test
    @DisplayName("A failed batch is rolled back and reported as StorageException")
    void shouldRollBackOnFailure() throws Exception {
        givenConnection();
        when(statement.executeBatch()).thenThrow(new SQLException("deadlock detected"));
        JdbcFeatureStore store = new JdbcFeatureStore(dataSource);

        assertThatThrownBy(() -> store.bulkInsert(List.of(vector(0, null))))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("deadlock detected")
                .hasCauseInstanceOf(SQLException.class);

        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).setAutoCommit(true);
    }

    @Test
    @DisplayName("An unreachable database is reported as StorageException")
    void shouldReportUnavailableDatabase() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
        JdbcFeatureStore store = new JdbcFeatureStore(dataSource);

        assertThatThrownBy(() -> store.bulkInsert(List.of(vector(0, null))))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Database unavailable");
    }

    @Test
    @DisplayName("An empty batch does not touch the database")
    void shouldSkipEmptyBatch() throws Exception {
        new JdbcFeatureStore(dataSource).bulkInsert(List.of());

        verifyNoInteractions(dataSource);
    }

    @Test
    @DisplayName("ensureSchema runs the bundled DDL script")
    void shouldEnsureSchema() throws Exception {
        Statement ddl = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(ddl);

        new JdbcFeatureStore(dataSource).ensureSchema();

        ArgumentCaptor<String> script = ArgumentCaptor.forClass(String.class);
        verify(ddl).execute(script.capture());
        assertThat(script.getValue()).contains("CREATE TABLE IF NOT EXISTS sensor_features");
        verify(ddl).close();
    }

    @Test
    @DisplayName("A failing DDL statement is reported as StorageException")
    void shouldReportSchemaFailure() throws Exception {
        Statement ddl = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(ddl);
        when(ddl.execute(anyString())).thenThrow(new SQLException("permission denied"));

        assertThatThrownBy(() -> new JdbcFeatureStore(dataSource).ensureSchema())
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("permission denied");
    }
}
