package com.sensorpipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorpipeline.core.buffer.StorageException;
import com.sensorpipeline.core.buffer.StorageWriter;
import com.sensorpipeline.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * {@link StorageWriter} that upserts feature vectors into the PostgreSQL
 * (TimescaleDB) table {@code sensor_features}.
 *
 * <p>
 * Each batch runs in one transaction: the whole batch is committed or rolled
 * back. Rows are keyed on {@code (well_id, sensor_type, timestamp)} and a
 * replayed record overwrites the earlier row. The complete feature vector is
 * stored as JSONB next to a few columns used for querying.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcFeatureStore implements StorageWriter {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcFeatureStore.class);

    static final String SCHEMA_RESOURCE = "db/sensor_features.sql";

    static final String UPSERT_SQL = "INSERT INTO sensor_features "
            + "(well_id, sensor_type, \"timestamp\", sensor_value, z_score, is_anomaly, late_arrival, features) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb)) "
            + "ON CONFLICT (well_id, sensor_type, \"timestamp\") DO UPDATE SET "
            + "sensor_value = EXCLUDED.sensor_value, "
            + "z_score = EXCLUDED.z_score, "
            + "is_anomaly = EXCLUDED.is_anomaly, "
            + "late_arrival = EXCLUDED.late_arrival, "
            + "features = EXCLUDED.features";

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public JdbcFeatureStore(DataSource dataSource) {
        this(dataSource, JsonSupport.newObjectMapper());
    }

    JdbcFeatureStore(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    @Override
    public void bulkInsert(List<FeatureVector> records) throws StorageException {
        if (records.isEmpty()) {
            return;
        }
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement ps = connection.prepareStatement(UPSERT_SQL)) {
                for (FeatureVector record : records) {
                    bind(ps, record);
                    ps.addBatch();
                }
                ps.executeBatch();
                connection.commit();
            } catch (SQLException | JsonProcessingException e) {
                rollback(connection);
                throw new StorageException(
                        "Bulk insert of " + records.size() + " record(s) failed: " + e.getMessage(), e);
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StorageException("Database unavailable: " + e.getMessage(), e);
        }
        LOG.debug("Upserted {} feature vector(s)", records.size());
    }

    /**
     * Create the table and indexes if they do not exist.
     *
     * @throws StorageException if the script cannot be loaded or executed
     */
    public void ensureSchema() throws StorageException {
        String ddl = loadSchemaScript();
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            LOG.info("Ensured sensor_features schema");
        } catch (SQLException e) {
            throw new StorageException("Failed to create schema: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void bind(PreparedStatement ps, FeatureVector record) throws SQLException, JsonProcessingException {
        ps.setString(1, record.getWellId());
        ps.setString(2, record.getSensorType().getCode());
        ps.setObject(3, OffsetDateTime.ofInstant(record.getTimestamp(), ZoneOffset.UTC));
        ps.setDouble(4, record.getValue());
        if (record.getZScore() == null) {
            ps.setNull(5, Types.DOUBLE);
        } else {
            ps.setDouble(5, record.getZScore());
        }
        ps.setBoolean(6, record.isAnomaly());
        ps.setBoolean(7, record.isLateArrival());
        ps.setString(8, mapper.writeValueAsString(record));
    }

    private static void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static String loadSchemaScript() throws StorageException {
        InputStream is = JdbcFeatureStore.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE);
        if (is == null) {
            throw new StorageException("Classpath resource not found: " + SCHEMA_RESOURCE);
        }
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }
}
