package com.fieldlink.relation;

import com.fieldlink.config.ConfigException;
import com.fieldlink.model.RelationConfig;
import com.fieldlink.model.RelationFieldConfig;
import com.fieldlink.resolver.UnknownFieldException;
import com.fieldlink.util.ConnectionDescriptorParser;
import com.fieldlink.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link RelationAdapter} over a JDBC table, backed by its own HikariCP pool.
 *
 * <p>A lookup on field {@code f} runs
 * <pre>SELECT (q1) AS f1, (q2) AS f2, ... FROM table WHERE (qf) = ?</pre>
 * where {@code qN} are the extraction expressions of the relation's fields and {@code qf} is the
 * expression bound to {@code f}. The pool is opened and one connection validated in the constructor.
 */
@Slf4j
public class JdbcRelationAdapter implements RelationAdapter, AutoCloseable {

    private final String name;
    private final List<String> fieldIds;
    private final Map<String, String> lookupSqlByField;
    private final HikariDataSource dataSource;

    /**
     * Connect a relation.
     *
     * @param relation relation definition
     * @param poolSettings pool sizing
     * @throws ConfigException when the relation declares no field
     * @throws RelationConnectionException when the data source cannot be reached
     */
    public JdbcRelationAdapter(RelationConfig relation, PoolSettings poolSettings) {
        if (relation.getFields() == null || relation.getFields().isEmpty()) {
            throw new ConfigException("relation `" + relation.getName() + "` does not have any field");
        }
        this.name = relation.getName();
        this.fieldIds = relation.getFields().stream()
                .map(RelationFieldConfig::getId)
                .collect(Collectors.toUnmodifiableList());
        this.lookupSqlByField = buildLookupSql(relation);
        this.dataSource = openPool(relation, poolSettings);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getFieldIds() {
        return fieldIds;
    }

    @Override
    public Map<String, Set<String>> lookup(String fieldId, String value) {
        String sql = lookupSqlByField.get(fieldId);
        if (sql == null) {
            throw new UnknownFieldException("relation `" + name + "` has no field `" + fieldId + "`");
        }
        log.debug("SQL: {} [{}]", sql, value);

        Map<String, Set<String>> discovered = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, value);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    readRow(rs, fieldId, discovered);
                }
            }
        } catch (SQLException e) {
            throw new LookupException(e.getMessage(), e);
        }
        return discovered;
    }

    private void readRow(ResultSet rs, String lookupField, Map<String, Set<String>> discovered) {
        // Columns are read by position: some drivers fold unquoted aliases to upper case.
        for (int i = 0; i < fieldIds.size(); i++) {
            String column = fieldIds.get(i);
            String columnValue;
            try {
                columnValue = rs.getString(i + 1);
            } catch (SQLException e) {
                throw new LookupException("failed to get field `" + column + "` when querying relation `"
                        + name + "` by `" + lookupField + "`: " + e.getMessage(), e);
            }
            if (columnValue != null) {
                discovered.computeIfAbsent(column, k -> new LinkedHashSet<>()).add(columnValue);
            }
        }
    }

    private static Map<String, String> buildLookupSql(RelationConfig relation) {
        String projection = relation.getFields().stream()
                .map(f -> "(" + f.getQuery() + ") AS " + f.getId())
                .collect(Collectors.joining(", "));

        Map<String, String> out = new LinkedHashMap<>();
        for (RelationFieldConfig field : relation.getFields()) {
            out.put(field.getId(), "SELECT " + projection
                    + " FROM " + relation.getTableName()
                    + " WHERE (" + field.getQuery() + ") = ?");
        }
        return Collections.unmodifiableMap(out);
    }

    private static HikariDataSource openPool(RelationConfig relation, PoolSettings poolSettings) {
        String masked = ConnectionDescriptorParser.mask(relation.getConnect());
        HikariDataSource ds = null;
        try {
            HikariConfig config = buildHikariConfig(relation, poolSettings);
            ds = new HikariDataSource(config);
            try (Connection conn = ds.getConnection()) {
                if (!conn.isValid(poolSettings.getValidationTimeoutSec())) {
                    throw new SQLException("Connection is not valid");
                }
            }
            log.info("Connected relation `{}` to {}", relation.getName(), masked);
            return ds;
        } catch (SQLException | RuntimeException e) {
            if (ds != null) {
                ds.close();
            }
            throw new RelationConnectionException("failed to connect to database `" + masked
                    + "` for relation `" + relation.getName() + "`: " + e.getMessage(), e);
        }
    }

    private static HikariConfig buildHikariConfig(RelationConfig relation, PoolSettings poolSettings) {
        JdbcConnectionInfo info = ConnectionDescriptorParser.parse(relation.getConnect());

        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(RelationSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        if (info.getUsername() != null && !info.getUsername().isEmpty()) {
            config.setUsername(info.getUsername());
        }
        if (info.getPassword() != null && !info.getPassword().isEmpty()) {
            config.setPassword(info.getPassword());
        }
        if (info.getDriverClassName() != null) {
            config.setDriverClassName(info.getDriverClassName());
        }
        info.getDataSourceProperties().forEach(config::addDataSourceProperty);
        if ("postgres".equals(info.getDbType())) {
            config.addDataSourceProperty("ApplicationName", "fieldlink");
        }

        config.setConnectionTimeout(poolSettings.getConnectionTimeoutMs());
        config.setMaximumPoolSize(poolSettings.getMaximumPoolSize());
        config.setMinimumIdle(poolSettings.getMinimumIdle());
        config.setPoolName("Relation-" + relation.getName());
        return config;
    }

    /**
     * Close the relation's pool.
     */
    @Override
    public void close() {
        dataSource.close();
    }
}
