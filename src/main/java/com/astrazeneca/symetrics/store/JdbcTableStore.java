package com.astrazeneca.symetrics.store;

import com.astrazeneca.symetrics.exception.StoreUnavailableException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static com.astrazeneca.symetrics.data.Patterns.JDBC_URL;

/**
 * Table store reached through JDBC. Every query opens its own connection and closes it on all exit paths,
 * no connection is shared between calls. Plain file paths are treated as SQLite databases opened read-only.
 */
public class JdbcTableStore implements TableStore {
    static final String SQLITE_PREFIX = "jdbc:sqlite:";
    /**
     * SQLITE_OPEN_READONLY: a missing database file is an error instead of a new empty database
     */
    static final String SQLITE_READ_ONLY = "1";

    private final String url;

    public JdbcTableStore(String descriptor) {
        this.url = toUrl(descriptor);
    }

    /**
     * @param descriptor JDBC URL or path to SQLite database
     * @return JDBC URL
     */
    public static String toUrl(String descriptor) {
        if (descriptor == null || descriptor.trim().isEmpty()) {
            throw new IllegalArgumentException("Table store location is empty");
        }
        return JDBC_URL.matcher(descriptor).find() ? descriptor : SQLITE_PREFIX + descriptor;
    }

    @Override
    public String getDescriptor() {
        return url;
    }

    @Override
    public List<Row> select(TableQuery query) {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(query.toSql())) {
            List<Object> parameters = query.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                return readRows(resultSet);
            }
        } catch (SQLException e) {
            System.err.println("Connection to " + url + " failed: " + e.getMessage() + " (query: " + query + ")");
            throw new StoreUnavailableException(url, e);
        }
    }

    Connection openConnection() throws SQLException {
        Properties properties = new Properties();
        if (url.startsWith(SQLITE_PREFIX)) {
            properties.setProperty("open_mode", SQLITE_READ_ONLY);
        }
        return DriverManager.getConnection(url, properties);
    }

    private List<Row> readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<Row> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                values.put(metaData.getColumnLabel(i), resultSet.getObject(i));
            }
            rows.add(new Row(values));
        }
        return rows;
    }

    @Override
    public String toString() {
        return "JdbcTableStore [" + url + "]";
    }
}
