package com.astrazeneca.symetrics.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameterized exact-match query over one table: SELECT columns AS aliases FROM table WHERE c1 = ? AND c2 = ?.
 * Table and column names come from the adapters' static schemas, values are always bound as parameters.
 */
public class TableQuery {
    private final String table;
    private final List<Column> columns = new ArrayList<>();
    private final List<Predicate> predicates = new ArrayList<>();

    private TableQuery(String table) {
        this.table = table;
    }

    public static TableQuery from(String table) {
        return new TableQuery(table);
    }

    /**
     * Adds column to the result under its canonical name.
     * @param column column name in the table schema
     * @param alias canonical name of the column in the result rows
     * @return this query
     */
    public TableQuery select(String column, String alias) {
        columns.add(new Column(column, alias));
        return this;
    }

    /**
     * Adds equality predicate.
     * @param column column name in the table schema
     * @param value value bound to the parameter
     * @return this query
     */
    public TableQuery where(String column, Object value) {
        predicates.add(new Predicate(column, value));
        return this;
    }

    public String getTable() {
        return table;
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<Predicate> getPredicates() {
        return Collections.unmodifiableList(predicates);
    }

    /**
     * @return values of predicates in the order of parameters in {@link #toSql()}
     */
    public List<Object> getParameters() {
        List<Object> parameters = new ArrayList<>();
        for (Predicate predicate : predicates) {
            parameters.add(predicate.value);
        }
        return parameters;
    }

    /**
     * @return SQL text with quoted identifiers (schemas have names like "#chrom") and '?' placeholders
     */
    public String toSql() {
        if (columns.isEmpty()) {
            throw new IllegalStateException("No columns selected from " + table);
        }
        StringBuilder sql = new StringBuilder("SELECT ");
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(quote(column.name)).append(" AS ").append(quote(column.alias));
        }
        sql.append(" FROM ").append(quote(table));
        for (int i = 0; i < predicates.size(); i++) {
            sql.append(i == 0 ? " WHERE " : " AND ");
            sql.append(quote(predicates.get(i).column)).append(" = ?");
        }
        return sql.toString();
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toString() {
        return toSql() + " " + getParameters();
    }

    /**
     * Selected column with its canonical name
     */
    public static class Column {
        public final String name;
        public final String alias;

        Column(String name, String alias) {
            this.name = name;
            this.alias = alias;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Column column = (Column) o;
            return Objects.equals(name, column.name) && Objects.equals(alias, column.alias);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, alias);
        }
    }

    /**
     * Equality predicate
     */
    public static class Predicate {
        public final String column;
        public final Object value;

        Predicate(String column, Object value) {
            this.column = column;
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Predicate predicate = (Predicate) o;
            return Objects.equals(column, predicate.column) && Objects.equals(value, predicate.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(column, value);
        }
    }
}
