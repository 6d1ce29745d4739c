package ai.schemaflow.model.db;

import jakarta.annotation.Nullable;
import org.postgresql.util.PSQLState;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

public enum DbHelper {
    ;

    public static boolean isUniqueViolation(SQLException e) {
        return PSQLState.UNIQUE_VIOLATION.getState().equals(rootSqlState(e));
    }

    public static boolean isForeignKeyViolation(SQLException e) {
        return PSQLState.FOREIGN_KEY_VIOLATION.getState().equals(rootSqlState(e));
    }

    public static boolean isQueryCanceled(SQLException e) {
        return PSQLState.QUERY_CANCELED.getState().equals(rootSqlState(e));
    }

    @Nullable
    public static String rootSqlState(SQLException e) {
        SQLException current = e;
        while (current != null) {
            if (current.getSQLState() != null) {
                return current.getSQLState();
            }
            current = current.getCause() instanceof SQLException cause ? cause : current.getNextException();
        }
        return null;
    }

    public static void bind(PreparedStatement st, int startIdx, List<Object> args) throws SQLException {
        int idx = startIdx;
        for (var arg : args) {
            bind(st, idx++, arg);
        }
    }

    public static void bind(PreparedStatement st, int idx, @Nullable Object value) throws SQLException {
        if (value == null) {
            st.setNull(idx, Types.NULL);
        } else if (value instanceof Enum<?> e) {
            st.setString(idx, e.name());
        } else if (value instanceof Instant instant) {
            st.setTimestamp(idx, Timestamp.from(instant));
        } else if (value instanceof Long l) {
            st.setLong(idx, l);
        } else if (value instanceof Integer i) {
            st.setInt(idx, i);
        } else if (value instanceof String s) {
            st.setString(idx, s);
        } else {
            st.setObject(idx, value);
        }
    }

    @Nullable
    public static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    @Nullable
    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        var ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
