package org.stress;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Inserts each key with its value. Keys are unique per run, so a miss here means the
 * table was not cleared beforehand.
 */
public class InsertWorkload implements Workload {
    @Override
    public String name() {
        return "insert";
    }

    @Override
    public String sql(DatabaseAdapter adapter) {
        return adapter.getInsertSql();
    }

    @Override
    public void bind(PreparedStatement ps, KeyValue kv) throws SQLException {
        ps.setBytes(1, kv.key());
        ps.setBytes(2, kv.value());
    }

    @Override
    public int execute(PreparedStatement ps) throws SQLException {
        return ps.executeUpdate();
    }
}
