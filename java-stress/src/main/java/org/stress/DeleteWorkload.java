package org.stress;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Point delete by key. A key that is already gone counts as a miss.
 */
public class DeleteWorkload implements Workload {
    @Override
    public String name() {
        return "delete";
    }

    @Override
    public String sql(DatabaseAdapter adapter) {
        return adapter.getDeleteSql();
    }

    @Override
    public void bind(PreparedStatement ps, KeyValue kv) throws SQLException {
        ps.setBytes(1, kv.key());
    }

    @Override
    public int execute(PreparedStatement ps) throws SQLException {
        return ps.executeUpdate();
    }
}
