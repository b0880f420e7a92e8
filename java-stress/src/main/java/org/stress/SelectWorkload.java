package org.stress;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Point lookup by key. The value is read off the result set so the driver
 * actually transfers it.
 */
public class SelectWorkload implements Workload {
    @Override
    public String name() {
        return "select";
    }

    @Override
    public String sql(DatabaseAdapter adapter) {
        return adapter.getSelectSql();
    }

    @Override
    public void bind(PreparedStatement ps, KeyValue kv) throws SQLException {
        ps.setBytes(1, kv.key());
    }

    @Override
    public int execute(PreparedStatement ps) throws SQLException {
        int found = 0;
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                rs.getBytes(1);
                found++;
            }
        }
        return found;
    }
}
