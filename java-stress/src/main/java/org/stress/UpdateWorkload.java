package org.stress;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Overwrites the value of each key with the bytes of its payload value reversed, so
 * the row really changes.
 */
public class UpdateWorkload implements Workload {
    @Override
    public String name() {
        return "update";
    }

    @Override
    public String sql(DatabaseAdapter adapter) {
        return adapter.getUpdateSql();
    }

    @Override
    public void bind(PreparedStatement ps, KeyValue kv) throws SQLException {
        byte[] value = kv.value();
        byte[] reversed = new byte[value.length];
        for (int i = 0; i < value.length; i++) {
            reversed[i] = value[value.length - 1 - i];
        }
        ps.setBytes(1, reversed);
        ps.setBytes(2, kv.key());
    }

    @Override
    public int execute(PreparedStatement ps) throws SQLException {
        return ps.executeUpdate();
    }
}
