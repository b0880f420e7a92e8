package org.stress;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * One kind of operation driven against the {@code stress_kv} table.
 * 
 * <p>A workload is stateless: it names its statement, binds one {@link KeyValue}
 * into it, and runs it. The statement itself is prepared and cached by the
 * worker's {@link WorkerSession}, so one {@code Workload} instance is shared by
 * every worker of a pool.
 * 
 * <p>Implementations:
 * <ul>
 *   <li>{@code InsertWorkload}: one INSERT per key</li>
 *   <li>{@code SelectWorkload}: point lookup by key</li>
 *   <li>{@code UpdateWorkload}: overwrite the value of a key</li>
 *   <li>{@code DeleteWorkload}: delete by key</li>
 * </ul>
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public interface Workload {
    /** @return the name used in metrics labels and report files */
    String name();

    /** @return the parameterized statement this workload runs */
    String sql(DatabaseAdapter adapter);

    void bind(PreparedStatement ps, KeyValue kv) throws SQLException;

    /**
     * Runs the bound statement.
     *
     * @return rows affected or found; 0 counts as a miss
     */
    int execute(PreparedStatement ps) throws SQLException;
}
