package eventnative.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * Lightweight JDBC helper for batched row writes. Errors propagate so callers can classify them.
 */
public final class JdbcTemplate {

  /**
   * Executes one statement per parameter list as a single JDBC batch.
   *
   * @return rows affected, summed over the batch where the driver reports counts
   */
  public static int executeBatch(Connection conn, String sql, List<List<Object>> batch)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (List<Object> params : batch) {
        bindParams(ps, params);
        ps.addBatch();
      }
      int affected = 0;
      for (int count : ps.executeBatch()) {
        if (count > 0) {
          affected += count;
        }
      }
      return affected;
    }
  }

  static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object param = params.get(i);
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Double d) {
        ps.setDouble(i + 1, d);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
