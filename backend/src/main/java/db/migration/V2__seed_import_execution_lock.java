package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__seed_import_execution_lock extends BaseJavaMigration {
  private static final String LOCK_NAME = "designation-import";

  @Override
  public void migrate(Context context) throws Exception {
    if (lockRowExists(context.getConnection())) {
      return;
    }
    try (PreparedStatement ps =
        context
            .getConnection()
            .prepareStatement(
                "INSERT INTO import_execution_lock (lock_name, holder_execution_id, holder_instance, "
                    + "acquired_at, lease_expires_at) VALUES (?, NULL, NULL, NULL, NULL)")) {
      ps.setString(1, LOCK_NAME);
      ps.executeUpdate();
    }
  }

  private boolean lockRowExists(Connection connection) throws SQLException {
    String sql = "SELECT 1 FROM import_execution_lock WHERE lock_name = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, LOCK_NAME);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
