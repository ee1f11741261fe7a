package blog.relations.infrastructure.persistence;

import java.sql.SQLException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * 무결성 위반 중 유니크 제약 위반만 골라냅니다.
 *
 * <p>Spring은 유니크, NOT NULL, FK, 길이 초과를 모두 {@link DataIntegrityViolationException}으로 번역하므로 원인
 * 체인의 {@link SQLException}을 직접 확인합니다.
 *
 * <ul>
 *   <li>H2 / 표준 SQLState: {@code 23505}
 *   <li>MySQL: vendor code {@code 1062} (SQLState는 FK 위반과 같은 {@code 23000})
 * </ul>
 */
public final class UniqueConstraintViolations {

  static final String UNIQUE_VIOLATION_SQL_STATE = "23505";
  static final int MYSQL_DUPLICATE_ENTRY = 1062;

  private UniqueConstraintViolations() {}

  public static boolean isUniqueViolation(DataIntegrityViolationException e) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLException sqlException && isUniqueViolation(sqlException)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isUniqueViolation(SQLException e) {
    return UNIQUE_VIOLATION_SQL_STATE.equals(e.getSQLState())
        || e.getErrorCode() == MYSQL_DUPLICATE_ENTRY;
  }
}
