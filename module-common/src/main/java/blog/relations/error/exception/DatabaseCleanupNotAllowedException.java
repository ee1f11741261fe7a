package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ServerBaseException;

public class DatabaseCleanupNotAllowedException extends ServerBaseException {
  public DatabaseCleanupNotAllowedException(String profile) {
    super(CommonErrorCode.DATABASE_CLEANUP_NOT_ALLOWED, profile);
  }
}
