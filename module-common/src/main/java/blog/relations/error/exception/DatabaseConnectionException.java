package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ServerBaseException;

public class DatabaseConnectionException extends ServerBaseException {
  public DatabaseConnectionException(String detail, Throwable cause) {
    super(CommonErrorCode.DATABASE_CONNECTION_FAILURE, cause, detail);
  }
}
