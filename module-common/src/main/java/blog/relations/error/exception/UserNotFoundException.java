package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ClientBaseException;

public class UserNotFoundException extends ClientBaseException {

  public UserNotFoundException(Long userId) {
    super(CommonErrorCode.USER_NOT_FOUND, "ID: " + userId);
  }

  private UserNotFoundException(String identifier) {
    super(CommonErrorCode.USER_NOT_FOUND, identifier);
  }

  public static UserNotFoundException byEmail(String email) {
    return new UserNotFoundException("email: " + email);
  }
}
