package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ClientBaseException;

public class CommentNotFoundException extends ClientBaseException {
  public CommentNotFoundException(Long commentId) {
    super(CommonErrorCode.COMMENT_NOT_FOUND, commentId);
  }
}
