package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ClientBaseException;

public class PostNotFoundException extends ClientBaseException {
  public PostNotFoundException(Long postId) {
    super(CommonErrorCode.POST_NOT_FOUND, postId);
  }
}
