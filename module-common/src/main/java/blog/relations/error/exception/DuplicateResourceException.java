package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ClientBaseException;

/**
 * 유니크 제약(email, name, slug, post-category 쌍) 위반 시 발생 (409)
 *
 * <p>DB가 보고한 제약 위반을 원인(cause)으로 보존합니다.
 */
public class DuplicateResourceException extends ClientBaseException {
  public DuplicateResourceException(String field, Object value, Throwable cause) {
    super(CommonErrorCode.DUPLICATE_RESOURCE, cause, field, value);
  }
}
