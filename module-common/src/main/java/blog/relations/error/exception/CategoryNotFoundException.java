package blog.relations.error.exception;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.exception.base.ClientBaseException;

public class CategoryNotFoundException extends ClientBaseException {

  public CategoryNotFoundException(Long categoryId) {
    super(CommonErrorCode.CATEGORY_NOT_FOUND, "ID: " + categoryId);
  }

  private CategoryNotFoundException(String identifier) {
    super(CommonErrorCode.CATEGORY_NOT_FOUND, identifier);
  }

  public static CategoryNotFoundException bySlug(String slug) {
    return new CategoryNotFoundException("slug: '" + slug + "'");
  }
}
