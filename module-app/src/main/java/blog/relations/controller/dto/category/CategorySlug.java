package blog.relations.controller.dto.category;

/** slug 형식: 소문자/숫자 단어를 하이픈으로 연결 (예: web-development) */
final class CategorySlug {

  static final String PATTERN = "^[a-z0-9]+(?:-[a-z0-9]+)*$";
  static final String MESSAGE = "slug는 소문자, 숫자, 하이픈(-)만 사용할 수 있습니다";

  private CategorySlug() {}
}
