package blog.relations.controller.dto;

/** PATCH 요청처럼 선택 필드를 받을 때 "값이 있으면 공백이 아니어야 한다"를 표현하는 정규식 */
public final class InputPatterns {

  /** null은 통과하고 빈 문자열과 공백만 있는 문자열은 거부 */
  public static final String NOT_BLANK = "(?s).*\\S.*";

  private InputPatterns() {}
}
