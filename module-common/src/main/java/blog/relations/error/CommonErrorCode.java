package blog.relations.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  USER_NOT_FOUND("C002", "존재하지 않는 사용자입니다 (%s)", HttpStatus.NOT_FOUND),
  POST_NOT_FOUND("C003", "존재하지 않는 게시글입니다 (ID: %s)", HttpStatus.NOT_FOUND),
  CATEGORY_NOT_FOUND("C004", "존재하지 않는 카테고리입니다 (%s)", HttpStatus.NOT_FOUND),
  COMMENT_NOT_FOUND("C005", "존재하지 않는 댓글입니다 (ID: %s)", HttpStatus.NOT_FOUND),
  DUPLICATE_RESOURCE("C006", "이미 존재하는 값입니다 (%s: %s)", HttpStatus.CONFLICT),
  ENDPOINT_NOT_FOUND("C007", "요청한 경로를 찾을 수 없습니다: %s", HttpStatus.NOT_FOUND),
  METHOD_NOT_ALLOWED("C008", "지원하지 않는 HTTP 메서드입니다: %s", HttpStatus.METHOD_NOT_ALLOWED),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  DATABASE_CLEANUP_NOT_ALLOWED(
      "S002", "운영 환경에서는 데이터베이스를 초기화할 수 없습니다 (profile: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  DATABASE_CONNECTION_FAILURE(
      "S003", "데이터베이스 연결에 실패했습니다 (%s)", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
