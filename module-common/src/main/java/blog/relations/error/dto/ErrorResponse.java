package blog.relations.error.dto;

import blog.relations.error.ErrorCode;
import blog.relations.error.exception.base.BaseException;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import org.springframework.http.ResponseEntity;

@Builder
public record ErrorResponse(
    int status,
    String code,
    String message,
    LocalDateTime timestamp,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<FieldErrorDetail> errors) {

  public ErrorResponse {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** 필드 단위 검증 실패 정보 */
  public record FieldErrorDetail(String field, String message) {}

  /**
   * 도메인 예외를 해당 에러 코드의 응답으로 변환한다.
   *
   * <p>e.getMessage()를 통해 식별자가 채워진 메시지(예: 어떤 사용자가 없는지)를 전달합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    ErrorCode errorCode = e.getErrorCode();
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatusCode())
                .code(errorCode.getCode())
                .message(e.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /**
   * 에러 코드만으로 응답을 만든다. 메시지 인자가 없는 코드에 쓴다.
   *
   * <p>Enum에 정의된 기본 메시지를 그대로 사용합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatusCode())
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /** 필드별 검증 오류를 함께 담은 응답. */
  public static ResponseEntity<ErrorResponse> toResponseEntity(
      ErrorCode errorCode, String detail, List<FieldErrorDetail> errors) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatusCode())
                .code(errorCode.getCode())
                .message(String.format(errorCode.getMessage(), detail))
                .timestamp(LocalDateTime.now())
                .errors(errors)
                .build());
  }
}
