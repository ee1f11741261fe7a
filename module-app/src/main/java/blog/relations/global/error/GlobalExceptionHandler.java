package blog.relations.global.error;

import blog.relations.error.CommonErrorCode;
import blog.relations.error.dto.ErrorResponse;
import blog.relations.error.dto.ErrorResponse.FieldErrorDetail;
import blog.relations.error.exception.base.BaseException;
import blog.relations.error.exception.base.ClientBaseException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * 비즈니스 예외 처리
   *
   * <p>클라이언트 예외는 WARN, 서버 예외는 원인과 함께 ERROR로 남깁니다.
   */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ClientBaseException) {
      log.warn("Client Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    } else {
      log.error("Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    }
    return ErrorResponse.toResponseEntity(e);
  }

  /** @Valid 요청 본문 검증 실패 (필드별 메시지 포함) */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    List<FieldErrorDetail> errors =
        e.getBindingResult().getFieldErrors().stream()
            .map(fe -> new FieldErrorDetail(fe.getField(), fe.getDefaultMessage()))
            .toList();
    log.warn("Validation Failure: {}", errors);
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INVALID_INPUT_VALUE, "요청 본문 검증 실패", errors);
  }

  /** 잘못된 JSON, 허용되지 않은 필드 */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable Request Body: {}", e.getMostSpecificCause().getMessage());
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INVALID_INPUT_VALUE, "요청 본문을 해석할 수 없습니다", List.of());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  protected ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
    log.warn("Type Mismatch: {}={}", e.getName(), e.getValue());
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INVALID_INPUT_VALUE,
        e.getName(),
        List.of(new FieldErrorDetail(e.getName(), "형식이 올바르지 않습니다: " + e.getValue())));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  protected ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException e) {
    log.warn("Missing Parameter: {}", e.getParameterName());
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.INVALID_INPUT_VALUE,
        e.getParameterName(),
        List.of(new FieldErrorDetail(e.getParameterName(), "필수 파라미터입니다")));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  protected ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.ENDPOINT_NOT_FOUND, "/" + e.getResourcePath(), List.of());
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  protected ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException e) {
    return ErrorResponse.toResponseEntity(
        CommonErrorCode.METHOD_NOT_ALLOWED, e.getMethod(), List.of());
  }

  /**
   * 예측하지 못한 시스템 예외
   *
   * <p>상세 메시지는 응답에 담지 않고 스택 트레이스만 로그로 남깁니다.
   */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
