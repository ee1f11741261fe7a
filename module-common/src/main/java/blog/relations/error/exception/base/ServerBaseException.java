package blog.relations.error.exception.base;

import blog.relations.error.ErrorCode;

/**
 * ServerBaseException: 시스템 내부 오류로 발생하는 '서버 예외'
 *
 * <p>5xx 계열의 에러를 처리하며, 장애 분석을 위한 상세 로그를 남기는 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)와 상세 메시지(args)를 함께 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
