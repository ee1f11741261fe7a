package blog.relations.error.exception.base;

import blog.relations.error.ErrorCode;

/**
 * ClientBaseException: 요청이 잘못되었거나 대상이 없을 때 발생하는 '비즈니스 예외'
 *
 * <p>4xx 계열의 에러를 처리하며, 클라이언트에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "존재하지 않는 사용자입니다 (ID: 1)"처럼 식별자를 포함한 메시지를 만듭니다.
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 원인 예외(DB 제약 위반 등)를 보존하면서 클라이언트용 메시지를 만듭니다.
  public ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
