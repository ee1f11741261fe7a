package blog.relations.lifecycle;

import blog.relations.error.exception.DatabaseConnectionException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * DB 연결 확인 및 연결/해제 로그
 *
 * <h3>Phase 설정</h3>
 *
 * <ul>
 *   <li>시작: 웹 서버보다 먼저 연결을 확인하여 실패 시 기동을 중단합니다.
 *   <li>종료: 웹 서버가 요청 수신을 멈춘 뒤 해제 로그를 남깁니다. 커넥션 풀 종료는 컨텍스트가 담당합니다.
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseConnectionLogger implements SmartLifecycle {

  static final int PHASE = Integer.MIN_VALUE + 1000;

  private final DataSource dataSource;

  private volatile boolean running = false;

  @Override
  public void start() {
    try (Connection connection = dataSource.getConnection()) {
      DatabaseMetaData metaData = connection.getMetaData();
      log.info(
          "[Database] 연결 성공: {} {} ({})",
          metaData.getDatabaseProductName(),
          metaData.getDatabaseProductVersion(),
          metaData.getURL());
    } catch (SQLException e) {
      throw new DatabaseConnectionException(e.getMessage(), e);
    }
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    log.info("[Database] 연결 해제");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }
}
