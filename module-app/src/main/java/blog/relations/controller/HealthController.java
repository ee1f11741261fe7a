package blog.relations.controller;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** DB 연결 상태 확인 (SELECT 1) */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final JdbcTemplate jdbcTemplate;

  @GetMapping("/health")
  public ResponseEntity<Map<String, String>> health() {
    try {
      jdbcTemplate.queryForObject("SELECT 1", Integer.class);
      return ResponseEntity.ok(Map.of("status", "UP", "database", "UP"));
    } catch (DataAccessException e) {
      log.warn("[Health] 데이터베이스 확인 실패: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(Map.of("status", "DOWN", "database", "DOWN"));
    }
  }
}
