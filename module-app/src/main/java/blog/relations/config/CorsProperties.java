package blog.relations.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * CORS 설정 프로퍼티
 *
 * <p>빈 오리진 목록이면 애플리케이션 시작이 실패합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app.cors")
public class CorsProperties {

  @NotEmpty(message = "CORS 허용 오리진 목록은 필수입니다. app.cors.allowed-origins 설정을 확인하세요.")
  private List<String> allowedOrigins;

  @NotNull private Boolean allowCredentials = true;

  /** preflight 캐시 시간 (초) */
  @Min(0)
  private Long maxAge = 3600L;
}
