package blog.relations;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * module-infra 테스트용 최소 Spring Boot 설정
 *
 * <p>@DataJpaTest가 탐색할 @SpringBootConfiguration을 제공합니다.
 */
@SpringBootApplication(scanBasePackages = "blog.relations")
public class InfraTestConfiguration {}
