package blog.relations.infrastructure.persistence;

import blog.relations.error.exception.DatabaseCleanupNotAllowedException;
import blog.relations.infrastructure.persistence.repository.CategoryRepository;
import blog.relations.infrastructure.persistence.repository.CommentRepository;
import blog.relations.infrastructure.persistence.repository.PostCategoryRepository;
import blog.relations.infrastructure.persistence.repository.PostRepository;
import blog.relations.infrastructure.persistence.repository.ProfileRepository;
import blog.relations.infrastructure.persistence.repository.UserRepository;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 전체 데이터 초기화 (시드 데이터 투입 및 테스트용)
 *
 * <p>FK 제약을 지키기 위해 자식 테이블부터 삭제합니다: comments → post_categories → posts → profiles → categories →
 * users
 *
 * <p>{@code prod} 프로파일에서는 실행을 거부합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseCleaner {

  static final String PRODUCTION_PROFILE = "prod";

  private final CommentRepository commentRepository;
  private final PostCategoryRepository postCategoryRepository;
  private final PostRepository postRepository;
  private final ProfileRepository profileRepository;
  private final CategoryRepository categoryRepository;
  private final UserRepository userRepository;
  private final Environment environment;

  @Transactional
  public void cleanDatabase() {
    if (Arrays.asList(environment.getActiveProfiles()).contains(PRODUCTION_PROFILE)) {
      throw new DatabaseCleanupNotAllowedException(PRODUCTION_PROFILE);
    }

    commentRepository.deleteAllInBatch();
    postCategoryRepository.deleteAllInBatch();
    postRepository.deleteAllInBatch();
    profileRepository.deleteAllInBatch();
    categoryRepository.deleteAllInBatch();
    userRepository.deleteAllInBatch();

    log.info("[DatabaseCleaner] 모든 테이블 데이터 삭제 완료");
  }
}
