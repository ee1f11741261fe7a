package blog.relations.infrastructure.persistence.repository;

import blog.relations.domain.User;
import java.util.Optional;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, Long> {

  /**
   * 이메일로 사용자 조회 (프로필 함께 로딩)
   *
   * @param email 유니크 이메일
   * @return 사용자 또는 empty
   */
  @EntityGraph(attributePaths = "profile")
  Optional<User> findByEmail(String email);
}
