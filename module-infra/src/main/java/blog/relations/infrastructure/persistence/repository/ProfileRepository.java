package blog.relations.infrastructure.persistence.repository;

import blog.relations.domain.Profile;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProfileRepository extends JpaRepository<Profile, Long> {

  Optional<Profile> findByUserId(Long userId);

  long countByUserId(Long userId);
}
