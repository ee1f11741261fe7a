package blog.relations.infrastructure.persistence.repository;

import blog.relations.domain.PostCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Post-Category 조인 행 Repository */
public interface PostCategoryRepository extends JpaRepository<PostCategory, Long> {

  /**
   * (postId, categoryId) 쌍의 조인 행 삭제
   *
   * <p>영속성 컨텍스트를 비워 이후 조회가 삭제 결과를 반영하도록 합니다.
   *
   * @return 삭제된 행 수 (0 또는 1)
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("delete from PostCategory pc where pc.post.id = :postId and pc.category.id = :categoryId")
  int deleteByPostIdAndCategoryId(
      @Param("postId") Long postId, @Param("categoryId") Long categoryId);

  long countByPostId(Long postId);

  long countByPostIdAndCategoryId(Long postId, Long categoryId);
}
