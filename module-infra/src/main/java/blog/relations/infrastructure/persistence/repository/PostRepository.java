package blog.relations.infrastructure.persistence.repository;

import blog.relations.domain.Post;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PostRepository extends JpaRepository<Post, Long> {

  /**
   * 게시글 목록 조회 (선택 필터, 최신순)
   *
   * <p>null인 필터는 조건에서 제외됩니다.
   *
   * @param published 공개 여부 필터
   * @param authorId 작성자 ID 필터
   * @return 최신순 게시글 목록
   */
  @EntityGraph(attributePaths = "author")
  @Query(
      """
      select p from Post p
      where (:published is null or p.published = :published)
        and (:authorId is null or p.author.id = :authorId)
      order by p.createdAt desc, p.id desc
      """)
  List<Post> search(@Param("published") Boolean published, @Param("authorId") Long authorId);

  /**
   * 카테고리에 연결된 게시글 조회 (조인 행이 하나라도 있으면 포함)
   *
   * @param categoryId 카테고리 ID
   * @return 최신순 게시글 목록
   */
  @EntityGraph(attributePaths = "author")
  @Query(
      """
      select p from Post p
      where exists (
        select 1 from PostCategory pc
        where pc.post = p and pc.category.id = :categoryId)
      order by p.createdAt desc, p.id desc
      """)
  List<Post> findAllLinkedToCategory(@Param("categoryId") Long categoryId);

  /** 단건 상세 조회 (작성자 + 작성자 프로필) */
  @EntityGraph(attributePaths = {"author", "author.profile"})
  Optional<Post> findDetailById(Long id);

  long countByAuthorId(Long authorId);
}
