package blog.relations.infrastructure.persistence.repository;

import blog.relations.domain.Comment;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentRepository extends JpaRepository<Comment, Long> {

  /**
   * 댓글 목록 조회 (선택 필터, 최신순)
   *
   * @param postId 게시글 ID 필터 (null이면 전체)
   * @param authorId 작성자 ID 필터 (null이면 전체)
   */
  @EntityGraph(attributePaths = {"author", "post", "post.author"})
  @Query(
      """
      select c from Comment c
      where (:postId is null or c.post.id = :postId)
        and (:authorId is null or c.author.id = :authorId)
      order by c.createdAt desc, c.id desc
      """)
  List<Comment> search(@Param("postId") Long postId, @Param("authorId") Long authorId);

  @EntityGraph(attributePaths = {"author", "author.profile"})
  List<Comment> findByPostIdOrderByCreatedAtDescIdDesc(Long postId);

  @EntityGraph(attributePaths = {"post", "post.author"})
  List<Comment> findByAuthorIdOrderByCreatedAtDescIdDesc(Long authorId);

  @EntityGraph(attributePaths = {"author", "author.profile", "post", "post.author"})
  Optional<Comment> findDetailById(Long id);

  long countByPostId(Long postId);

  long countByAuthorId(Long authorId);
}
