package blog.relations.infrastructure.persistence.repository;

import blog.relations.domain.Category;
import blog.relations.infrastructure.persistence.projection.CategoryPostCount;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface CategoryRepository extends JpaRepository<Category, Long> {

  Optional<Category> findBySlug(String slug);

  /**
   * 인기 카테고리 조회
   *
   * <p>연결된 게시글 수 내림차순, 동률이면 먼저 생성된 카테고리(id 오름차순)가 앞섭니다. 게시글이 없는 카테고리도 0건으로 포함됩니다.
   *
   * @param pageable 조회 개수 제한 (첫 페이지만 사용)
   * @return 카테고리별 게시글 수
   */
  @Query(
      """
      select new blog.relations.infrastructure.persistence.projection.CategoryPostCount(
        c.id, c.name, c.slug, c.createdAt, c.updatedAt, count(pc.id))
      from Category c
      left join c.posts pc
      group by c.id, c.name, c.slug, c.createdAt, c.updatedAt
      order by count(pc.id) desc, c.id asc
      """)
  List<CategoryPostCount> findPopular(Pageable pageable);
}
