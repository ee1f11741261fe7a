package blog.relations.dto.category;

import blog.relations.infrastructure.persistence.projection.CategoryPostCount;
import java.time.LocalDateTime;

/** 카테고리 행 전체와 연결된 게시글 수 */
public record PopularCategoryResponse(
    Long id,
    String name,
    String slug,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    long postCount) {

  public static PopularCategoryResponse from(CategoryPostCount row) {
    return new PopularCategoryResponse(
        row.id(), row.name(), row.slug(), row.createdAt(), row.updatedAt(), row.postCount());
  }
}
