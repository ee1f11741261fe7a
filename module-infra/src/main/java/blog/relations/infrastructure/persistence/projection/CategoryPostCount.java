package blog.relations.infrastructure.persistence.projection;

import java.time.LocalDateTime;

/**
 * 카테고리별 연결된 게시글 수 (인기 카테고리 조회용 projection)
 *
 * @param postCount post_categories 조인 행 개수
 */
public record CategoryPostCount(
    Long id,
    String name,
    String slug,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    Long postCount) {}
