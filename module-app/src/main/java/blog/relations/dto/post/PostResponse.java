package blog.relations.dto.post;

import blog.relations.domain.Comment;
import blog.relations.domain.Post;
import blog.relations.dto.category.CategoryResponse;
import blog.relations.dto.comment.CommentResponse;
import blog.relations.dto.user.UserResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;

/**
 * 게시글 응답 DTO
 *
 * <p>author, categories, comments는 요청된 경우에만 채워집니다. 댓글은 항상 최신순입니다.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PostResponse(
    Long id,
    String title,
    String content,
    boolean published,
    Long authorId,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    UserResponse author,
    List<CategoryResponse> categories,
    List<CommentResponse> comments) {

  public static PostResponse from(Post post) {
    return base(post).build();
  }

  public static PostResponse withAuthor(Post post) {
    return base(post).author(UserResponse.from(post.getAuthor())).build();
  }

  public static PostResponse withAuthorAndCategories(Post post) {
    return base(post)
        .author(UserResponse.from(post.getAuthor()))
        .categories(categoriesOf(post))
        .build();
  }

  /** 사용자 상세 조회에 포함되는 게시글 (작성자는 상위 객체) */
  public static PostResponse withCategoriesAndComments(Post post) {
    return base(post).categories(categoriesOf(post)).comments(commentsOf(post)).build();
  }

  /** 목록 조회용: 작성자, 카테고리, 댓글(작성자 포함) */
  public static PostResponse withRelations(Post post) {
    return base(post)
        .author(UserResponse.from(post.getAuthor()))
        .categories(categoriesOf(post))
        .comments(commentsOf(post))
        .build();
  }

  /** 단건 조회용: 작성자 프로필, 카테고리, 댓글(작성자 포함) */
  public static PostResponse detail(Post post) {
    return base(post)
        .author(UserResponse.withProfile(post.getAuthor()))
        .categories(categoriesOf(post))
        .comments(commentsOf(post))
        .build();
  }

  /** 카테고리 상세 조회용: 작성자, 댓글 */
  public static PostResponse withAuthorAndComments(Post post) {
    return base(post)
        .author(UserResponse.from(post.getAuthor()))
        .comments(commentsOf(post))
        .build();
  }

  private static PostResponseBuilder base(Post post) {
    return PostResponse.builder()
        .id(post.getId())
        .title(post.getTitle())
        .content(post.getContent())
        .published(post.isPublished())
        .authorId(post.getAuthor().getId())
        .createdAt(post.getCreatedAt())
        .updatedAt(post.getUpdatedAt());
  }

  private static List<CategoryResponse> categoriesOf(Post post) {
    return post.getCategoryList().stream().map(CategoryResponse::from).toList();
  }

  private static List<CommentResponse> commentsOf(Post post) {
    return post.getComments().stream()
        .sorted(Comment.NEWEST_FIRST)
        .map(CommentResponse::withAuthor)
        .toList();
  }
}
