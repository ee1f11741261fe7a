package blog.relations.dto.category;

import blog.relations.domain.Category;
import blog.relations.domain.Post;
import blog.relations.dto.post.PostResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategoryResponse(
    Long id,
    String name,
    String slug,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    List<PostResponse> posts) {

  public static CategoryResponse from(Category category) {
    return of(category, null);
  }

  public static CategoryResponse withPosts(Category category, Function<Post, PostResponse> mapper) {
    return of(category, category.getPostList().stream().map(mapper).toList());
  }

  private static CategoryResponse of(Category category, List<PostResponse> posts) {
    return new CategoryResponse(
        category.getId(),
        category.getName(),
        category.getSlug(),
        category.getCreatedAt(),
        category.getUpdatedAt(),
        posts);
  }
}
