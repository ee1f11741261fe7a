package blog.relations.dto.user;

import blog.relations.domain.Comment;
import blog.relations.domain.User;
import blog.relations.dto.comment.CommentResponse;
import blog.relations.dto.post.PostResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;

/**
 * 사용자 응답 DTO
 *
 * <p>요청하지 않은 관계(profile, posts, comments)는 null로 두어 JSON에서 생략합니다. 팩토리 메서드는 트랜잭션 안에서
 * 호출되어야 합니다.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(
    Long id,
    String email,
    String name,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    ProfileResponse profile,
    List<PostResponse> posts,
    List<CommentResponse> comments) {

  /** 스칼라 필드만 */
  public static UserResponse from(User user) {
    return base(user).build();
  }

  public static UserResponse withProfile(User user) {
    return base(user).profile(profileOf(user)).build();
  }

  /** 프로필 + 게시글 (이메일 조회) */
  public static UserResponse withProfileAndPosts(User user) {
    return base(user)
        .profile(profileOf(user))
        .posts(user.getPosts().stream().map(PostResponse::from).toList())
        .build();
  }

  /** 목록 조회용: 프로필, 게시글, 댓글 (스칼라) */
  public static UserResponse withRelations(User user) {
    return base(user)
        .profile(profileOf(user))
        .posts(user.getPosts().stream().map(PostResponse::from).toList())
        .comments(
            user.getComments().stream()
                .sorted(Comment.NEWEST_FIRST)
                .map(CommentResponse::from)
                .toList())
        .build();
  }

  /** 단건 조회용: 게시글마다 카테고리와 댓글까지 포함 */
  public static UserResponse detail(User user) {
    return base(user)
        .profile(profileOf(user))
        .posts(user.getPosts().stream().map(PostResponse::withCategoriesAndComments).toList())
        .comments(
            user.getComments().stream()
                .sorted(Comment.NEWEST_FIRST)
                .map(CommentResponse::from)
                .toList())
        .build();
  }

  private static UserResponseBuilder base(User user) {
    return UserResponse.builder()
        .id(user.getId())
        .email(user.getEmail())
        .name(user.getName())
        .createdAt(user.getCreatedAt())
        .updatedAt(user.getUpdatedAt());
  }

  private static ProfileResponse profileOf(User user) {
    return user.hasProfile() ? ProfileResponse.from(user.getProfile()) : null;
  }
}
