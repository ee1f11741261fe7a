package blog.relations.dto.comment;

import blog.relations.domain.Comment;
import blog.relations.dto.post.PostResponse;
import blog.relations.dto.user.UserResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommentResponse(
    Long id,
    String content,
    Long postId,
    Long authorId,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    UserResponse author,
    PostResponse post) {

  public static CommentResponse from(Comment comment) {
    return base(comment).build();
  }

  public static CommentResponse withAuthor(Comment comment) {
    return base(comment).author(UserResponse.from(comment.getAuthor())).build();
  }

  public static CommentResponse withAuthorProfile(Comment comment) {
    return base(comment).author(UserResponse.withProfile(comment.getAuthor())).build();
  }

  public static CommentResponse withPost(Comment comment) {
    return base(comment).post(PostResponse.withAuthor(comment.getPost())).build();
  }

  /** 작성자 + 게시글(게시글 작성자 포함) */
  public static CommentResponse withAuthorAndPost(Comment comment) {
    return base(comment)
        .author(UserResponse.from(comment.getAuthor()))
        .post(PostResponse.withAuthor(comment.getPost()))
        .build();
  }

  /** 단건 조회용: 작성자 프로필 + 게시글 작성자 */
  public static CommentResponse detail(Comment comment) {
    return base(comment)
        .author(UserResponse.withProfile(comment.getAuthor()))
        .post(PostResponse.withAuthor(comment.getPost()))
        .build();
  }

  private static CommentResponseBuilder base(Comment comment) {
    return CommentResponse.builder()
        .id(comment.getId())
        .content(comment.getContent())
        .postId(comment.getPost().getId())
        .authorId(comment.getAuthor().getId())
        .createdAt(comment.getCreatedAt())
        .updatedAt(comment.getUpdatedAt());
  }
}
