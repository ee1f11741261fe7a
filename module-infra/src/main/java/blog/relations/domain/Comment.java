package blog.relations.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.Comparator;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

/** 댓글 엔티티. 게시글과 작성자 FK가 모두 필수이며, 둘 중 하나가 삭제되면 함께 삭제됩니다. */
@Entity
@Table(
    name = "comments",
    indexes = {
      @Index(name = "idx_comments_post_id", columnList = "post_id"),
      @Index(name = "idx_comments_author_id", columnList = "author_id")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"post", "author"})
public class Comment {

  /** 최신순 (동일 시각이면 나중에 생성된 id 우선) */
  public static final Comparator<Comment> NEWEST_FIRST =
      Comparator.<Comment, LocalDateTime>comparing(
              Comment::getCreatedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
          .thenComparing(Comment::getId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
          .reversed();

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, length = 2000)
  private String content;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "post_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private Post post;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "author_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private User author;

  @CreationTimestamp
  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @UpdateTimestamp
  @Column(nullable = false)
  private LocalDateTime updatedAt;

  public Comment(Post post, User author, String content) {
    this.post = post;
    this.author = author;
    this.content = content;
    post.getComments().add(this);
    author.getComments().add(this);
  }

  public void updateContent(String content) {
    this.content = content;
  }
}
