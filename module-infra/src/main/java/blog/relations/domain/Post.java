package blog.relations.domain;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * 게시글 엔티티
 *
 * <h3>관계</h3>
 *
 * <ul>
 *   <li>N:1 {@link User} (작성자, 필수)
 *   <li>N:M {@link Category} ({@link PostCategory} 조인 엔티티 경유)
 *   <li>1:N {@link Comment}
 * </ul>
 *
 * <p>{@code categories}는 PERSIST만 전파합니다. 조인 행 삭제는 명시적 쿼리 또는 DB cascade로 처리합니다.
 */
@Entity
@Table(name = "posts", indexes = @Index(name = "idx_posts_author_id", columnList = "author_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"author", "categories", "comments"})
public class Post {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String title;

  @Column(length = 10000)
  private String content;

  @Column(nullable = false)
  private boolean published;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "author_id", nullable = false)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private User author;

  @OneToMany(mappedBy = "post", cascade = CascadeType.PERSIST)
  private List<PostCategory> categories = new ArrayList<>();

  @OneToMany(mappedBy = "post")
  private List<Comment> comments = new ArrayList<>();

  @CreationTimestamp
  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @UpdateTimestamp
  @Column(nullable = false)
  private LocalDateTime updatedAt;

  public Post(User author, String title, String content, boolean published) {
    this.author = author;
    this.title = title;
    this.content = content;
    this.published = published;
    author.getPosts().add(this);
  }

  /** null이 아닌 값만 반영합니다. published는 전이 규칙 없이 그대로 덮어씁니다. */
  public void update(String title, String content, Boolean published) {
    if (title != null) {
      this.title = title;
    }
    if (content != null) {
      this.content = content;
    }
    if (published != null) {
      this.published = published;
    }
  }

  /**
   * 카테고리 연결 (조인 행 생성)
   *
   * <p>이미 연결된 카테고리인지는 호출자가 확인합니다. 중복 쌍은 유니크 제약에서 거부됩니다.
   */
  public PostCategory addCategory(Category category) {
    PostCategory link = new PostCategory(this, category);
    categories.add(link);
    return link;
  }

  public List<Category> getCategoryList() {
    return categories.stream().map(PostCategory::getCategory).toList();
  }
}
