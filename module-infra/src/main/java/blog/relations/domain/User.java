package blog.relations.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * 사용자 엔티티
 *
 * <h3>관계</h3>
 *
 * <ul>
 *   <li>1:0..1 {@link Profile} (FK는 profiles.user_id)
 *   <li>1:N {@link Post} (작성자)
 *   <li>1:N {@link Comment} (작성자)
 * </ul>
 *
 * <p>삭제 시 프로필, 게시글, 댓글은 DB의 {@code ON DELETE CASCADE} 규칙으로 함께 삭제됩니다. 이 엔티티의 컬렉션에는 JPA cascade를
 * 두지 않습니다.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = {"profile", "posts", "comments"})
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true)
  private String email;

  private String name;

  @OneToOne(mappedBy = "user", fetch = FetchType.LAZY)
  private Profile profile;

  @OneToMany(mappedBy = "author")
  private List<Post> posts = new ArrayList<>();

  @OneToMany(mappedBy = "author")
  private List<Comment> comments = new ArrayList<>();

  @CreationTimestamp
  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @UpdateTimestamp
  @Column(nullable = false)
  private LocalDateTime updatedAt;

  public User(String email, String name) {
    this.email = email;
    this.name = name;
  }

  /** null이 아닌 값만 반영합니다 (PATCH 의미). */
  public void update(String email, String name) {
    if (email != null) {
      this.email = email;
    }
    if (name != null) {
      this.name = name;
    }
  }

  /** 양방향 연관관계의 반대편을 맞춥니다. 영속화는 호출자가 담당합니다. */
  void assignProfile(Profile profile) {
    this.profile = profile;
  }

  public boolean hasProfile() {
    return profile != null;
  }

  /** 이름이 없으면 이메일을 표시 이름으로 사용합니다. */
  public String getDisplayName() {
    return name != null && !name.isBlank() ? name : email;
  }
}
