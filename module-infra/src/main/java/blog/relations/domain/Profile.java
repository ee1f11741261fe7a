package blog.relations.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * 사용자 프로필 (1:1)
 *
 * <p>{@code user_id} 유니크 제약이 사용자당 프로필 1개를 보장합니다.
 */
@Entity
@Table(name = "profiles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString(exclude = "user")
public class Profile {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(length = 1000)
  private String bio;

  @Column(length = 2048)
  private String avatar;

  @Column(length = 2048)
  private String website;

  @OneToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "user_id", nullable = false, unique = true)
  @OnDelete(action = OnDeleteAction.CASCADE)
  private User user;

  @CreationTimestamp
  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @UpdateTimestamp
  @Column(nullable = false)
  private LocalDateTime updatedAt;

  public Profile(User user, String bio, String avatar, String website) {
    this.user = user;
    this.bio = bio;
    this.avatar = avatar;
    this.website = website;
    user.assignProfile(this);
  }

  /** null이 아닌 값만 반영합니다. */
  public void update(String bio, String avatar, String website) {
    if (bio != null) {
      this.bio = bio;
    }
    if (avatar != null) {
      this.avatar = avatar;
    }
    if (website != null) {
      this.website = website;
    }
  }
}
