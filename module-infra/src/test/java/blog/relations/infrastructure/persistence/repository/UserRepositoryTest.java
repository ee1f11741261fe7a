package blog.relations.infrastructure.persistence.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import blog.relations.domain.Category;
import blog.relations.domain.Comment;
import blog.relations.domain.Post;
import blog.relations.domain.PostCategory;
import blog.relations.domain.Profile;
import blog.relations.domain.User;
import blog.relations.infrastructure.persistence.UniqueConstraintViolations;
import blog.relations.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * User 영속성 테스트 (H2)
 *
 * <p>유니크 제약과 DB 레벨 ON DELETE CASCADE 동작을 검증합니다.
 */
@DataJpaTest
@Tag("integration")
class UserRepositoryTest {

  @Autowired private TestEntityManager em;
  @Autowired private UserRepository userRepository;
  @Autowired private ProfileRepository profileRepository;
  @Autowired private PostRepository postRepository;
  @Autowired private CommentRepository commentRepository;
  @Autowired private PostCategoryRepository postCategoryRepository;

  private TestFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new TestFixtures(em);
  }

  @Nested
  @DisplayName("유니크 제약")
  class UniqueConstraintTest {

    @Test
    @DisplayName("같은 이메일로 두 번 저장하면 DataIntegrityViolationException")
    void duplicateEmail() {
      userRepository.saveAndFlush(new User("a@x.com", "A"));

      assertThatThrownBy(() -> userRepository.saveAndFlush(new User("a@x.com", "B")))
          .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("한 사용자에게 두 번째 프로필을 저장하면 DataIntegrityViolationException")
    void secondProfileRejected() {
      User user = fixtures.userWithProfile("a@x.com", "first profile bio");
      fixtures.flushAndClear();
      User reloaded = userRepository.findById(user.getId()).orElseThrow();

      assertThatThrownBy(
              () -> profileRepository.saveAndFlush(new Profile(reloaded, "second bio", null, null)))
          .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("이메일 중복은 유니크 위반으로 분류된다")
    void duplicateEmailIsUniqueViolation() {
      userRepository.saveAndFlush(new User("a@x.com", "A"));

      DataIntegrityViolationException e =
          catchThrowableOfType(
              () -> userRepository.saveAndFlush(new User("a@x.com", "B")),
              DataIntegrityViolationException.class);

      assertThat(UniqueConstraintViolations.isUniqueViolation(e)).isTrue();
    }

    @Test
    @DisplayName("컬럼 길이 초과는 무결성 위반이지만 유니크 위반이 아니다")
    void valueTooLongIsNotUniqueViolation() {
      User user = userRepository.saveAndFlush(new User("a@x.com", "A"));

      DataIntegrityViolationException e =
          catchThrowableOfType(
              () -> profileRepository.saveAndFlush(new Profile(user, "y".repeat(1001), null, null)),
              DataIntegrityViolationException.class);

      assertThat(e).isNotNull();
      assertThat(UniqueConstraintViolations.isUniqueViolation(e)).isFalse();
    }
  }

  @Nested
  @DisplayName("사용자 삭제 (ON DELETE CASCADE)")
  class CascadeDeleteTest {

    @Test
    @DisplayName("사용자 삭제 시 프로필, 게시글, 댓글, 게시글 하위 댓글/조인 행이 모두 삭제된다")
    void deleteUserCascades() {
      // given: A(프로필 O)가 쓴 글에 B가 댓글, B가 쓴 글에 A가 댓글
      User a = fixtures.userWithProfile("a@x.com", "hello world!");
      User b = fixtures.user("b@x.com");
      Category tech = fixtures.category("Technology");
      Category db = fixtures.category("Database");
      Post postByA = fixtures.post(a, "A의 글", tech, db);
      Post postByB = fixtures.post(b, "B의 글", tech);
      fixtures.comment(postByA, b, "B가 A 글에 단 댓글");
      fixtures.comment(postByB, a, "A가 B 글에 단 댓글");
      fixtures.comment(postByB, b, "B가 자기 글에 단 댓글");
      fixtures.flushAndClear();

      // when
      userRepository.delete(userRepository.findById(a.getId()).orElseThrow());
      userRepository.flush();
      em.clear();

      // then: A와 관련된 행은 고아 없이 모두 삭제
      assertThat(userRepository.existsById(a.getId())).isFalse();
      assertThat(profileRepository.countByUserId(a.getId())).isZero();
      assertThat(postRepository.countByAuthorId(a.getId())).isZero();
      assertThat(commentRepository.countByAuthorId(a.getId())).isZero();
      assertThat(commentRepository.countByPostId(postByA.getId())).isZero();
      assertThat(postCategoryRepository.countByPostId(postByA.getId())).isZero();

      // B의 데이터와 카테고리는 유지
      assertThat(fixtures.count(User.class)).isEqualTo(1);
      assertThat(fixtures.count(Post.class)).isEqualTo(1);
      assertThat(fixtures.count(Comment.class)).isEqualTo(1);
      assertThat(fixtures.count(PostCategory.class)).isEqualTo(1);
      assertThat(fixtures.count(Category.class)).isEqualTo(2);
      assertThat(fixtures.count(Profile.class)).isZero();
    }
  }

  @Test
  @DisplayName("findByEmail은 프로필을 함께 로딩한다")
  void findByEmailLoadsProfile() {
    fixtures.userWithProfile("a@x.com", "hello world!");
    fixtures.flushAndClear();

    User found = userRepository.findByEmail("a@x.com").orElseThrow();

    assertThat(found.hasProfile()).isTrue();
    assertThat(found.getProfile().getBio()).isEqualTo("hello world!");
    assertThat(userRepository.findByEmail("none@x.com")).isEmpty();
  }
}
