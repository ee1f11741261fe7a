package blog.relations.service;

import static blog.relations.support.EntityFixtures.category;
import static blog.relations.support.EntityFixtures.comment;
import static blog.relations.support.EntityFixtures.post;
import static blog.relations.support.EntityFixtures.user;
import static blog.relations.support.EntityFixtures.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import blog.relations.domain.Category;
import blog.relations.domain.Post;
import blog.relations.domain.PostCategory;
import blog.relations.domain.User;
import blog.relations.dto.category.CategoryResponse;
import blog.relations.dto.post.PostResponse;
import blog.relations.dto.post.PostStatsResponse;
import blog.relations.error.exception.CategoryNotFoundException;
import blog.relations.error.exception.PostNotFoundException;
import blog.relations.error.exception.UserNotFoundException;
import blog.relations.infrastructure.persistence.repository.CategoryRepository;
import blog.relations.infrastructure.persistence.repository.CommentRepository;
import blog.relations.infrastructure.persistence.repository.PostCategoryRepository;
import blog.relations.infrastructure.persistence.repository.PostRepository;
import blog.relations.infrastructure.persistence.repository.UserRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@Tag("unit")
class PostServiceTest {

  private PostRepository postRepository;
  private UserRepository userRepository;
  private CategoryRepository categoryRepository;
  private PostCategoryRepository postCategoryRepository;
  private CommentRepository commentRepository;
  private PostService postService;

  private User alice;
  private Category tech;
  private Category db;

  @BeforeEach
  void setUp() {
    postRepository = mock(PostRepository.class);
    userRepository = mock(UserRepository.class);
    categoryRepository = mock(CategoryRepository.class);
    postCategoryRepository = mock(PostCategoryRepository.class);
    commentRepository = mock(CommentRepository.class);
    postService =
        new PostService(
            postRepository,
            userRepository,
            categoryRepository,
            postCategoryRepository,
            commentRepository);

    alice = user(1L, "a@x.com", "Alice");
    tech = category(1L, "Technology", "technology");
    db = category(2L, "Database", "database");
  }

  @Nested
  @DisplayName("게시글 생성")
  class CreateTest {

    @Test
    @DisplayName("작성자가 없으면 UserNotFoundException이고 저장하지 않는다")
    void unknownAuthor() {
      given(userRepository.findById(99L)).willReturn(Optional.empty());

      assertThatThrownBy(() -> postService.create("제목", null, null, 99L))
          .isInstanceOf(UserNotFoundException.class);
      verify(postRepository, never()).save(any());
    }

    @Test
    @DisplayName("published를 생략하면 비공개로 생성된다")
    void defaultUnpublished() {
      given(userRepository.findById(1L)).willReturn(Optional.of(alice));
      given(postRepository.save(any(Post.class)))
          .willAnswer(inv -> withId(inv.getArgument(0, Post.class), 10L));

      PostResponse response = postService.create("제목", "본문", null, 1L);

      assertThat(response.published()).isFalse();
      assertThat(response.author().email()).isEqualTo("a@x.com");
      assertThat(response.categories()).isNull();
    }

    @Test
    @DisplayName("중복된 categoryId는 하나로 합쳐 연결한다")
    void collapsesDuplicateCategoryIds() {
      given(userRepository.findById(1L)).willReturn(Optional.of(alice));
      given(categoryRepository.findAllById(any())).willReturn(List.of(tech, db));
      given(postRepository.save(any(Post.class)))
          .willAnswer(inv -> withId(inv.getArgument(0, Post.class), 10L));

      PostResponse response =
          postService.createWithCategories("제목", null, true, 1L, List.of(1L, 2L, 1L));

      assertThat(response.categories())
          .extracting(CategoryResponse::slug)
          .containsExactly("technology", "database");
    }

    @Test
    @DisplayName("없는 카테고리가 섞여 있으면 CategoryNotFoundException이고 저장하지 않는다")
    void unknownCategoryWritesNothing() {
      given(userRepository.findById(1L)).willReturn(Optional.of(alice));
      given(categoryRepository.findAllById(any())).willReturn(List.of(tech));

      assertThatThrownBy(
              () -> postService.createWithCategories("제목", null, true, 1L, List.of(1L, 77L)))
          .isInstanceOf(CategoryNotFoundException.class)
          .hasMessageContaining("77");
      verify(postRepository, never()).save(any());
    }
  }

  @Nested
  @DisplayName("카테고리 연결")
  class CategoryLinkTest {

    @Test
    @DisplayName("이미 연결된 카테고리는 건너뛰고 나머지만 저장한다")
    void skipsExistingLinks() {
      Post post = post(10L, alice, "제목");
      post.addCategory(tech);
      given(postRepository.findById(10L)).willReturn(Optional.of(post));
      given(postRepository.findDetailById(10L)).willReturn(Optional.of(post));
      given(categoryRepository.findAllById(any())).willReturn(List.of(tech, db));

      postService.addCategories(10L, List.of(1L, 2L));

      ArgumentCaptor<PostCategory> saved = ArgumentCaptor.forClass(PostCategory.class);
      verify(postCategoryRepository, times(1)).save(saved.capture());
      assertThat(saved.getValue().getCategory()).isSameAs(db);
    }

    @Test
    @DisplayName("모두 연결되어 있으면 아무것도 저장하지 않는다")
    void allLinkedIsNoop() {
      Post post = post(10L, alice, "제목");
      post.addCategory(tech);
      given(postRepository.findById(10L)).willReturn(Optional.of(post));
      given(postRepository.findDetailById(10L)).willReturn(Optional.of(post));
      given(categoryRepository.findAllById(any())).willReturn(List.of(tech));

      postService.addCategories(10L, List.of(1L));

      verify(postCategoryRepository, never()).save(any());
    }

    @Test
    @DisplayName("없는 게시글의 연결 해제는 PostNotFoundException")
    void removeCategoryMissingPost() {
      given(postRepository.existsById(99L)).willReturn(false);

      assertThatThrownBy(() -> postService.removeCategory(99L, 1L))
          .isInstanceOf(PostNotFoundException.class);
      verify(postCategoryRepository, never()).deleteByPostIdAndCategoryId(anyLong(), anyLong());
    }

    @Test
    @DisplayName("연결이 없어도 해제는 성공하고 게시글을 반환한다")
    void removeAbsentLink() {
      Post post = post(10L, alice, "제목");
      given(postRepository.existsById(10L)).willReturn(true);
      given(postCategoryRepository.deleteByPostIdAndCategoryId(10L, 5L)).willReturn(0);
      given(postRepository.findDetailById(10L)).willReturn(Optional.of(post));

      PostResponse response = postService.removeCategory(10L, 5L);

      assertThat(response.id()).isEqualTo(10L);
      assertThat(response.categories()).isEmpty();
    }
  }

  @Test
  @DisplayName("댓글 작성 시 게시글이 없으면 PostNotFoundException")
  void addCommentMissingPost() {
    given(postRepository.findById(99L)).willReturn(Optional.empty());

    assertThatThrownBy(() -> postService.addComment(99L, "댓글", 1L))
        .isInstanceOf(PostNotFoundException.class);
    verify(commentRepository, never()).save(any());
  }

  @Test
  @DisplayName("통계의 author는 이름이 없으면 이메일을 사용한다")
  void statsAuthorFallsBackToEmail() {
    User anonymous = user(2L, "anon@x.com", null);
    Post post = post(10L, anonymous, "제목");
    post.addCategory(category(1L, "Tech", "tech"));
    post.addCategory(category(2L, "Java", "java"));
    for (long i = 1; i <= 3; i++) {
      comment(i, post, anonymous, "댓글 " + i);
    }
    given(postRepository.findDetailById(10L)).willReturn(Optional.of(post));

    PostStatsResponse stats = postService.getPostStats(10L);

    assertThat(stats.post().title()).isEqualTo("제목");
    assertThat(stats.stats().totalComments()).isEqualTo(3L);
    assertThat(stats.stats().totalCategories()).isEqualTo(2L);
    assertThat(stats.stats().author()).isEqualTo("anon@x.com");
    verify(commentRepository, never()).countByPostId(any());
    verify(postCategoryRepository, never()).countByPostId(any());
  }
}
