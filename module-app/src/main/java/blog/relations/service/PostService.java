package blog.relations.service;

import static blog.relations.infrastructure.persistence.UniqueConstraintViolations.isUniqueViolation;

import blog.relations.domain.Category;
import blog.relations.domain.Comment;
import blog.relations.domain.Post;
import blog.relations.domain.User;
import blog.relations.dto.comment.CommentResponse;
import blog.relations.dto.post.PostResponse;
import blog.relations.dto.post.PostStatsResponse;
import blog.relations.error.exception.CategoryNotFoundException;
import blog.relations.error.exception.DuplicateResourceException;
import blog.relations.error.exception.PostNotFoundException;
import blog.relations.error.exception.UserNotFoundException;
import blog.relations.infrastructure.persistence.repository.CategoryRepository;
import blog.relations.infrastructure.persistence.repository.CommentRepository;
import blog.relations.infrastructure.persistence.repository.PostCategoryRepository;
import blog.relations.infrastructure.persistence.repository.PostRepository;
import blog.relations.infrastructure.persistence.repository.UserRepository;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 게시글 서비스
 *
 * <h3>N:M 카테고리 연결</h3>
 *
 * <ul>
 *   <li>요청의 중복 categoryId는 하나로 합칩니다.
 *   <li>존재하지 않는 카테고리가 하나라도 있으면 아무것도 저장하지 않고 404를 반환합니다.
 *   <li>{@code addCategories}는 이미 연결된 쌍을 건너뜁니다. 동시 요청은 유니크 제약이 막습니다.
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PostService {

  private final PostRepository postRepository;
  private final UserRepository userRepository;
  private final CategoryRepository categoryRepository;
  private final PostCategoryRepository postCategoryRepository;
  private final CommentRepository commentRepository;

  @Transactional
  public PostResponse create(String title, String content, Boolean published, Long authorId) {
    User author = getUser(authorId);
    Post post =
        postRepository.save(new Post(author, title, content, Boolean.TRUE.equals(published)));
    log.info("[PostService] 게시글 생성: id={}, authorId={}", post.getId(), authorId);
    return PostResponse.withAuthor(post);
  }

  @Transactional
  public PostResponse createWithCategories(
      String title, String content, Boolean published, Long authorId, List<Long> categoryIds) {
    User author = getUser(authorId);
    List<Category> categories = getCategories(categoryIds);

    Post post = new Post(author, title, content, Boolean.TRUE.equals(published));
    categories.forEach(post::addCategory);
    post = postRepository.save(post);
    log.info(
        "[PostService] 게시글+카테고리 생성: id={}, categories={}", post.getId(), categories.size());
    return PostResponse.withAuthorAndCategories(post);
  }

  public List<PostResponse> findAll(Boolean published, Long authorId, boolean includeRelations) {
    Function<Post, PostResponse> mapper =
        includeRelations ? PostResponse::withRelations : PostResponse::from;
    return postRepository.search(published, authorId).stream().map(mapper).toList();
  }

  public PostResponse findOne(Long id) {
    Post post = postRepository.findDetailById(id).orElseThrow(() -> new PostNotFoundException(id));
    return PostResponse.detail(post);
  }

  @Transactional
  public PostResponse update(Long id, String title, String content, Boolean published) {
    Post post = getPost(id);
    post.update(title, content, published);
    postRepository.flush();
    log.info("[PostService] 게시글 수정: id={}", id);
    return PostResponse.withAuthorAndCategories(post);
  }

  /**
   * 카테고리 연결 추가
   *
   * <p>이미 연결된 카테고리는 건너뛰므로 같은 요청을 반복해도 조인 행은 늘지 않습니다.
   */
  @Transactional
  public PostResponse addCategories(Long postId, List<Long> categoryIds) {
    Post post = getPost(postId);
    List<Category> categories = getCategories(categoryIds);
    Set<Long> linked =
        post.getCategoryList().stream().map(Category::getId).collect(Collectors.toSet());

    List<Category> missing =
        categories.stream().filter(category -> !linked.contains(category.getId())).toList();
    try {
      missing.forEach(category -> postCategoryRepository.save(post.addCategory(category)));
      postCategoryRepository.flush();
    } catch (DataIntegrityViolationException e) {
      if (!isUniqueViolation(e)) {
        throw e;
      }
      throw new DuplicateResourceException("post_categories", postId + "-" + categoryIds, e);
    }
    log.info(
        "[PostService] 카테고리 연결: postId={}, added={}, skipped={}",
        postId,
        missing.size(),
        categories.size() - missing.size());
    return findOne(postId);
  }

  /** 연결이 없으면 아무것도 하지 않습니다. 게시글은 존재해야 합니다. */
  @Transactional
  public PostResponse removeCategory(Long postId, Long categoryId) {
    if (!postRepository.existsById(postId)) {
      throw new PostNotFoundException(postId);
    }
    int deleted = postCategoryRepository.deleteByPostIdAndCategoryId(postId, categoryId);
    log.info(
        "[PostService] 카테고리 연결 해제: postId={}, categoryId={}, deleted={}",
        postId,
        categoryId,
        deleted);
    return findOne(postId);
  }

  @Transactional
  public CommentResponse addComment(Long postId, String content, Long authorId) {
    Post post = getPost(postId);
    User author = getUser(authorId);
    Comment comment = commentRepository.save(new Comment(post, author, content));
    log.info("[PostService] 댓글 작성: postId={}, commentId={}", postId, comment.getId());
    return CommentResponse.withAuthorAndPost(comment);
  }

  @Transactional
  public PostResponse remove(Long id) {
    Post post = getPost(id);
    PostResponse removed = PostResponse.from(post);
    postRepository.delete(post);
    log.info("[PostService] 게시글 삭제: id={}", id);
    return removed;
  }

  /** 카테고리에 연결된 게시글 (작성자, 카테고리 포함) */
  public List<PostResponse> findByCategory(Long categoryId) {
    return postRepository.findAllLinkedToCategory(categoryId).stream()
        .map(PostResponse::withAuthorAndCategories)
        .toList();
  }

  /** 상세 조회와 같은 집합(작성자, 카테고리, 댓글)에서 집계하며 별도 count 쿼리는 없습니다. */
  public PostStatsResponse getPostStats(Long id) {
    Post post = postRepository.findDetailById(id).orElseThrow(() -> new PostNotFoundException(id));
    return new PostStatsResponse(
        new PostStatsResponse.PostSummary(post.getId(), post.getTitle(), post.isPublished()),
        new PostStatsResponse.Stats(
            post.getComments().size(),
            post.getCategories().size(),
            post.getAuthor().getDisplayName()));
  }

  private Post getPost(Long id) {
    return postRepository.findById(id).orElseThrow(() -> new PostNotFoundException(id));
  }

  private User getUser(Long id) {
    return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
  }

  /**
   * 요청 순서를 유지한 채 중복을 제거하고 카테고리를 조회합니다.
   *
   * @throws CategoryNotFoundException 하나라도 존재하지 않는 경우 (첫 번째 누락 ID)
   */
  private List<Category> getCategories(Collection<Long> categoryIds) {
    Set<Long> ids = new LinkedHashSet<>(categoryIds);
    Map<Long, Category> found =
        categoryRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(Category::getId, Function.identity()));
    return ids.stream()
        .map(
            id -> {
              Category category = found.get(id);
              if (category == null) {
                throw new CategoryNotFoundException(id);
              }
              return category;
            })
        .toList();
  }
}
