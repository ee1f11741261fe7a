package blog.relations.service;

import static blog.relations.infrastructure.persistence.UniqueConstraintViolations.isUniqueViolation;

import blog.relations.domain.Category;
import blog.relations.dto.category.CategoryResponse;
import blog.relations.dto.category.CategoryStatsResponse;
import blog.relations.dto.category.PopularCategoryResponse;
import blog.relations.dto.post.PostResponse;
import blog.relations.error.exception.CategoryNotFoundException;
import blog.relations.error.exception.DuplicateResourceException;
import blog.relations.error.exception.InvalidInputException;
import blog.relations.infrastructure.persistence.repository.CategoryRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CategoryService {

  static final int DEFAULT_POPULAR_LIMIT = 10;
  static final int MAX_POPULAR_LIMIT = 100;

  private final CategoryRepository categoryRepository;

  @Transactional
  public CategoryResponse create(String name, String slug) {
    Category category = saveUnique(new Category(name, slug), name, slug);
    log.info("[CategoryService] 카테고리 생성: id={}, slug={}", category.getId(), slug);
    return CategoryResponse.from(category);
  }

  /** 이름 오름차순 */
  public List<CategoryResponse> findAll(boolean includePosts) {
    return categoryRepository.findAll(Sort.by("name")).stream()
        .map(
            category ->
                includePosts
                    ? CategoryResponse.withPosts(category, PostResponse::withAuthor)
                    : CategoryResponse.from(category))
        .toList();
  }

  public CategoryResponse findOne(Long id) {
    return CategoryResponse.withPosts(getCategory(id), PostResponse::withAuthorAndComments);
  }

  public CategoryResponse findBySlug(String slug) {
    Category category =
        categoryRepository
            .findBySlug(slug)
            .orElseThrow(() -> CategoryNotFoundException.bySlug(slug));
    return CategoryResponse.withPosts(category, PostResponse::withAuthor);
  }

  @Transactional
  public CategoryResponse update(Long id, String name, String slug) {
    Category category = getCategory(id);
    category.update(name, slug);
    try {
      categoryRepository.flush();
    } catch (DataIntegrityViolationException e) {
      if (!isUniqueViolation(e)) {
        throw e;
      }
      throw new DuplicateResourceException("name/slug", name + "/" + slug, e);
    }
    log.info("[CategoryService] 카테고리 수정: id={}", id);
    return CategoryResponse.from(category);
  }

  /** 조인 행은 DB cascade로 삭제되고 게시글은 유지됩니다. */
  @Transactional
  public CategoryResponse remove(Long id) {
    Category category = getCategory(id);
    CategoryResponse removed = CategoryResponse.from(category);
    categoryRepository.delete(category);
    log.info("[CategoryService] 카테고리 삭제: id={}", id);
    return removed;
  }

  public CategoryStatsResponse getCategoryStats(Long id) {
    Category category = getCategory(id);
    return new CategoryStatsResponse(
        new CategoryStatsResponse.CategorySummary(
            category.getId(), category.getName(), category.getSlug()),
        new CategoryStatsResponse.Stats(category.getPosts().size()));
  }

  /**
   * 인기 카테고리 조회
   *
   * @param limit 최대 개수 (null이면 10, 1~100)
   * @return 게시글 수 내림차순, 동률이면 id 오름차순
   */
  public List<PopularCategoryResponse> getPopularCategories(Integer limit) {
    int size = limit == null ? DEFAULT_POPULAR_LIMIT : limit;
    if (size < 1 || size > MAX_POPULAR_LIMIT) {
      throw new InvalidInputException(
          "limit은 1 이상 " + MAX_POPULAR_LIMIT + " 이하여야 합니다 (limit=" + size + ")");
    }
    return categoryRepository.findPopular(PageRequest.of(0, size)).stream()
        .map(PopularCategoryResponse::from)
        .toList();
  }

  private Category getCategory(Long id) {
    return categoryRepository.findById(id).orElseThrow(() -> new CategoryNotFoundException(id));
  }

  private Category saveUnique(Category category, String name, String slug) {
    try {
      return categoryRepository.saveAndFlush(category);
    } catch (DataIntegrityViolationException e) {
      if (!isUniqueViolation(e)) {
        throw e;
      }
      throw new DuplicateResourceException("name/slug", name + "/" + slug, e);
    }
  }
}
