package blog.relations.controller;

import blog.relations.controller.dto.category.CreateCategoryRequest;
import blog.relations.controller.dto.category.UpdateCategoryRequest;
import blog.relations.dto.category.CategoryResponse;
import blog.relations.dto.category.CategoryStatsResponse;
import blog.relations.dto.category.PopularCategoryResponse;
import blog.relations.global.response.ApiResponse;
import blog.relations.service.CategoryService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categories")
@RequiredArgsConstructor
public class CategoryController {

  private final CategoryService categoryService;

  @PostMapping
  public ResponseEntity<ApiResponse<CategoryResponse>> create(
      @Valid @RequestBody CreateCategoryRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.success(categoryService.create(request.name(), request.slug())));
  }

  @GetMapping
  public ResponseEntity<ApiResponse<List<CategoryResponse>>> findAll(
      @RequestParam(defaultValue = "false") boolean includePosts) {
    return ResponseEntity.ok(ApiResponse.success(categoryService.findAll(includePosts)));
  }

  /**
   * 인기 카테고리
   *
   * @param limit 최대 개수 (기본 10, 1~100)
   */
  @GetMapping("/popular")
  public ResponseEntity<ApiResponse<List<PopularCategoryResponse>>> getPopular(
      @RequestParam(required = false) Integer limit) {
    return ResponseEntity.ok(ApiResponse.success(categoryService.getPopularCategories(limit)));
  }

  @GetMapping("/slug/{slug}")
  public ResponseEntity<ApiResponse<CategoryResponse>> findBySlug(@PathVariable String slug) {
    return ResponseEntity.ok(ApiResponse.success(categoryService.findBySlug(slug)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ApiResponse<CategoryResponse>> findOne(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(categoryService.findOne(id)));
  }

  @GetMapping("/{id}/stats")
  public ResponseEntity<ApiResponse<CategoryStatsResponse>> getStats(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(categoryService.getCategoryStats(id)));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ApiResponse<CategoryResponse>> update(
      @PathVariable Long id, @Valid @RequestBody UpdateCategoryRequest request) {
    return ResponseEntity.ok(
        ApiResponse.success(categoryService.update(id, request.name(), request.slug())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<ApiResponse<CategoryResponse>> remove(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(categoryService.remove(id)));
  }
}
