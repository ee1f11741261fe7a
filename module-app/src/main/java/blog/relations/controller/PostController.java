package blog.relations.controller;

import blog.relations.controller.dto.post.AddCategoriesRequest;
import blog.relations.controller.dto.post.AddCommentRequest;
import blog.relations.controller.dto.post.CreatePostRequest;
import blog.relations.controller.dto.post.CreatePostWithCategoriesRequest;
import blog.relations.controller.dto.post.UpdatePostRequest;
import blog.relations.dto.comment.CommentResponse;
import blog.relations.dto.post.PostResponse;
import blog.relations.dto.post.PostStatsResponse;
import blog.relations.global.response.ApiResponse;
import blog.relations.service.PostService;
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

/** 게시글 API (카테고리 연결과 댓글 작성 포함) */
@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
public class PostController {

  private final PostService postService;

  @PostMapping
  public ResponseEntity<ApiResponse<PostResponse>> create(
      @Valid @RequestBody CreatePostRequest request) {
    return created(
        postService.create(
            request.title(), request.content(), request.published(), request.authorId()));
  }

  @PostMapping("/with-categories")
  public ResponseEntity<ApiResponse<PostResponse>> createWithCategories(
      @Valid @RequestBody CreatePostWithCategoriesRequest request) {
    return created(
        postService.createWithCategories(
            request.title(),
            request.content(),
            request.published(),
            request.authorId(),
            request.categoryIds()));
  }

  @GetMapping
  public ResponseEntity<ApiResponse<List<PostResponse>>> findAll(
      @RequestParam(required = false) Boolean published,
      @RequestParam(required = false) Long authorId,
      @RequestParam(defaultValue = "false") boolean includeRelations) {
    return ResponseEntity.ok(
        ApiResponse.success(postService.findAll(published, authorId, includeRelations)));
  }

  @GetMapping("/by-category/{categoryId}")
  public ResponseEntity<ApiResponse<List<PostResponse>>> findByCategory(
      @PathVariable Long categoryId) {
    return ResponseEntity.ok(ApiResponse.success(postService.findByCategory(categoryId)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ApiResponse<PostResponse>> findOne(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(postService.findOne(id)));
  }

  @GetMapping("/{id}/stats")
  public ResponseEntity<ApiResponse<PostStatsResponse>> getStats(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(postService.getPostStats(id)));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ApiResponse<PostResponse>> update(
      @PathVariable Long id, @Valid @RequestBody UpdatePostRequest request) {
    return ResponseEntity.ok(
        ApiResponse.success(
            postService.update(id, request.title(), request.content(), request.published())));
  }

  @PostMapping("/{id}/categories")
  public ResponseEntity<ApiResponse<PostResponse>> addCategories(
      @PathVariable Long id, @Valid @RequestBody AddCategoriesRequest request) {
    return ResponseEntity.ok(
        ApiResponse.success(postService.addCategories(id, request.categoryIds())));
  }

  @DeleteMapping("/{id}/categories/{categoryId}")
  public ResponseEntity<ApiResponse<PostResponse>> removeCategory(
      @PathVariable Long id, @PathVariable Long categoryId) {
    return ResponseEntity.ok(ApiResponse.success(postService.removeCategory(id, categoryId)));
  }

  @PostMapping("/{id}/comments")
  public ResponseEntity<ApiResponse<CommentResponse>> addComment(
      @PathVariable Long id, @Valid @RequestBody AddCommentRequest request) {
    return created(postService.addComment(id, request.content(), request.authorId()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<ApiResponse<PostResponse>> remove(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(postService.remove(id)));
  }

  private static <T> ResponseEntity<ApiResponse<T>> created(T body) {
    return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(body));
  }
}
