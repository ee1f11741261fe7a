package blog.relations.controller;

import blog.relations.controller.dto.comment.CreateCommentRequest;
import blog.relations.controller.dto.comment.UpdateCommentRequest;
import blog.relations.dto.comment.CommentResponse;
import blog.relations.global.response.ApiResponse;
import blog.relations.service.CommentService;
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
@RequestMapping("/comments")
@RequiredArgsConstructor
public class CommentController {

  private final CommentService commentService;

  @PostMapping
  public ResponseEntity<ApiResponse<CommentResponse>> create(
      @Valid @RequestBody CreateCommentRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            ApiResponse.success(
                commentService.create(request.content(), request.postId(), request.authorId())));
  }

  @GetMapping
  public ResponseEntity<ApiResponse<List<CommentResponse>>> findAll(
      @RequestParam(required = false) Long postId,
      @RequestParam(required = false) Long authorId) {
    return ResponseEntity.ok(ApiResponse.success(commentService.findAll(postId, authorId)));
  }

  @GetMapping("/by-post/{postId}")
  public ResponseEntity<ApiResponse<List<CommentResponse>>> findByPost(@PathVariable Long postId) {
    return ResponseEntity.ok(ApiResponse.success(commentService.findByPost(postId)));
  }

  @GetMapping("/by-user/{userId}")
  public ResponseEntity<ApiResponse<List<CommentResponse>>> findByUser(@PathVariable Long userId) {
    return ResponseEntity.ok(ApiResponse.success(commentService.findByUser(userId)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ApiResponse<CommentResponse>> findOne(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(commentService.findOne(id)));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ApiResponse<CommentResponse>> update(
      @PathVariable Long id, @Valid @RequestBody UpdateCommentRequest request) {
    return ResponseEntity.ok(ApiResponse.success(commentService.update(id, request.content())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<ApiResponse<CommentResponse>> remove(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(commentService.remove(id)));
  }
}
