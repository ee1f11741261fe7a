package blog.relations.controller;

import blog.relations.controller.dto.user.CreateUserRequest;
import blog.relations.controller.dto.user.CreateUserWithProfileRequest;
import blog.relations.controller.dto.user.ProfileRequest;
import blog.relations.controller.dto.user.UpdateUserRequest;
import blog.relations.dto.user.ProfileResponse;
import blog.relations.dto.user.UserResponse;
import blog.relations.dto.user.UserStatsResponse;
import blog.relations.global.response.ApiResponse;
import blog.relations.service.UserService;
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

/**
 * 사용자 API
 *
 * <p>엔드포인트:
 *
 * <ul>
 *   <li>POST /users, POST /users/with-profile - 생성 (201)
 *   <li>GET /users, GET /users/by-email, GET /users/{id}, GET /users/{id}/stats - 조회
 *   <li>PATCH /users/{id}, PATCH /users/{id}/profile - 수정 (프로필은 upsert)
 *   <li>DELETE /users/{id} - 삭제 (프로필, 게시글, 댓글 cascade)
 * </ul>
 */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

  private final UserService userService;

  @PostMapping
  public ResponseEntity<ApiResponse<UserResponse>> create(
      @Valid @RequestBody CreateUserRequest request) {
    return created(userService.create(request.email(), request.name()));
  }

  @PostMapping("/with-profile")
  public ResponseEntity<ApiResponse<UserResponse>> createWithProfile(
      @Valid @RequestBody CreateUserWithProfileRequest request) {
    ProfileRequest profile = request.profile();
    return created(
        userService.createWithProfile(
            request.email(),
            request.name(),
            profile.bio(),
            profile.avatar(),
            profile.website()));
  }

  @GetMapping
  public ResponseEntity<ApiResponse<List<UserResponse>>> findAll(
      @RequestParam(defaultValue = "false") boolean includeRelations) {
    return ResponseEntity.ok(ApiResponse.success(userService.findAll(includeRelations)));
  }

  @GetMapping("/by-email")
  public ResponseEntity<ApiResponse<UserResponse>> findByEmail(@RequestParam String email) {
    return ResponseEntity.ok(ApiResponse.success(userService.findByEmail(email)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ApiResponse<UserResponse>> findOne(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(userService.findOne(id)));
  }

  @GetMapping("/{id}/stats")
  public ResponseEntity<ApiResponse<UserStatsResponse>> getStats(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(userService.getUserStats(id)));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ApiResponse<UserResponse>> update(
      @PathVariable Long id, @Valid @RequestBody UpdateUserRequest request) {
    return ResponseEntity.ok(
        ApiResponse.success(userService.update(id, request.email(), request.name())));
  }

  @PatchMapping("/{id}/profile")
  public ResponseEntity<ApiResponse<ProfileResponse>> updateProfile(
      @PathVariable Long id, @Valid @RequestBody ProfileRequest request) {
    return ResponseEntity.ok(
        ApiResponse.success(
            userService.updateProfile(id, request.bio(), request.avatar(), request.website())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<ApiResponse<UserResponse>> remove(@PathVariable Long id) {
    return ResponseEntity.ok(ApiResponse.success(userService.remove(id)));
  }

  private static <T> ResponseEntity<ApiResponse<T>> created(T body) {
    return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(body));
  }
}
