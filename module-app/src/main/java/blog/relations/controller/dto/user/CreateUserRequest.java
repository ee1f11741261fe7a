package blog.relations.controller.dto.user;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
    @NotBlank(message = "email은 필수입니다")
        @Email(message = "email 형식이 올바르지 않습니다")
        @Size(max = 255, message = "email은 255자 이하여야 합니다")
        String email,
    @Size(min = 2, max = 255, message = "name은 2자 이상 255자 이하여야 합니다") String name) {}
