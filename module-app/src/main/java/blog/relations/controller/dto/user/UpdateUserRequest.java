package blog.relations.controller.dto.user;

import blog.relations.controller.dto.InputPatterns;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** null인 필드는 변경하지 않습니다. 값이 있으면 생성 시와 같은 규칙으로 검증합니다. */
public record UpdateUserRequest(
    @Pattern(regexp = InputPatterns.NOT_BLANK, message = "email은 비어 있을 수 없습니다")
        @Email(message = "email 형식이 올바르지 않습니다")
        @Size(max = 255, message = "email은 255자 이하여야 합니다")
        String email,
    @Size(min = 2, max = 255, message = "name은 2자 이상 255자 이하여야 합니다") String name) {}
