package blog.relations.controller.dto.user;

import blog.relations.controller.dto.InputPatterns;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

/**
 * 프로필 입력 (생성 시 중첩 객체, PATCH /users/{id}/profile 본문 공용)
 *
 * <p>모든 필드는 선택이며 null이면 기존 값을 유지합니다. 빈 문자열은 URL로 인정하지 않습니다.
 */
public record ProfileRequest(
    @Size(min = 10, max = 1000, message = "bio는 10자 이상 1000자 이하여야 합니다") String bio,
    @Pattern(regexp = InputPatterns.NOT_BLANK, message = "avatar는 비어 있을 수 없습니다")
        @URL(message = "avatar는 URL 형식이어야 합니다")
        @Size(max = 2048, message = "avatar는 2048자 이하여야 합니다")
        String avatar,
    @Pattern(regexp = InputPatterns.NOT_BLANK, message = "website는 비어 있을 수 없습니다")
        @URL(message = "website는 URL 형식이어야 합니다")
        @Size(max = 2048, message = "website는 2048자 이하여야 합니다")
        String website) {}
