package blog.relations.controller.dto.post;

import blog.relations.controller.dto.InputPatterns;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** null인 필드는 변경하지 않습니다. */
public record UpdatePostRequest(
    @Pattern(regexp = InputPatterns.NOT_BLANK, message = "title은 비어 있을 수 없습니다")
        @Size(max = 255, message = "title은 255자 이하여야 합니다")
        String title,
    @Size(max = 10000, message = "content는 10000자 이하여야 합니다") String content,
    Boolean published) {}
