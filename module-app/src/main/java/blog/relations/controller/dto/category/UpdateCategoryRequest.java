package blog.relations.controller.dto.category;

import blog.relations.controller.dto.InputPatterns;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateCategoryRequest(
    @Pattern(regexp = InputPatterns.NOT_BLANK, message = "name은 비어 있을 수 없습니다")
        @Size(max = 100, message = "name은 100자 이하여야 합니다")
        String name,
    @Size(max = 100, message = "slug는 100자 이하여야 합니다")
        @Pattern(regexp = CategorySlug.PATTERN, message = CategorySlug.MESSAGE)
        String slug) {}
