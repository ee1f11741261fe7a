package blog.relations.controller.dto.category;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateCategoryRequest(
    @NotBlank(message = "name은 필수입니다") @Size(max = 100, message = "name은 100자 이하여야 합니다")
        String name,
    @NotBlank(message = "slug는 필수입니다")
        @Size(max = 100, message = "slug는 100자 이하여야 합니다")
        @Pattern(regexp = CategorySlug.PATTERN, message = CategorySlug.MESSAGE)
        String slug) {}
