package blog.relations.controller.dto.post;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

public record AddCategoriesRequest(
    @NotEmpty(message = "categoryIds는 비어 있을 수 없습니다")
        List<@NotNull @Positive(message = "categoryId는 양수여야 합니다") Long> categoryIds) {}
