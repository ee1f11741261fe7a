package blog.relations.controller.dto.post;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreatePostWithCategoriesRequest(
    @NotBlank(message = "title은 필수입니다") @Size(max = 255, message = "title은 255자 이하여야 합니다")
        String title,
    @Size(max = 10000, message = "content는 10000자 이하여야 합니다") String content,
    Boolean published,
    @NotNull(message = "authorId는 필수입니다") @Positive(message = "authorId는 양수여야 합니다")
        Long authorId,
    @NotEmpty(message = "categoryIds는 비어 있을 수 없습니다")
        List<@NotNull @Positive(message = "categoryId는 양수여야 합니다") Long> categoryIds) {}
