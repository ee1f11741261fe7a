package blog.relations.controller.dto.comment;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateCommentRequest(
    @NotBlank(message = "content는 필수입니다") @Size(max = 2000, message = "content는 2000자 이하여야 합니다")
        String content,
    @NotNull(message = "postId는 필수입니다") @Positive(message = "postId는 양수여야 합니다") Long postId,
    @NotNull(message = "authorId는 필수입니다") @Positive(message = "authorId는 양수여야 합니다")
        Long authorId) {}
