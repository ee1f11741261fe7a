package blog.relations.controller.dto.post;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * 게시글 생성 요청
 *
 * @param published 생략 시 false
 */
public record CreatePostRequest(
    @NotBlank(message = "title은 필수입니다") @Size(max = 255, message = "title은 255자 이하여야 합니다")
        String title,
    @Size(max = 10000, message = "content는 10000자 이하여야 합니다") String content,
    Boolean published,
    @NotNull(message = "authorId는 필수입니다") @Positive(message = "authorId는 양수여야 합니다")
        Long authorId) {}
