package blog.relations.controller;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import blog.relations.dto.category.CategoryResponse;
import blog.relations.dto.post.PostResponse;
import blog.relations.error.exception.CategoryNotFoundException;
import blog.relations.global.error.GlobalExceptionHandler;
import blog.relations.service.PostService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("PostController 단위 테스트")
class PostControllerUnitTest {

  @Mock private PostService postService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PostController(postService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  @DisplayName("title 누락 → 400 + C001")
  void create_missingTitle_returns400() throws Exception {
    mockMvc
        .perform(
            post("/posts").contentType(MediaType.APPLICATION_JSON).content("{\"authorId\":1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("title"));

    verifyNoInteractions(postService);
  }

  @Test
  @DisplayName("content가 10000자를 넘으면 DB까지 가지 않고 400 + 필드 에러")
  void create_contentTooLong_returns400() throws Exception {
    String content = "x".repeat(10_001);

    mockMvc
        .perform(
            post("/posts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"글\",\"authorId\":1,\"content\":\"" + content + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("C001"))
        .andExpect(jsonPath("$.errors[0].field").value("content"));

    verifyNoInteractions(postService);
  }

  @Test
  @DisplayName("PATCH: 공백 title → 400")
  void update_blankTitle_returns400() throws Exception {
    mockMvc
        .perform(
            patch("/posts/1").contentType(MediaType.APPLICATION_JSON).content("{\"title\":\"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("title"));

    verifyNoInteractions(postService);
  }

  @Test
  @DisplayName("빈 categoryIds → 400")
  void createWithCategories_empty_returns400() throws Exception {
    mockMvc
        .perform(
            post("/posts/with-categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"글\",\"authorId\":1,\"categoryIds\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].field").value("categoryIds"));
  }

  @Test
  @DisplayName("없는 카테고리 연결 → 404 + C004")
  void addCategories_unknownCategory_returns404() throws Exception {
    given(postService.addCategories(1L, List.of(77L)))
        .willThrow(new CategoryNotFoundException(77L));

    mockMvc
        .perform(
            post("/posts/1/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"categoryIds\":[77]}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("C004"));
  }

  @Test
  @DisplayName("카테고리 연결 해제 → 200 + 남은 카테고리")
  void removeCategory_returns200() throws Exception {
    CategoryResponse db = new CategoryResponse(2L, "Database", "database", null, null, null);
    given(postService.removeCategory(1L, 1L))
        .willReturn(
            PostResponse.builder()
                .id(1L)
                .title("글")
                .authorId(1L)
                .categories(List.of(db))
                .comments(List.of())
                .build());

    mockMvc
        .perform(delete("/posts/1/categories/1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.categories.length()").value(1))
        .andExpect(jsonPath("$.data.categories[0].id").value(2));
  }
}
