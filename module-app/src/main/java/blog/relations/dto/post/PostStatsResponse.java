package blog.relations.dto.post;

public record PostStatsResponse(PostSummary post, Stats stats) {

  public record PostSummary(Long id, String title, boolean published) {}

  /**
   * @param author 작성자 이름 (이름이 없으면 이메일)
   */
  public record Stats(long totalComments, long totalCategories, String author) {}
}
