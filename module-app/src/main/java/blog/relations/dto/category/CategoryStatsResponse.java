package blog.relations.dto.category;

public record CategoryStatsResponse(CategorySummary category, Stats stats) {

  public record CategorySummary(Long id, String name, String slug) {}

  public record Stats(int totalPosts) {}
}
