package blog.relations.dto.user;

public record UserStatsResponse(UserSummary user, Stats stats) {

  public record UserSummary(Long id, String email, String name) {}

  public record Stats(int totalPosts, int totalComments, boolean hasProfile) {}
}
