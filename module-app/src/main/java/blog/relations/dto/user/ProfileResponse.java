package blog.relations.dto.user;

import blog.relations.domain.Profile;
import java.time.LocalDateTime;

public record ProfileResponse(
    Long id,
    String bio,
    String avatar,
    String website,
    Long userId,
    LocalDateTime createdAt,
    LocalDateTime updatedAt) {

  public static ProfileResponse from(Profile profile) {
    return new ProfileResponse(
        profile.getId(),
        profile.getBio(),
        profile.getAvatar(),
        profile.getWebsite(),
        profile.getUser().getId(),
        profile.getCreatedAt(),
        profile.getUpdatedAt());
  }
}
