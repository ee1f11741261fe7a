package blog.relations.service;

import static blog.relations.infrastructure.persistence.UniqueConstraintViolations.isUniqueViolation;

import blog.relations.domain.Profile;
import blog.relations.domain.User;
import blog.relations.dto.user.ProfileResponse;
import blog.relations.dto.user.UserResponse;
import blog.relations.dto.user.UserStatsResponse;
import blog.relations.error.exception.DuplicateResourceException;
import blog.relations.error.exception.UserNotFoundException;
import blog.relations.infrastructure.persistence.repository.ProfileRepository;
import blog.relations.infrastructure.persistence.repository.UserRepository;
import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용자 / 프로필 서비스
 *
 * <h3>관계 처리</h3>
 *
 * <ul>
 *   <li>프로필은 사용자당 최대 1개이며 {@code updateProfile}은 upsert로 동작합니다.
 *   <li>사용자 삭제는 단일 DELETE이며 프로필, 게시글, 댓글은 DB FK cascade로 삭제됩니다.
 *   <li>이메일 중복은 유니크 제약 위반으로 감지하여 409로 변환합니다.
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

  static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

  private final UserRepository userRepository;
  private final ProfileRepository profileRepository;

  @Transactional
  public UserResponse create(String email, String name) {
    User user = saveUnique(new User(email, name), email);
    log.info("[UserService] 사용자 생성: id={}", user.getId());
    return UserResponse.from(user);
  }

  /**
   * 사용자와 프로필을 한 트랜잭션에서 생성
   *
   * <p>이메일이 이미 사용 중이면 어떤 행도 남지 않습니다.
   */
  @Transactional
  public UserResponse createWithProfile(
      String email, String name, String bio, String avatar, String website) {
    User user = saveUnique(new User(email, name), email);
    profileRepository.save(new Profile(user, bio, avatar, website));
    log.info("[UserService] 사용자+프로필 생성: id={}", user.getId());
    return UserResponse.withProfile(user);
  }

  public List<UserResponse> findAll(boolean includeRelations) {
    Function<User, UserResponse> mapper =
        includeRelations ? UserResponse::withRelations : UserResponse::from;
    return userRepository.findAll(NEWEST_FIRST).stream().map(mapper).toList();
  }

  public UserResponse findOne(Long id) {
    return UserResponse.detail(getUser(id));
  }

  public UserResponse findByEmail(String email) {
    User user =
        userRepository.findByEmail(email).orElseThrow(() -> UserNotFoundException.byEmail(email));
    return UserResponse.withProfileAndPosts(user);
  }

  @Transactional
  public UserResponse update(Long id, String email, String name) {
    User user = getUser(id);
    user.update(email, name);
    try {
      userRepository.flush();
    } catch (DataIntegrityViolationException e) {
      if (!isUniqueViolation(e)) {
        throw e;
      }
      throw new DuplicateResourceException("email", email, e);
    }
    log.info("[UserService] 사용자 수정: id={}", id);
    return UserResponse.withProfile(user);
  }

  /**
   * 프로필 upsert
   *
   * <p>프로필이 없으면 생성하고, 있으면 null이 아닌 필드만 갱신합니다. 동시 생성으로 유니크 제약에 걸리면 409를 반환합니다.
   */
  @Transactional
  public ProfileResponse updateProfile(Long userId, String bio, String avatar, String website) {
    User user = getUser(userId);
    Profile profile =
        profileRepository
            .findByUserId(userId)
            .map(
                existing -> {
                  existing.update(bio, avatar, website);
                  return existing;
                })
            .orElseGet(() -> new Profile(user, bio, avatar, website));
    try {
      profile = profileRepository.saveAndFlush(profile);
    } catch (DataIntegrityViolationException e) {
      if (!isUniqueViolation(e)) {
        throw e;
      }
      throw new DuplicateResourceException("profile.userId", userId, e);
    }
    log.info("[UserService] 프로필 저장: userId={}, profileId={}", userId, profile.getId());
    return ProfileResponse.from(profile);
  }

  @Transactional
  public UserResponse remove(Long id) {
    User user = getUser(id);
    UserResponse removed = UserResponse.from(user);
    userRepository.delete(user);
    log.info("[UserService] 사용자 삭제: id={}", id);
    return removed;
  }

  public UserStatsResponse getUserStats(Long id) {
    User user = getUser(id);
    return new UserStatsResponse(
        new UserStatsResponse.UserSummary(user.getId(), user.getEmail(), user.getName()),
        new UserStatsResponse.Stats(
            user.getPosts().size(), user.getComments().size(), user.hasProfile()));
  }

  private User getUser(Long id) {
    return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
  }

  private User saveUnique(User user, String email) {
    try {
      return userRepository.saveAndFlush(user);
    } catch (DataIntegrityViolationException e) {
      if (!isUniqueViolation(e)) {
        throw e;
      }
      throw new DuplicateResourceException("email", email, e);
    }
  }
}
