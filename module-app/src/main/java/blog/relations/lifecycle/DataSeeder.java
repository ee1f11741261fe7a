package blog.relations.lifecycle;

import blog.relations.dto.category.CategoryResponse;
import blog.relations.dto.post.PostResponse;
import blog.relations.dto.user.UserResponse;
import blog.relations.infrastructure.persistence.DatabaseCleaner;
import blog.relations.service.CategoryService;
import blog.relations.service.PostService;
import blog.relations.service.UserService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 예제 데이터 투입
 *
 * <p>모든 테이블을 비운 뒤 카테고리 5개, 사용자 3명(2명은 프로필 보유), 게시글 4개, 댓글을 생성합니다. 모든 쓰기는 서비스 계층을 거칩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true")
public class DataSeeder implements ApplicationRunner {

  private final DatabaseCleaner databaseCleaner;
  private final UserService userService;
  private final CategoryService categoryService;
  private final PostService postService;

  @Override
  public void run(ApplicationArguments args) {
    log.info("[Seed] 시드 데이터 투입 시작");
    databaseCleaner.cleanDatabase();

    categoryService.create("Technology", "technology");
    CategoryResponse programming = categoryService.create("Programming", "programming");
    CategoryResponse webDevelopment =
        categoryService.create("Web Development", "web-development");
    CategoryResponse database = categoryService.create("Database", "database");
    CategoryResponse tutorial = categoryService.create("Tutorial", "tutorial");

    UserResponse john =
        userService.createWithProfile(
            "john@example.com",
            "John Doe",
            "Software developer passionate about clean code and relational databases.",
            "https://i.pravatar.cc/150?u=john",
            "https://johndoe.dev");
    UserResponse jane =
        userService.createWithProfile(
            "jane@example.com",
            "Jane Smith",
            "Tech writer and backend engineer who loves teaching data modeling.",
            "https://i.pravatar.cc/150?u=jane",
            "https://janesmith.io");
    UserResponse bob = userService.create("bob@example.com", "Bob Johnson");

    PostResponse gettingStarted =
        postService.createWithCategories(
            "Getting Started with JPA",
            "Learn how to map entities and relationships with JPA and Hibernate.",
            true,
            john.id(),
            List.of(programming.id(), database.id(), tutorial.id()));
    PostResponse relationships =
        postService.createWithCategories(
            "Understanding Database Relationships",
            "One-to-one, one-to-many and many-to-many relationships explained.",
            true,
            jane.id(),
            List.of(database.id(), tutorial.id()));
    PostResponse restApis =
        postService.createWithCategories(
            "Building REST APIs with Spring Boot",
            "A step-by-step guide to building a REST API backed by a relational database.",
            true,
            john.id(),
            List.of(programming.id(), webDevelopment.id(), tutorial.id()));
    postService.createWithCategories(
        "Draft: Advanced Java Patterns",
        "Work in progress.",
        false,
        jane.id(),
        List.of(programming.id()));

    postService.addComment(gettingStarted.id(), "Great introduction, thanks!", jane.id());
    postService.addComment(gettingStarted.id(), "Very helpful for beginners.", bob.id());
    postService.addComment(
        relationships.id(), "The many-to-many section cleared things up.", john.id());
    postService.addComment(restApis.id(), "Looking forward to the next part.", bob.id());

    log.info("[Seed] 시드 데이터 투입 완료: categories=5, users=3, posts=4, comments=4");
  }
}
