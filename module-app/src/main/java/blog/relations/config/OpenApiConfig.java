package blog.relations.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Blog Relations API",
            version = "1.0.0",
            description =
                "관계형 모델링 예제 API\n\n"
                    + "## 관계\n"
                    + "- **1:1** User - Profile\n"
                    + "- **1:N** User - Post, Post - Comment\n"
                    + "- **N:M** Post - Category (post_categories 조인 테이블)",
            license = @License(name = "MIT License", url = "https://opensource.org/licenses/MIT")),
    servers = @Server(url = "http://localhost:3000", description = "Local Development"))
public class OpenApiConfig {}
