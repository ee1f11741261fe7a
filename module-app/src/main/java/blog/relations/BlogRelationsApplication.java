package blog.relations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BlogRelationsApplication {

  public static void main(String[] args) {
    SpringApplication.run(BlogRelationsApplication.class, args);
  }
}
