package tech.yump.multipart;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import tech.yump.multipart.cli.MultipartCommandRunner;
import tech.yump.multipart.config.MultipartProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(MultipartProperties.class)
public class MultipartSecretsApplication {

  public static void main(String[] args) {
    boolean commandLine = MultipartCommandRunner.isCommandLineInvocation(args);
    SpringApplication application = new SpringApplication(MultipartSecretsApplication.class);
    if (commandLine) {
      application.setWebApplicationType(WebApplicationType.NONE);
      application.setBannerMode(Banner.Mode.OFF);
    }

    ConfigurableApplicationContext context = application.run(args);
    if (commandLine) {
      System.exit(SpringApplication.exit(context));
    }
    log.info(">>> Multipart Secrets Application Started <<<");
  }
}
