package uk.ac.ebi.orthoviewer.ortholog_service.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  private final OrthoDataConfig orthoDataConfig;

  public WebMvcConfig(OrthoDataConfig orthoDataConfig) {
    this.orthoDataConfig = orthoDataConfig;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**")
        .allowedOrigins(orthoDataConfig.getCorsAllowedOrigins().toArray(String[]::new))
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .allowCredentials(true);
  }
}
