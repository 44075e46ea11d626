package org.nowstart.trendband.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final ObjectProvider<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.getIfAvailable() == null ? "dev" : buildProperties.getIfAvailable().getVersion();
        return new OpenAPI()
                .info(new Info()
                        .title("trendband API")
                        .description("Read-only state of the trendband trading loop.")
                        .version(version));
    }
}
