package org.nowstart.trendband.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

class SwaggerConfigTest {

    @Test
    void customOpenAPI_buildsExpectedMetadata() {
        Properties properties = new Properties();
        properties.setProperty("version", "1.2.3");
        ObjectProvider<BuildProperties> provider = provider(new BuildProperties(properties));

        var openApi = new SwaggerConfig(provider).customOpenAPI();

        assertThat(openApi.getInfo().getTitle()).isEqualTo("trendband API");
        assertThat(openApi.getInfo().getDescription()).contains("trading loop");
        assertThat(openApi.getInfo().getVersion()).isEqualTo("1.2.3");
    }

    @Test
    void customOpenAPI_fallsBackToDevVersionWithoutBuildInfo() {
        var openApi = new SwaggerConfig(provider(null)).customOpenAPI();

        assertThat(openApi.getInfo().getVersion()).isEqualTo("dev");
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<BuildProperties> provider(BuildProperties buildProperties) {
        ObjectProvider<BuildProperties> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(buildProperties);
        return provider;
    }
}
