package org.nowstart.trendband.config;

import org.nowstart.trendband.repository.OkxFeignClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackageClasses = OkxFeignClient.class)
public class FeignClientConfig {
}
