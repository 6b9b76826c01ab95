package com.chamapool.chama.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackages = "com.chamapool.chama.client")
public class FeignClientConfiguration {
}
