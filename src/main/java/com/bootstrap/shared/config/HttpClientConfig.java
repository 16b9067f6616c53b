package com.bootstrap.shared.config;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 共用 OkHttpClient（Cloudflare REST API 等直接呼叫）
 *
 * 各 service 需要不同逾時時以 newBuilder() 衍生，共用連線池。
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient httpClient() {
        log.info("OkHttpClient 已初始化: connectTimeout=10s, readTimeout=15s");
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .writeTimeout(15, TimeUnit.SECONDS)
                .build();
    }
}
