package com.timebox.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 本地缓存配置。
 * <p>
 * 项目与类别名称在排程上下文中反复出现，写入后短时间内复用，避免每次生成都回表。
 * </p>
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "catalogNameCache")
    public Cache<String, String> catalogNameCache(
            @Value("${cache.catalog-name.expire-seconds:60}") long expireSeconds,
            @Value("${cache.catalog-name.maximum-size:10000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(expireSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }
}
