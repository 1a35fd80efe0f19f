package com.example.inboxsync.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson backs the cluster-wide chat lock. Not created in {@code local} lock mode.
 */
@Configuration
@ConditionalOnProperty(prefix = "sync.lock", name = "mode", havingValue = "redis", matchIfMissing = true)
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties, SyncProperties syncProperties) {
        Config config = new Config();
        config.setLockWatchdogTimeout(syncProperties.getLock().getWatchdogTimeout().toMillis());

        SingleServerConfig server = config.useSingleServer()
                .setAddress(serverAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName("inbox-sync-chat-lock");
        if (StringUtils.hasText(redisProperties.getUsername())) {
            server.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            server.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        return Redisson.create(config);
    }

    /**
     * {@code spring.data.redis.url} wins over host and port when set.
     */
    private String serverAddress(RedisProperties redisProperties) {
        if (StringUtils.hasText(redisProperties.getUrl())) {
            return redisProperties.getUrl();
        }
        boolean tls = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (tls ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
