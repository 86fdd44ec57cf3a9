package com.work.escrow.demo.config;

import com.work.escrow.core.lock.ItemLockManager;
import com.work.escrow.core.lock.impl.RedisItemLockManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis 分布式 item 锁装配：
 * 当 escrow.lock-mode=redis 时启用，多节点共享同一批 item 时必须开启。
 */
@Configuration
@ConditionalOnProperty(prefix = "escrow", name = "lock-mode", havingValue = "redis")
public class RedisLockConfiguration {

    @Bean
    public ItemLockManager redisItemLockManager(StringRedisTemplate redisTemplate) {
        return new RedisItemLockManager(redisTemplate);
    }
}
