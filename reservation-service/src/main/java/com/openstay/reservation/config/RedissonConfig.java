package com.openstay.reservation.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis client for the distributed allocation strategy.
 * Only created when {@code reservation.allocation.strategy=distributed}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "reservation.allocation.strategy", havingValue = "distributed")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(ReservationProperties properties) {
        Config config = new Config();
        config.useSingleServer().setAddress(properties.getRedis().getAddress());
        log.info("Connecting Redisson to {}", properties.getRedis().getAddress());
        return Redisson.create(config);
    }
}
