package me.internalizable.cricketscore.config;

import me.internalizable.cricketscore.cache.ScoreboardCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScoreboardCache scoreboardCache(
            @Value("${cache.scoreboard.ttl-seconds:2}") int ttlSeconds,
            Clock clock) {
        return ScoreboardCache.builder()
                .name("scoreboard")
                .ttl(Duration.ofSeconds(ttlSeconds))
                .clock(clock)
                .build();
    }
}
