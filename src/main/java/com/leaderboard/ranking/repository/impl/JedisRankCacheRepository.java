package com.leaderboard.ranking.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaderboard.ranking.exception.FatalConfigurationException;
import com.leaderboard.ranking.model.PlayerRank;
import com.leaderboard.ranking.model.RankedPlayer;
import com.leaderboard.ranking.repository.RankCacheRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.List;
import java.util.Optional;

/**
 * Redis-backed snapshot cache. Each snapshot is stored as a JSON string under its own key
 * with {@code SETEX}, so expiry is handled by Redis per entry.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.cache.type", havingValue = "redis", matchIfMissing = true)
public class JedisRankCacheRepository implements RankCacheRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRankCacheRepository.class);

    static final String TOP_KEY_PREFIX = "leaderboard:top:";
    static final String RANK_KEY_PREFIX = "leaderboard:rank:";

    private static final TypeReference<List<RankedPlayer>> RANKED_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private JedisPool jedisPool;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @Value("${redis.required:true}")
    private boolean required;

    @Value("${leaderboard.cache.top-ttl-seconds:60}")
    private long topTtlSeconds;

    @Value("${leaderboard.cache.rank-ttl-seconds:30}")
    private long rankTtlSeconds;

    @Value("${leaderboard.top.max-limit:100}")
    private int maxTopLimit;

    public JedisRankCacheRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(8);
        poolConfig.setTestOnBorrow(true);

        DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout)
            .ssl(redisSsl);
        if (redisPassword != null && !redisPassword.isEmpty()) {
            clientConfigBuilder.password(redisPassword);
        }

        jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
        } catch (Exception e) {
            if (required) {
                jedisPool.close();
                throw new FatalConfigurationException(
                    "Cannot connect to Redis at " + redisHost + ":" + redisPort, e);
            }
            logger.warn("Redis at {}:{} unreachable, rank cache disabled until it answers", redisHost, redisPort, e);
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            return true;
        } catch (Exception e) {
            return false;
        }
    }

    @Override
    public Optional<List<RankedPlayer>> getTopN(int limit) {
        return read(TOP_KEY_PREFIX + limit, RANKED_LIST);
    }

    @Override
    public void putTopN(int limit, List<RankedPlayer> players) {
        write(TOP_KEY_PREFIX + limit, topTtlSeconds, players);
    }

    @Override
    public Optional<PlayerRank> getPlayerRank(long playerId) {
        return read(RANK_KEY_PREFIX + playerId, new TypeReference<PlayerRank>() {});
    }

    @Override
    public void putPlayerRank(PlayerRank playerRank) {
        write(RANK_KEY_PREFIX + playerRank.getPlayerId(), rankTtlSeconds, playerRank);
    }

    @Override
    public void invalidateTopN() {
        String[] keys = new String[maxTopLimit];
        for (int n = 1; n <= maxTopLimit; n++) {
            keys[n - 1] = TOP_KEY_PREFIX + n;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(keys);
        } catch (Exception e) {
            throw new RuntimeException("Failed to invalidate top-N cache in Redis", e);
        }
    }

    @Override
    public void invalidatePlayer(long playerId) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(RANK_KEY_PREFIX + playerId);
        } catch (Exception e) {
            throw new RuntimeException("Failed to invalidate rank cache for player " + playerId, e);
        }
    }

    private <T> Optional<T> read(String key, TypeReference<T> type) {
        try (Jedis jedis = jedisPool.getResource()) {
            String json = jedis.get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable cache entry {}", key, e);
            return Optional.empty();
        } catch (Exception e) {
            logger.warn("Failed to read {} from Redis: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, long ttlSeconds, Object value) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.setex(key, ttlSeconds, objectMapper.writeValueAsString(value));
        } catch (Exception e) {
            throw new RuntimeException("Failed to write " + key + " to Redis", e);
        }
    }
}
