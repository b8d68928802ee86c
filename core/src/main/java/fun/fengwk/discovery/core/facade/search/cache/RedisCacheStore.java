package fun.fengwk.discovery.core.facade.search.cache;

import fun.fengwk.discovery.core.exception.CacheUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link CacheStore} on Redis.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void sortedSetAdd(String key, String member, double score) {
        execute("zadd", key, () -> redisTemplate.opsForZSet().add(key, member, score));
    }

    @Override
    public long sortedSetRemoveRangeByRank(String key, long start, long end) {
        Long removed = execute("zremrangebyrank", key, () -> redisTemplate.opsForZSet().removeRange(key, start, end));
        return removed == null ? 0L : removed;
    }

    @Override
    public List<String> sortedSetReverseRange(String key, long start, long end) {
        Set<String> members = execute("zrevrange", key, () -> redisTemplate.opsForZSet().reverseRange(key, start, end));
        return members == null ? new ArrayList<>() : new ArrayList<>(members);
    }

    @Override
    public void expire(String key, Duration ttl) {
        execute("expire", key, () -> redisTemplate.expire(key, ttl));
    }

    @Override
    public String get(String key) {
        return execute("get", key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        execute("set", key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    private static <T> T execute(String command, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("redis " + command + " failed, key=" + key, ex);
        }
    }

}
