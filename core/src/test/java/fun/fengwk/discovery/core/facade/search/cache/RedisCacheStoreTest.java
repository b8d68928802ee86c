package fun.fengwk.discovery.core.facade.search.cache;

import fun.fengwk.discovery.core.exception.CacheUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCacheStore cacheStore;

    @BeforeEach
    void setUp() {
        cacheStore = new RedisCacheStore(redisTemplate);
    }

    @Test
    void shouldDelegateSortedSetCommands() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.removeRange("k", 0, -11)).thenReturn(2L);
        when(zSetOperations.reverseRange("k", 0, 9)).thenReturn(new LinkedHashSet<>(List.of("b", "a")));

        cacheStore.sortedSetAdd("k", "a", 42D);
        long removed = cacheStore.sortedSetRemoveRangeByRank("k", 0, -11);
        List<String> members = cacheStore.sortedSetReverseRange("k", 0, 9);

        verify(zSetOperations).add("k", "a", 42D);
        assertThat(removed).isEqualTo(2L);
        assertThat(members).containsExactly("b", "a");
    }

    @Test
    void shouldTreatMissingRepliesAsEmpty() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);

        assertThat(cacheStore.sortedSetRemoveRangeByRank("k", 0, -1)).isZero();
        assertThat(cacheStore.sortedSetReverseRange("k", 0, -1)).isEmpty();
    }

    @Test
    void shouldSetValueWithTtlAndExpireKeys() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("v")).thenReturn("cached");

        cacheStore.setWithTtl("v", "json", Duration.ofSeconds(120));
        cacheStore.expire("k", Duration.ofDays(30));

        verify(valueOperations).set("v", "json", Duration.ofSeconds(120));
        verify(redisTemplate).expire("k", Duration.ofDays(30));
        assertThat(cacheStore.get("v")).isEqualTo("cached");
    }

    @Test
    void shouldWrapRedisFailure() {
        RedisConnectionFailureException failure = new RedisConnectionFailureException("refused");
        when(redisTemplate.opsForValue()).thenThrow(failure);

        assertThatThrownBy(() -> cacheStore.get("v"))
            .isInstanceOf(CacheUnavailableException.class)
            .hasCause(failure)
            .hasMessageContaining("key=v");
    }

}
