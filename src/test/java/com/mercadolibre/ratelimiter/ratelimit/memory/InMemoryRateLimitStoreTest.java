package com.mercadolibre.ratelimiter.ratelimit.memory;

import com.mercadolibre.ratelimiter.ratelimit.algorithm.TokenBucket;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore.ScoredMember;
import com.mercadolibre.ratelimiter.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateLimitStoreTest {

    MutableClock clock;
    InMemoryRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        store = new InMemoryRateLimitStore(clock);
    }

    @Test
    void values_expire_with_the_clock() {
        store.set("k", "v", Duration.ofSeconds(10)).block();
        assertThat(store.ttl("k").block()).isEqualTo(10);

        clock.advanceSeconds(9);
        assertThat(store.get("k").block()).isEqualTo("v");

        clock.advanceSeconds(1);
        assertThat(store.get("k").block()).isNull();
        assertThat(store.ttl("k").block()).isEqualTo(RateLimitStore.TTL_MISSING);
    }

    @Test
    void expired_state_of_clients_that_never_return_is_swept() {
        TokenBucket bucket = new TokenBucket(store, clock);
        RateLimitConfig config = RateLimitConfig.of(10, 60);
        for (int i = 0; i < 1_000; i++) {
            bucket.isAllowed("rate_limit:ip:10.0." + (i / 256) + "." + (i % 256), config).block();
        }
        store.set("permanent", "v", null).block();
        assertThat(store.size()).isEqualTo(2_001);

        clock.advanceSeconds(3_600);
        bucket.isAllowed("rate_limit:ip:192.168.0.1", config).block();

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.get("permanent").block()).isEqualTo("v");
    }

    @Test
    void sweep_waits_for_its_interval() {
        store.set("short", "v", Duration.ofSeconds(1)).block();
        clock.advanceSeconds(2);
        store.set("other", "v", Duration.ofSeconds(60)).block();
        assertThat(store.size()).isEqualTo(2);

        clock.advance(InMemoryRateLimitStore.SWEEP_INTERVAL);
        store.exists("other").block();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void ttl_reports_no_expiry_for_permanent_keys() {
        store.set("k", "v", null).block();
        assertThat(store.ttl("k").block()).isEqualTo(RateLimitStore.TTL_NO_EXPIRY);
    }

    @Test
    void multi_get_keeps_positions_for_missing_keys() {
        store.set("a", "1", null).block();
        assertThat(store.multiGet(List.of("a", "b")).block()).isEqualTo(Arrays.asList("1", null));
    }

    @Test
    void increment_multi_set_and_expire() {
        assertThat(store.increment("n").block()).isEqualTo(1);
        assertThat(store.increment("n").block()).isEqualTo(2);
        assertThat(store.expire("n", Duration.ofSeconds(5)).block()).isTrue();
        assertThat(store.expire("absent", Duration.ofSeconds(5)).block()).isFalse();

        store.multiSet(Map.of("x", "1", "y", "2"), Duration.ofSeconds(3)).block();
        clock.advanceSeconds(3);
        assertThat(store.multiGet(List.of("x", "y", "n")).block()).isEqualTo(Arrays.asList(null, null, "2"));
    }

    @Test
    void delete_reports_whether_a_key_existed() {
        store.set("k", "v", null).block();
        assertThat(store.delete("k").block()).isTrue();
        assertThat(store.delete("k").block()).isFalse();
        assertThat(store.exists("k").block()).isFalse();
    }

    @Test
    void compare_and_set_writes_only_on_match() {
        List<String> keys = List.of("a", "b");
        assertThat(store.compareAndSet(keys, Arrays.asList(null, null), List.of("1", "2"), null).block()).isTrue();
        assertThat(store.compareAndSet(keys, Arrays.asList(null, null), List.of("3", "4"), null).block()).isFalse();
        assertThat(store.compareAndSet(keys, List.of("1", "2"), List.of("3", "4"), Duration.ofSeconds(5)).block()).isTrue();
        assertThat(store.multiGet(keys).block()).containsExactly("3", "4");
        assertThat(store.ttl("a").block()).isEqualTo(5);
    }

    @Test
    void increment_if_below_stops_at_limit_and_keeps_expiry() {
        Duration ttl = Duration.ofSeconds(30);
        assertThat(store.incrementIfBelow("c", 2, ttl).block()).isEqualTo(1);
        clock.advanceSeconds(10);
        assertThat(store.incrementIfBelow("c", 2, ttl).block()).isEqualTo(2);
        assertThat(store.incrementIfBelow("c", 2, ttl).block()).isEqualTo(-1);
        assertThat(store.ttl("c").block()).isEqualTo(20);
    }

    @Test
    void zadd_if_below_prunes_before_counting() {
        Duration ttl = Duration.ofSeconds(11);
        assertThat(store.zAddIfBelow("z", 0, 2, "a", 100, ttl).block()).isTrue();
        assertThat(store.zAddIfBelow("z", 0, 2, "b", 101, ttl).block()).isTrue();
        assertThat(store.zAddIfBelow("z", 0, 2, "c", 102, ttl).block()).isFalse();
        assertThat(store.zAddIfBelow("z", 100, 2, "c", 102, ttl).block()).isTrue();

        StepVerifier.create(store.zRangeWithScores("z", 0, -1))
                .expectNext(new ScoredMember("b", 101), new ScoredMember("c", 102))
                .verifyComplete();
    }

    @Test
    void sorted_set_range_and_removal() {
        store.zAdd("z", "x", 3).block();
        store.zAdd("z", "y", 1).block();
        store.zAdd("z", "w", 2).block();

        assertThat(store.zRangeWithScores("z", 0, 0).map(ScoredMember::member).collectList().block()).containsExactly("y");
        assertThat(store.zRangeWithScores("z", -1, -1).map(ScoredMember::member).collectList().block()).containsExactly("x");
        assertThat(store.zRemoveRangeByScore("z", 0, 2).block()).isEqualTo(2);
        assertThat(store.zCard("z").block()).isEqualTo(1);
    }

    @Test
    void keys_match_glob_patterns() {
        store.set("rate_limit:whitelist:1.2.3.4", "1", null).block();
        store.set("rate_limit:whitelist:5.6.7.8", "1", Duration.ofSeconds(1)).block();
        store.set("rate_limit:blacklist:1.2.3.4", "1", null).block();

        clock.advanceSeconds(2);

        assertThat(store.keys("rate_limit:whitelist:*").collectList().block())
                .containsExactly("rate_limit:whitelist:1.2.3.4");
        assertThat(InMemoryRateLimitStore.globToRegex("a.b?").matcher("a.bc").matches()).isTrue();
        assertThat(InMemoryRateLimitStore.globToRegex("a.b?").matcher("axbc").matches()).isFalse();
    }

    @Test
    void wrong_type_is_an_error() {
        store.zAdd("z", "x", 1).block();
        StepVerifier.create(store.get("z")).expectError(IllegalStateException.class).verify();
    }
}
