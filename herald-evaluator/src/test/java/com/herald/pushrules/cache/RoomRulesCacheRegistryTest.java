package com.herald.pushrules.cache;

import com.herald.pushrules.api.model.Membership;
import com.herald.pushrules.api.model.PushAction;
import com.herald.pushrules.api.model.PushCondition;
import com.herald.pushrules.api.model.PushRule;
import com.herald.pushrules.api.model.ResolutionContext;
import com.herald.pushrules.api.model.RuleSet;
import com.herald.pushrules.api.model.StateKey;
import com.herald.pushrules.api.spi.InvalidationCallback;
import com.herald.pushrules.infra.config.PushRulesConfig;
import com.herald.pushrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.herald.pushrules.testing.FakePushRuleStore;
import com.herald.pushrules.testing.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoomRulesCacheRegistryTest {

    private static final String ROOM_A = "!a:example.org";
    private static final String ROOM_B = "!b:example.org";
    private static final String ALICE = "@alice:example.org";
    private static final String BOB = "@bob:example.org";

    private FakePushRuleStore store;
    private InMemoryMetricsRegistry metrics;
    private RoomRulesCacheRegistry registry;

    @BeforeEach
    void setUp() {
        RuleSet notifyAll = RuleSet.of(PushRule.of(".m.rule.message",
                List.of(PushCondition.of(PushCondition.EVENT_MATCH, Map.of("key", "type", "pattern", "m.room.message"))),
                List.of(PushAction.NOTIFY)));
        store = new FakePushRuleStore()
                .member("$alice-a", ALICE, Membership.JOIN)
                .member("$bob-b", BOB, Membership.JOIN)
                .pusher(ALICE)
                .pusher(BOB)
                .rules(ALICE, notifyAll)
                .rules(BOB, notifyAll);
        metrics = new InMemoryMetricsRegistry();
        registry = newRegistry(PushRulesConfig.defaults());
    }

    private RoomRulesCacheRegistry newRegistry(PushRulesConfig config) {
        return new RoomRulesCacheRegistry(config, store, new TestUsers(), metrics, Runnable::run);
    }

    private static ResolutionContext context(Object stateGroup, String userId, String eventId) {
        return new ResolutionContext(stateGroup, Map.of(StateKey.member(userId), eventId));
    }

    @Test
    @DisplayName("Should return the same cache for the same room")
    void getOrCreateReturnsSameInstance() {
        RoomRulesCache first = registry.getOrCreate(ROOM_A);
        RoomRulesCache second = registry.getOrCreate(ROOM_A);

        assertThat(second).isSameAs(first);
        assertThat(first.roomId()).isEqualTo(ROOM_A);
        assertThat(registry.getOrCreate(ROOM_B)).isNotSameAs(first);
        assertThat(registry.estimatedSize()).isEqualTo(2L);
        assertThat(metrics.getGaugeValue("room_rules_cache_size")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should hand out a cold cache after eviction without touching other rooms")
    void evictionYieldsColdCache() {
        RoomRulesCache roomA = registry.getOrCreate(ROOM_A);
        roomA.refresh(context("sg-a", ALICE, "$alice-a")).join();
        RoomRulesCache roomB = registry.getOrCreate(ROOM_B);
        roomB.refresh(context("sg-b", BOB, "$bob-b")).join();

        registry.evict(ROOM_A);

        RoomRulesCache recreated = registry.getOrCreate(ROOM_A);
        assertThat(recreated).isNotSameAs(roomA);
        assertThat(recreated.isCurrentFor("sg-a")).isFalse();
        assertThat(recreated.cachedUserCount()).isZero();
        assertThat(registry.getOrCreate(ROOM_B)).isSameAs(roomB);
        assertThat(roomB.isCurrentFor("sg-b")).isTrue();
    }

    @Test
    @DisplayName("Should invalidate the room's entry through its callback")
    void callbackInvalidatesCurrentEntry() {
        RoomRulesCache roomA = registry.getOrCreate(ROOM_A);
        roomA.refresh(context("sg-a", ALICE, "$alice-a")).join();

        store.callbacks().get(0).invalidate();

        assertThat(roomA.sequence()).isEqualTo(1L);
        assertThat(roomA.isCurrentFor("sg-a")).isFalse();
    }

    @Test
    @DisplayName("Should ignore a callback fired after its room was evicted")
    void callbackAfterEvictionIsNoOp() {
        RoomRulesCache roomA = registry.getOrCreate(ROOM_A);
        roomA.refresh(context("sg-a", ALICE, "$alice-a")).join();
        InvalidationCallback callback = store.callbacks().get(0);

        registry.evictAll();
        callback.invalidate();

        assertThat(registry.peek(ROOM_A)).isEmpty();
        assertThat(registry.estimatedSize()).isZero();
        assertThat(roomA.sequence()).isZero();
    }

    @Test
    @DisplayName("Should not recreate or count an access when a callback fires")
    void callbackDoesNotTouchStats() {
        registry.getOrCreate(ROOM_A);
        long requestsBefore = registry.stats().requestCount();

        registry.invalidationCallback(ROOM_A).invalidate();
        registry.invalidationCallback(ROOM_B).invalidate();

        assertThat(registry.stats().requestCount()).isEqualTo(requestsBefore);
        assertThat(registry.peek(ROOM_B)).isEmpty();
    }

    @Test
    @DisplayName("Should invalidate only rooms where the user whose rules changed is a member")
    void rulesChangedInvalidatesMatchingRooms() {
        RoomRulesCache roomA = registry.getOrCreate(ROOM_A);
        roomA.refresh(context("sg-a", ALICE, "$alice-a")).join();
        RoomRulesCache roomB = registry.getOrCreate(ROOM_B);
        roomB.refresh(context("sg-b", BOB, "$bob-b")).join();

        int invalidated = registry.onRulesChanged(ALICE);

        assertThat(invalidated).isEqualTo(1);
        assertThat(roomA.isCurrentFor("sg-a")).isFalse();
        assertThat(roomB.isCurrentFor("sg-b")).isTrue();
        assertThat(registry.onRulesChanged("@nobody:example.org")).isZero();
    }

    @Test
    @DisplayName("Should pick up rules created by a member who had none")
    void rulesChangedForMemberWithoutRules() {
        String carol = "@carol:example.org";
        store.member("$carol-a", carol, Membership.JOIN).pusher(carol);
        RoomRulesCache roomA = registry.getOrCreate(ROOM_A);
        ResolutionContext state = new ResolutionContext("sg-a", Map.of(
                StateKey.member(ALICE), "$alice-a",
                StateKey.member(carol), "$carol-a"));
        assertThat(roomA.refresh(state).join()).containsOnlyKeys(ALICE);

        RuleSet carolRules = RuleSet.of(PushRule.of(".m.rule.master", List.of(), List.of(PushAction.NOTIFY)));
        store.rules(carol, carolRules);

        assertThat(registry.onRulesChanged(carol)).isEqualTo(1);
        assertThat(roomA.refresh(state).join()).containsOnlyKeys(ALICE, carol);
    }

    @Test
    @DisplayName("Should invalidate a present room on request")
    void invalidateRoom() {
        RoomRulesCache roomA = registry.getOrCreate(ROOM_A);
        roomA.refresh(context("sg-a", ALICE, "$alice-a")).join();

        registry.invalidateRoom(ROOM_A);
        registry.invalidateRoom("!unknown:example.org");

        assertThat(roomA.sequence()).isEqualTo(1L);
        assertThat(registry.peek("!unknown:example.org")).isEmpty();
    }

    @Test
    @DisplayName("Should drop every room and report the size on the gauge")
    void evictAllClearsRegistry() {
        registry.getOrCreate(ROOM_A);
        registry.getOrCreate(ROOM_B);
        assertThat(metrics.getGaugeValue("room_rules_cache_size")).isEqualTo(2.0);

        registry.evictAll();

        assertThat(registry.estimatedSize()).isZero();
        assertThat(registry.peek(ROOM_A)).isEmpty();
        assertThat(registry.peek(ROOM_B)).isEmpty();
        assertThat(metrics.getGaugeValue("room_rules_cache_size")).isZero();
    }

    @Test
    @DisplayName("Should stay within the configured maximum size")
    void boundedBySize() {
        RoomRulesCacheRegistry small = newRegistry(PushRulesConfig.builder().roomCacheMaxSize(2).build());

        for (int i = 0; i < 10; i++) {
            small.getOrCreate("!room" + i + ":example.org");
        }
        small.cleanUp();

        assertThat(small.estimatedSize()).isLessThanOrEqualTo(2L);
    }
}
