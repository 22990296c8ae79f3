package com.herald.pushrules.runtime.evaluation;

import com.herald.pushrules.api.model.Event;
import com.herald.pushrules.api.model.EventTypes;
import com.herald.pushrules.api.model.PushAction;
import com.herald.pushrules.api.model.PushCondition;
import com.herald.pushrules.api.model.PushRule;
import com.herald.pushrules.api.model.RuleSet;
import com.herald.pushrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.herald.pushrules.testing.SimpleConditionMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PushRuleListEvaluatorTest {

    private static final String USER = "@alice:example.org";

    private static final PushCondition IS_MESSAGE = new PushCondition(PushCondition.EVENT_MATCH,
            Map.of("key", "type", "pattern", EventTypes.MESSAGE), "is-message");
    private static final PushCondition MENTIONS_ME = PushCondition.of(PushCondition.CONTAINS_DISPLAY_NAME, Map.of());

    private SimpleConditionMatcher matcher;
    private InMemoryMetricsRegistry metrics;
    private PushRuleListEvaluator evaluator;

    @BeforeEach
    void setUp() {
        Event event = new Event("$e1", "!room:example.org", EventTypes.MESSAGE, "@bob:example.org", null,
                Map.of("msgtype", "m.text", "body", "hello Alice"));
        matcher = new SimpleConditionMatcher(event, 3);
        metrics = new InMemoryMetricsRegistry();
        evaluator = new PushRuleListEvaluator(matcher, new ConditionMemo(), metrics.counter("push_rules_malformed"));
    }

    @Test
    @DisplayName("Should stop at the first matching rule")
    void firstMatchWins() {
        RuleSet rules = RuleSet.of(
                PushRule.of("mention", List.of(MENTIONS_ME), List.of(PushAction.NOTIFY, PushAction.highlight())),
                PushRule.of("message", List.of(IS_MESSAGE), List.of(PushAction.NOTIFY)));

        List<PushAction> actions = evaluator.actionsFor(USER, "Alice", rules);

        assertThat(actions).containsExactly(PushAction.NOTIFY, PushAction.highlight());
        assertThat(matcher.calls()).containsExactly("contains_display_name:" + USER);
    }

    @Test
    @DisplayName("Should skip disabled rules")
    void disabledRulesAreSkipped() {
        RuleSet rules = RuleSet.of(
                new PushRule("mention", false, List.of(MENTIONS_ME), List.of(PushAction.NOTIFY, PushAction.highlight())),
                PushRule.of("message", List.of(IS_MESSAGE), List.of(PushAction.NOTIFY, PushAction.sound("default"))));

        assertThat(evaluator.actionsFor(USER, "Alice", rules))
                .containsExactly(PushAction.NOTIFY, PushAction.sound("default"));
    }

    @Test
    @DisplayName("Should not notify when the first matching rule says dont_notify")
    void dontNotifySuppressesLaterRules() {
        RuleSet rules = RuleSet.of(
                PushRule.of("muted", List.of(IS_MESSAGE), List.of(PushAction.DONT_NOTIFY)),
                PushRule.of("mention", List.of(MENTIONS_ME), List.of(PushAction.NOTIFY)));

        assertThat(evaluator.actionsFor(USER, "Alice", rules)).isEmpty();
        assertThat(matcher.calls()).hasSize(1);
    }

    @Test
    @DisplayName("Should strip dont_notify and require notify in the remaining actions")
    void normalizesActions() {
        RuleSet tweakOnly = RuleSet.of(
                PushRule.of("tweak", List.of(IS_MESSAGE), List.of(PushAction.sound("ping"))));
        RuleSet mixed = RuleSet.of(
                PushRule.of("mixed", List.of(IS_MESSAGE), List.of(PushAction.DONT_NOTIFY, PushAction.NOTIFY, PushAction.COALESCE)));

        assertThat(evaluator.actionsFor(USER, null, tweakOnly)).isEmpty();
        assertThat(evaluator.actionsFor(USER, null, mixed)).containsExactly(PushAction.NOTIFY, PushAction.COALESCE);
    }

    @Test
    @DisplayName("Should match a rule without conditions")
    void emptyConditionsMatchEverything() {
        RuleSet rules = RuleSet.of(PushRule.of("catch-all", List.of(), List.of(PushAction.NOTIFY)));

        assertThat(evaluator.actionsFor(USER, null, rules)).containsExactly(PushAction.NOTIFY);
    }

    @Test
    @DisplayName("Should treat malformed rules as non-matching and keep going")
    void malformedRulesAreSkipped() {
        RuleSet rules = RuleSet.of(
                new PushRule("no-conditions", true, null, List.of(PushAction.NOTIFY)),
                new PushRule("no-actions", true, List.of(IS_MESSAGE), null),
                PushRule.of("unknown-kind", List.of(PushCondition.of("sender_is_cat", Map.of())), List.of(PushAction.NOTIFY)),
                PushRule.of("message", List.of(IS_MESSAGE), List.of(PushAction.NOTIFY, PushAction.sound("default"))));

        List<PushAction> actions = evaluator.actionsFor(USER, null, rules);

        assertThat(actions).containsExactly(PushAction.NOTIFY, PushAction.sound("default"));
        assertThat(metrics.getCounterValue("push_rules_malformed")).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should return nothing when no rule matches")
    void noMatch() {
        RuleSet rules = RuleSet.of(PushRule.of("mention", List.of(MENTIONS_ME), List.of(PushAction.NOTIFY)));

        assertThat(evaluator.actionsFor(USER, "Carol", rules)).isEmpty();
        assertThat(evaluator.actionsFor(USER, null, RuleSet.of())).isEmpty();
    }
}
