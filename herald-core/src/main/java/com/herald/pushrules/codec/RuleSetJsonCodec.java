/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.herald.pushrules.api.exceptions.MalformedRuleException;
import com.herald.pushrules.api.model.PushAction;
import com.herald.pushrules.api.model.PushCondition;
import com.herald.pushrules.api.model.PushRule;
import com.herald.pushrules.api.model.RuleSet;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes the stored JSON form of a user's push rules.
 *
 * <p>
 * Stored form, highest priority rule first:
 * <pre>{@code
 * [
 *   {
 *     "rule_id": ".m.rule.contains_display_name",
 *     "enabled": true,
 *     "conditions": [ { "kind": "contains_display_name" } ],
 *     "actions": [ "notify", { "set_tweak": "sound", "value": "default" }, { "set_tweak": "highlight" } ]
 *   }
 * ]
 * }</pre>
 *
 * <p>
 * Decoding is lenient per rule: a rule without {@code conditions} or
 * {@code actions} is kept with that part set to {@code null}, so evaluation can
 * skip it; action entries of unknown shape are dropped. A condition's
 * {@code _id} is kept only when its kind does not depend on the recipient, so
 * that memoized results are never shared between users whose outcome can differ.
 */
public class RuleSetJsonCodec {
    private static final Logger logger = Logger.getLogger(RuleSetJsonCodec.class.getName());

    private static final String FIELD_RULE_ID = "rule_id";
    private static final String FIELD_ENABLED = "enabled";
    private static final String FIELD_CONDITIONS = "conditions";
    private static final String FIELD_ACTIONS = "actions";
    private static final String FIELD_KIND = "kind";
    private static final String FIELD_CACHE_ID = "_id";
    private static final String FIELD_SET_TWEAK = "set_tweak";
    private static final String FIELD_VALUE = "value";

    private final ObjectMapper objectMapper;

    public RuleSetJsonCodec() {
        this(new ObjectMapper());
    }

    public RuleSetJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param json stored rule list
     * @return decoded rules in stored order
     * @throws MalformedRuleException if the document is not a JSON array
     */
    public RuleSet decode(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRuleException("Push rules are not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedRuleException("Push rules must be a JSON array");
        }

        List<PushRule> rules = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode ruleNode : root) {
            if (!ruleNode.isObject()) {
                logger.fine("Skipping non-object rule entry at index " + index);
            } else {
                rules.add(decodeRule(ruleNode, index));
            }
            index++;
        }
        return new RuleSet(rules);
    }

    public String encode(RuleSet ruleSet) {
        ArrayNode root = objectMapper.createArrayNode();
        for (PushRule rule : ruleSet) {
            ObjectNode ruleNode = root.addObject();
            ruleNode.put(FIELD_RULE_ID, rule.ruleId());
            ruleNode.put(FIELD_ENABLED, rule.enabled());
            if (rule.conditions() != null) {
                ArrayNode conditions = ruleNode.putArray(FIELD_CONDITIONS);
                for (PushCondition condition : rule.conditions()) {
                    ObjectNode conditionNode = conditions.addObject();
                    conditionNode.put(FIELD_KIND, condition.kind());
                    condition.parameters().forEach((key, value) -> conditionNode.set(key, objectMapper.valueToTree(value)));
                    condition.memoKey().ifPresent(id -> conditionNode.put(FIELD_CACHE_ID, id));
                }
            }
            if (rule.actions() != null) {
                ArrayNode actions = ruleNode.putArray(FIELD_ACTIONS);
                for (PushAction action : rule.actions()) {
                    if (action.tweak() == null) {
                        actions.add(action.kind());
                    } else {
                        ObjectNode tweak = actions.addObject();
                        tweak.put(FIELD_SET_TWEAK, action.tweak());
                        if (action.value() != null) {
                            tweak.set(FIELD_VALUE, objectMapper.valueToTree(action.value()));
                        }
                    }
                }
            }
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize push rules", e);
        }
    }

    private PushRule decodeRule(JsonNode ruleNode, int index) {
        String ruleId = ruleNode.path(FIELD_RULE_ID).asText("rule-" + index);
        boolean enabled = ruleNode.path(FIELD_ENABLED).asBoolean(true);

        List<PushCondition> conditions = null;
        JsonNode conditionsNode = ruleNode.get(FIELD_CONDITIONS);
        if (conditionsNode != null && conditionsNode.isArray()) {
            conditions = new ArrayList<>(conditionsNode.size());
            for (JsonNode conditionNode : conditionsNode) {
                conditions.add(decodeCondition(conditionNode));
            }
        } else if (logger.isLoggable(Level.FINE)) {
            logger.fine("Rule " + ruleId + " has no condition list");
        }

        List<PushAction> actions = null;
        JsonNode actionsNode = ruleNode.get(FIELD_ACTIONS);
        if (actionsNode != null && actionsNode.isArray()) {
            actions = new ArrayList<>(actionsNode.size());
            for (JsonNode actionNode : actionsNode) {
                PushAction action = decodeAction(actionNode);
                if (action != null) {
                    actions.add(action);
                } else if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Rule " + ruleId + ": dropping unrecognised action " + actionNode);
                }
            }
        } else if (logger.isLoggable(Level.FINE)) {
            logger.fine("Rule " + ruleId + " has no action list");
        }

        return new PushRule(ruleId, enabled, conditions, actions);
    }

    private PushCondition decodeCondition(JsonNode node) {
        // Unknown or missing kinds are kept; the matcher rejects them at evaluation time.
        String kind = node.path(FIELD_KIND).asText("");
        Map<String, Object> parameters = new LinkedHashMap<>();
        String cacheId = null;

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (FIELD_KIND.equals(name)) {
                continue;
            }
            if (FIELD_CACHE_ID.equals(name)) {
                cacheId = field.getValue().asText(null);
                continue;
            }
            Object value = objectMapper.convertValue(field.getValue(), Object.class);
            if (value != null) {
                parameters.put(name, value);
            }
        }

        PushCondition condition = new PushCondition(kind, parameters, cacheId);
        if (cacheId != null && condition.dependsOnRecipient()) {
            return new PushCondition(kind, parameters, null);
        }
        return condition;
    }

    private static PushAction decodeAction(JsonNode node) {
        if (node.isTextual()) {
            return new PushAction(node.asText(), null, null);
        }
        if (node.isObject() && node.hasNonNull(FIELD_SET_TWEAK)) {
            JsonNode value = node.get(FIELD_VALUE);
            Object tweakValue = null;
            if (value != null && !value.isNull()) {
                tweakValue = value.isBoolean() ? value.asBoolean() : value.isNumber() ? value.numberValue() : value.asText();
            }
            return PushAction.tweak(node.get(FIELD_SET_TWEAK).asText(), tweakValue);
        }
        return null;
    }
}
