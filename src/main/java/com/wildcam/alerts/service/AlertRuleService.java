package com.wildcam.alerts.service;

import com.wildcam.alerts.model.AlertRule;
import com.wildcam.alerts.repository.AlertRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class AlertRuleService {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleService.class);

    private final AlertRuleRepository ruleRepository;

    public AlertRuleService(AlertRuleRepository ruleRepository) {
        this.ruleRepository = ruleRepository;
    }

    public List<AlertRule> getAllRules() {
        return ruleRepository.findAll();
    }

    public AlertRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId);
    }

    public AlertRule createRule(AlertRule rule) {
        if (rule.getRuleId() == null || rule.getRuleId().isBlank()) {
            rule.setRuleId("RULE-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase());
        }
        ruleRepository.save(rule);
        log.info("Created alert rule {} for user {} (camera={})",
                rule.getRuleId(), rule.getUserId(), rule.isGlobal() ? "all" : rule.getCameraId());
        return rule;
    }

    /**
     * Replaces the routing fields of an existing rule. Ownership (ruleId, userId)
     * is kept from the stored rule. Returns null when no rule has that id.
     */
    public AlertRule updateRule(String ruleId, AlertRule updated) {
        AlertRule existing = ruleRepository.findById(ruleId);
        if (existing == null) {
            return null;
        }

        existing.setCameraId(updated.getCameraId());
        existing.setActive(updated.isActive());
        existing.setSeverityLevels(updated.getSeverityLevels());
        existing.setSpeciesFilter(updated.getSpeciesFilter());
        existing.setMinConfidence(updated.getMinConfidence());
        existing.setTimeOfDay(updated.getTimeOfDay());
        existing.setDaysOfWeek(updated.getDaysOfWeek());
        existing.setEmailEnabled(updated.isEmailEnabled());
        existing.setEmailAddress(updated.getEmailAddress());
        existing.setPushEnabled(updated.isPushEnabled());
        existing.setWebhookUrl(updated.getWebhookUrl());
        existing.setSmsEnabled(updated.isSmsEnabled());
        existing.setPhoneNumber(updated.getPhoneNumber());
        existing.setSuppressFalsePositives(updated.isSuppressFalsePositives());

        ruleRepository.save(existing);
        log.info("Updated alert rule {}", ruleId);
        return existing;
    }

    public boolean deleteRule(String ruleId) {
        boolean deleted = ruleRepository.delete(ruleId);
        if (deleted) {
            log.info("Deleted alert rule {}", ruleId);
        }
        return deleted;
    }
}
