package dev.reviewgate.service;

import dev.reviewgate.domain.entity.SlaRule;
import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.dto.request.SlaRuleRequest;
import dev.reviewgate.dto.response.SlaRuleResponse;
import dev.reviewgate.exception.InvalidStatusException;
import dev.reviewgate.repository.SlaRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Administrator-managed SLA rules. Rules only affect deadlines computed after they change;
 * existing deadlines are left as they are.
 */
@Service
public class SlaRuleService {

    private static final Logger log = LoggerFactory.getLogger(SlaRuleService.class);

    private final SlaRuleRepository repository;

    public SlaRuleService(SlaRuleRepository repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public List<SlaRuleResponse> list() {
        return repository.findAll().stream()
                .sorted(Comparator.comparing(SlaRule::getFromStatus).thenComparing(SlaRule::getToStatus))
                .map(SlaRuleService::toResponse)
                .toList();
    }

    /**
     * Replaces the whole rule set. Either every rule is stored or none is. All validation happens
     * here, before anything is deleted.
     */
    @Transactional
    public List<SlaRuleResponse> replaceAll(List<SlaRuleRequest> requests) {
        List<SlaRule> rules = new ArrayList<>();
        Set<String> pairs = new HashSet<>();
        for (SlaRuleRequest request : requests) {
            if (request == null) {
                throw new IllegalArgumentException("SLA rule entries must not be null");
            }
            ReviewStatus from = ReviewStatus.parse(request.fromStatus())
                    .orElseThrow(() -> new InvalidStatusException("fromStatus", request.fromStatus()));
            ReviewStatus to = ReviewStatus.parse(request.toStatus())
                    .orElseThrow(() -> new InvalidStatusException("toStatus", request.toStatus()));
            if (!pairs.add(from.name() + "->" + to.name())) {
                throw new IllegalArgumentException("Duplicate SLA rule for %s -> %s".formatted(from, to));
            }
            rules.add(SlaRule.of(from, to, request.durationHours()));
        }

        // Bulk delete runs immediately, so the unique (from, to) constraint never sees old and new rows together
        repository.deleteAllInBatch();
        List<SlaRule> saved = repository.saveAll(rules);
        log.info("SLA rules replaced: {} rule(s)", saved.size());
        return saved.stream().map(SlaRuleService::toResponse).toList();
    }

    private static SlaRuleResponse toResponse(SlaRule rule) {
        return new SlaRuleResponse(rule.getFromStatus(), rule.getToStatus(), rule.getDurationHours());
    }
}
