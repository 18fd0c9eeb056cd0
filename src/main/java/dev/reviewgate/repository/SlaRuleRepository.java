package dev.reviewgate.repository;

import dev.reviewgate.domain.entity.SlaRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface SlaRuleRepository extends JpaRepository<SlaRule, UUID> {
}
