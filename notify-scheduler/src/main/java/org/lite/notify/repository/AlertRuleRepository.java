package org.lite.notify.repository;

import org.lite.notify.entity.AlertRule;
import org.lite.notify.enums.AlertType;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AlertRuleRepository extends ReactiveMongoRepository<AlertRule, String> {

    Flux<AlertRule> findByUserIdAndRuleTypeAndEnabledTrue(String userId, AlertType ruleType);
}
