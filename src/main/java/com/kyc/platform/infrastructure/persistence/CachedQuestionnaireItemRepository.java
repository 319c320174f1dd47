package com.kyc.platform.infrastructure.persistence;

import com.kyc.platform.domain.model.QuestionnaireItem;
import com.kyc.platform.domain.port.out.CacheStore;
import com.kyc.platform.domain.port.out.QuestionnaireItemRepository;
import com.kyc.platform.infrastructure.cache.RepositoryCacheConfig;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Repository
public class CachedQuestionnaireItemRepository extends CachedEntityRepository<QuestionnaireItem>
        implements QuestionnaireItemRepository {

    public CachedQuestionnaireItemRepository(DataManagerRegistry managers,
                                             CacheStore cacheStore,
                                             TransactionOperations transactions,
                                             RepositoryCacheConfig cacheConfig) {
        super(QuestionnaireItem.DESCRIPTOR, managers, cacheStore, transactions, cacheConfig);
    }

    /**
     * Read straight from the datastore; per-questionnaire listings are not cached.
     */
    @Override
    public List<QuestionnaireItem> findByQuestionnaire(long questionnaireId) {
        Map<String, Object> criteria = Map.of(QUESTIONNAIRE_ID, questionnaireId);
        return read("list questionnaire items", criteria, () -> manager().filterBy(criteria).list().stream()
                .sorted(Comparator.comparing(QuestionnaireItem::getOrderIndex))
                .toList());
    }
}
