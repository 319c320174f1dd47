package com.kyc.platform.infrastructure.persistence;

import com.kyc.platform.domain.model.Questionnaire;
import com.kyc.platform.domain.port.out.CacheStore;
import com.kyc.platform.infrastructure.cache.RepositoryCacheConfig;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionOperations;

@Repository
public class QuestionnaireRepository extends CachedEntityRepository<Questionnaire> {

    public QuestionnaireRepository(DataManagerRegistry managers,
                                   CacheStore cacheStore,
                                   TransactionOperations transactions,
                                   RepositoryCacheConfig cacheConfig) {
        super(Questionnaire.DESCRIPTOR, managers, cacheStore, transactions, cacheConfig);
    }
}
