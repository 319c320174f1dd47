package com.kyc.platform.infrastructure.persistence;

import com.kyc.platform.domain.model.Question;
import com.kyc.platform.domain.port.out.CacheStore;
import com.kyc.platform.infrastructure.cache.RepositoryCacheConfig;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionOperations;

@Repository
public class QuestionRepository extends CachedEntityRepository<Question> {

    public QuestionRepository(DataManagerRegistry managers,
                              CacheStore cacheStore,
                              TransactionOperations transactions,
                              RepositoryCacheConfig cacheConfig) {
        super(Question.DESCRIPTOR, managers, cacheStore, transactions, cacheConfig);
    }
}
