package com.kyc.platform.domain.port.out;

import com.kyc.platform.domain.model.QuestionnaireItem;

import java.util.List;

public interface QuestionnaireItemRepository extends EntityRepository<QuestionnaireItem> {

    String QUESTIONNAIRE_ID = "questionnaire_id";
    String QUESTION_ID = "question_id";

    /**
     * @return the questionnaire's items ordered by order index, empty if it has none
     */
    List<QuestionnaireItem> findByQuestionnaire(long questionnaireId);
}
