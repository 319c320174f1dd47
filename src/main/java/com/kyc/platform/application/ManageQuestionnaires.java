package com.kyc.platform.application;

import com.kyc.platform.domain.model.PageResult;
import com.kyc.platform.domain.model.Questionnaire;
import com.kyc.platform.domain.model.QuestionnaireItem;
import com.kyc.platform.domain.model.QuestionnaireScope;
import com.kyc.platform.domain.model.QuestionnaireType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Staff-facing management of questionnaires and the questions they contain.
 */
public interface ManageQuestionnaires {

    /**
     * Lists questionnaires, filtered by scope when given, otherwise by type when given.
     *
     * @param scope    optional scope filter, takes precedence over {@code type}
     * @param type     optional type filter
     * @param page     1-based page number
     * @param perPage  page size
     * @return the requested page together with the total number of matches
     */
    PageResult<Questionnaire> listQuestionnaires(QuestionnaireScope scope, QuestionnaireType type, int page, int perPage);

    Questionnaire createQuestionnaire(Map<String, Object> fields);

    Optional<Questionnaire> getQuestionnaire(long id);

    Optional<Questionnaire> updateQuestionnaire(long id, Map<String, Object> fields);

    Optional<Questionnaire> deleteQuestionnaire(long id);

    /**
     * Appends an existing question to the end of a questionnaire.
     *
     * @throws com.kyc.platform.domain.exception.EntityNotFoundException if either side does not exist
     * @throws com.kyc.platform.domain.exception.EntityValidationException if the question is already included
     */
    QuestionnaireItem addQuestion(long questionnaireId, long questionId);

    /**
     * @return the questionnaire's items in display order
     */
    List<QuestionnaireItem> listQuestions(long questionnaireId);
}
