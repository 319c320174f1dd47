package com.kyc.platform.application;

import com.kyc.platform.domain.exception.EntityNotFoundException;
import com.kyc.platform.domain.exception.EntityValidationException;
import com.kyc.platform.domain.model.PageResult;
import com.kyc.platform.domain.model.Question;
import com.kyc.platform.domain.model.Questionnaire;
import com.kyc.platform.domain.model.QuestionnaireItem;
import com.kyc.platform.domain.model.QuestionnaireScope;
import com.kyc.platform.domain.model.QuestionnaireType;
import com.kyc.platform.domain.port.out.EntityRepository;
import com.kyc.platform.domain.port.out.QuestionnaireItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.kyc.platform.domain.port.out.QuestionnaireItemRepository.QUESTIONNAIRE_ID;
import static com.kyc.platform.domain.port.out.QuestionnaireItemRepository.QUESTION_ID;

@Service
public class AdminQuestionnaireService implements ManageQuestionnaires {

    private static final Logger logger = LoggerFactory.getLogger(AdminQuestionnaireService.class);

    private final EntityRepository<Questionnaire> questionnaireRepository;
    private final EntityRepository<Question> questionRepository;
    private final QuestionnaireItemRepository itemRepository;

    public AdminQuestionnaireService(EntityRepository<Questionnaire> questionnaireRepository,
                                     EntityRepository<Question> questionRepository,
                                     QuestionnaireItemRepository itemRepository) {
        this.questionnaireRepository = questionnaireRepository;
        this.questionRepository = questionRepository;
        this.itemRepository = itemRepository;
    }

    @Override
    public PageResult<Questionnaire> listQuestionnaires(QuestionnaireScope scope, QuestionnaireType type,
                                                        int page, int perPage) {
        Map<String, Object> filters;
        if (scope != null) {
            filters = Map.of("questionnaire_scope", scope);
        } else if (type != null) {
            filters = Map.of("questionnaire_type", type);
        } else {
            filters = Map.of();
        }

        PageResult<Questionnaire> result = questionnaireRepository.paginate(page, perPage, filters);
        logger.debug("Listed {} of {} questionnaires (scope={}, type={})",
                result.entities().size(), result.totalCount(), scope, type);
        return result;
    }

    @Override
    public Questionnaire createQuestionnaire(Map<String, Object> fields) {
        return questionnaireRepository.create(fields);
    }

    @Override
    public Optional<Questionnaire> getQuestionnaire(long id) {
        return questionnaireRepository.getById(id);
    }

    @Override
    public Optional<Questionnaire> updateQuestionnaire(long id, Map<String, Object> fields) {
        return questionnaireRepository.update(id, fields);
    }

    @Override
    public Optional<Questionnaire> deleteQuestionnaire(long id) {
        return questionnaireRepository.delete(id);
    }

    @Override
    public QuestionnaireItem addQuestion(long questionnaireId, long questionId) {
        requireQuestionnaire(questionnaireId);
        if (questionRepository.getById(questionId).isEmpty()) {
            throw new EntityNotFoundException("Question", questionId);
        }

        if (itemRepository.exists(Map.of(QUESTIONNAIRE_ID, questionnaireId, QUESTION_ID, questionId))) {
            throw new EntityValidationException(String.format(
                    "Question %d is already part of questionnaire %d", questionId, questionnaireId));
        }

        int nextIndex = itemRepository.findByQuestionnaire(questionnaireId).stream()
                .mapToInt(QuestionnaireItem::getOrderIndex)
                .max()
                .orElse(-1) + 1;

        QuestionnaireItem item = itemRepository.create(Map.of(
                QUESTIONNAIRE_ID, questionnaireId,
                QUESTION_ID, questionId,
                "order_index", nextIndex));

        logger.info("Added question {} to questionnaire {} at position {}", questionId, questionnaireId, nextIndex);
        return item;
    }

    @Override
    public List<QuestionnaireItem> listQuestions(long questionnaireId) {
        requireQuestionnaire(questionnaireId);
        return itemRepository.findByQuestionnaire(questionnaireId);
    }

    private void requireQuestionnaire(long questionnaireId) {
        if (questionnaireRepository.getById(questionnaireId).isEmpty()) {
            throw new EntityNotFoundException("Questionnaire", questionnaireId);
        }
    }
}
