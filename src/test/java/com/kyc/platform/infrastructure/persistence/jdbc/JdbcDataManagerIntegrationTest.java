package com.kyc.platform.infrastructure.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyc.platform.domain.exception.EntityValidationException;
import com.kyc.platform.domain.model.Question;
import com.kyc.platform.domain.model.QuestionType;
import com.kyc.platform.domain.model.Questionnaire;
import com.kyc.platform.domain.model.QuestionnaireItem;
import com.kyc.platform.domain.model.QuestionnaireScope;
import com.kyc.platform.domain.model.QuestionnaireType;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers
class JdbcDataManagerIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>("postgres:15-alpine")
                    .withDatabaseName("kyc_test")
                    .withUsername("test")
                    .withPassword("test");

    private static HikariDataSource dataSource;
    private static JdbcTemplate jdbcTemplate;
    private static QuestionnaireDataManager questionnaires;
    private static QuestionDataManager questions;
    private static QuestionnaireItemDataManager items;

    @BeforeAll
    static void setup() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgres.getJdbcUrl());
        config.setUsername(postgres.getUsername());
        config.setPassword(postgres.getPassword());
        dataSource = new HikariDataSource(config);

        Flyway.configure().dataSource(dataSource).load().migrate();

        jdbcTemplate = new JdbcTemplate(dataSource);
        NamedParameterJdbcTemplate namedTemplate = new NamedParameterJdbcTemplate(dataSource);
        questionnaires = new QuestionnaireDataManager(namedTemplate);
        questions = new QuestionDataManager(namedTemplate, new ObjectMapper());
        items = new QuestionnaireItemDataManager(namedTemplate);
    }

    @AfterAll
    static void closeDataSource() {
        dataSource.close();
    }

    @BeforeEach
    void cleanup() {
        jdbcTemplate.execute("DELETE FROM questionnaire_items");
        jdbcTemplate.execute("DELETE FROM questions");
        jdbcTemplate.execute("DELETE FROM questionnaires");
    }

    @Test
    void shouldInsertAndReadBackQuestionnaire() {
        // When
        Questionnaire created = questionnaires.createInstance(Map.of(
                "name", "Onboarding",
                "about", "Basic checks",
                "questionnaire_type", "verification")).orElseThrow();

        // Then
        assertThat(created.getId()).isPositive();
        assertThat(created.getCreatedAt()).isNotNull();

        Questionnaire loaded = questionnaires.getById(created.getId()).orElseThrow();
        assertThat(loaded.getName()).isEqualTo("Onboarding");
        assertThat(loaded.getAbout()).isEqualTo("Basic checks");
        assertThat(loaded.getQuestionnaireType()).isEqualTo(QuestionnaireType.VERIFICATION);
        assertThat(loaded.getQuestionnaireScope()).isEqualTo(QuestionnaireScope.DRAFT);
        assertThat(loaded.getStaffId()).isNull();
    }

    @Test
    void shouldReturnEmptyForMissingId() {
        assertThat(questionnaires.getById(999_999L)).isEmpty();
    }

    @Test
    void shouldFilterCountAndSliceInIdOrder() {
        // Given
        List<Long> publicIds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Questionnaire q = createQuestionnaire("Public " + i, QuestionnaireScope.PUBLIC);
            publicIds.add(q.getId());
        }
        createQuestionnaire("Draft", QuestionnaireScope.DRAFT);

        // When
        var publicQuery = questionnaires.filterBy(Map.of("questionnaire_scope", QuestionnaireScope.PUBLIC));

        // Then
        assertThat(publicQuery.count()).isEqualTo(5);
        assertThat(publicQuery.slice(1, 2)).extracting(Questionnaire::getId)
                .containsExactly(publicIds.get(1), publicIds.get(2));
        assertThat(publicQuery.slice(3, null)).hasSize(2);
        assertThat(publicQuery.first()).map(Questionnaire::getId).contains(publicIds.get(0));
        assertThat(questionnaires.count()).isEqualTo(6);
        assertThat(questionnaires.getAll().list()).hasSize(6);
    }

    @Test
    void shouldMatchAnyValueOfCollectionCriteria() {
        Questionnaire a = createQuestionnaire("A", QuestionnaireScope.DRAFT);
        createQuestionnaire("B", QuestionnaireScope.DRAFT);
        Questionnaire c = createQuestionnaire("C", QuestionnaireScope.DRAFT);

        List<Questionnaire> matched = questionnaires.filterBy(Map.of("id", List.of(a.getId(), c.getId()))).list();

        assertThat(matched).extracting(Questionnaire::getName).containsExactly("A", "C");
    }

    @Test
    void shouldMatchNullCriteria() {
        createQuestionnaire("No staff", QuestionnaireScope.DRAFT);

        Map<String, Object> criteria = new LinkedHashMap<>();
        criteria.put("staff_id", null);

        assertThat(questionnaires.exists(criteria)).isTrue();
    }

    @Test
    void shouldRejectUnknownFilterColumn() {
        assertThatThrownBy(() -> questionnaires.filterBy(Map.of("name; DROP TABLE questionnaires", "x")))
                .isInstanceOf(EntityValidationException.class)
                .hasMessageStartingWith("Unknown filter field");
    }

    @Test
    void shouldUpdateInstanceInPlace() {
        // Given
        Questionnaire created = createQuestionnaire("Before", QuestionnaireScope.DRAFT);

        // When
        questionnaires.updateInstance(created, Map.of("name", "After", "questionnaire_scope", "assigned"));

        // Then
        Questionnaire loaded = questionnaires.getById(created.getId()).orElseThrow();
        assertThat(loaded.getName()).isEqualTo("After");
        assertThat(loaded.getQuestionnaireScope()).isEqualTo(QuestionnaireScope.ASSIGNED);
    }

    @Test
    void shouldDeleteInstance() {
        Questionnaire created = createQuestionnaire("Doomed", QuestionnaireScope.DRAFT);

        questionnaires.deleteInstance(created);

        assertThat(questionnaires.getById(created.getId())).isEmpty();
    }

    @Test
    void shouldBulkCreateInBatchesAndAssignIds() {
        // Given
        List<Question> batch = List.of(
                question("Q-1", "First"),
                question("Q-2", "Second"),
                question("Q-3", "Third"));

        // When
        List<Question> created = questions.bulkCreateInstances(batch, 2);

        // Then
        assertThat(created).hasSize(3);
        assertThat(created).extracting(Question::getId).doesNotContainNull().isSorted();
        assertThat(questions.count()).isEqualTo(3);
    }

    @Test
    void shouldRoundTripValidationRulesAsJson() {
        Question created = questions.createInstance(Map.of(
                "question_type", "slider",
                "reference_code", "Q-RANGE",
                "text", "Monthly income",
                "validation_rules", Map.of("min", 0, "max", 10000))).orElseThrow();

        Question loaded = questions.getById(created.getId()).orElseThrow();

        assertThat(loaded.getQuestionType()).isEqualTo(QuestionType.SLIDER);
        assertThat(loaded.getValidationRules()).containsEntry("min", 0).containsEntry("max", 10000);
    }

    @Test
    void shouldBulkUpdateOnlyNamedFields() {
        // Given
        List<Question> created = questions.bulkCreateInstances(
                List.of(question("Q-A", "Old A"), question("Q-B", "Old B")), 10);
        created.forEach(q -> {
            q.setText("New " + q.getReferenceCode());
            q.setReferenceCode(q.getReferenceCode() + "-changed");
        });

        // When
        List<Question> updated = questions.bulkUpdateInstances(created, List.of("text"), 1);

        // Then
        assertThat(updated).hasSize(2);
        Question reloaded = questions.getById(created.get(0).getId()).orElseThrow();
        assertThat(reloaded.getText()).isEqualTo("New Q-A");
        assertThat(reloaded.getReferenceCode()).isEqualTo("Q-A");
    }

    @Test
    void shouldRejectBulkUpdateOfUnknownField() {
        Question q = questions.createInstance(Map.of(
                "question_type", "text", "reference_code", "Q-X", "text", "x")).orElseThrow();

        assertThatThrownBy(() -> questions.bulkUpdateInstances(List.of(q), List.of("id"), 10))
                .isInstanceOf(EntityValidationException.class);
    }

    @Test
    void shouldBulkDeleteMatchingRowsAndReturnThem() {
        // Given
        Questionnaire keep = createQuestionnaire("Keep", QuestionnaireScope.PUBLIC);
        Questionnaire drop1 = createQuestionnaire("Drop 1", QuestionnaireScope.DRAFT);
        Questionnaire drop2 = createQuestionnaire("Drop 2", QuestionnaireScope.DRAFT);

        // When
        List<Questionnaire> deleted = questionnaires.bulkDeleteInstances(Map.of("questionnaire_scope", "draft"));

        // Then
        assertThat(deleted).extracting(Questionnaire::getId).containsExactly(drop1.getId(), drop2.getId());
        assertThat(questionnaires.getById(keep.getId())).isPresent();
        assertThat(questionnaires.count()).isEqualTo(1);
    }

    @Test
    void shouldEnforceUniqueQuestionPerQuestionnaire() {
        // Given
        Questionnaire questionnaire = createQuestionnaire("With items", QuestionnaireScope.DRAFT);
        Question question = questions.createInstance(Map.of(
                "question_type", "text", "reference_code", "Q-U", "text", "Name")).orElseThrow();
        items.createInstance(Map.of(
                "questionnaire_id", questionnaire.getId(), "question_id", question.getId(), "order_index", 0));

        // When / Then
        assertThatThrownBy(() -> items.createInstance(Map.of(
                "questionnaire_id", questionnaire.getId(), "question_id", question.getId(), "order_index", 1)))
                .isInstanceOf(DataIntegrityViolationException.class);

        List<QuestionnaireItem> stored = items.filterBy(Map.of("questionnaire_id", questionnaire.getId())).list();
        assertThat(stored).singleElement().extracting(QuestionnaireItem::getOrderIndex).isEqualTo(0);
    }

    private Questionnaire createQuestionnaire(String name, QuestionnaireScope scope) {
        return questionnaires.createInstance(Map.of(
                "name", name,
                "questionnaire_type", QuestionnaireType.REGULAR,
                "questionnaire_scope", scope)).orElseThrow();
    }

    private static Question question(String referenceCode, String text) {
        return Question.fromFields(Map.of("question_type", "text", "reference_code", referenceCode, "text", text));
    }
}
