package com.kyc.platform;

import com.kyc.platform.application.ManageQuestionnaires;
import com.kyc.platform.domain.exception.EntityNotFoundException;
import com.kyc.platform.domain.exception.EntityValidationException;
import com.kyc.platform.domain.model.PageResult;
import com.kyc.platform.domain.model.Question;
import com.kyc.platform.domain.model.Questionnaire;
import com.kyc.platform.domain.model.QuestionnaireItem;
import com.kyc.platform.domain.model.QuestionnaireScope;
import com.kyc.platform.domain.port.out.EntityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = KycPlatformApplication.class)
@Testcontainers
@TestPropertySource(properties = {
        "kyc.repository.cache.enabled=true",
        "kyc.repository.cache.store=redis",
        "logging.level.com.kyc.platform=DEBUG"
})
class KycPlatformFullIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("kyc_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--save", "", "--appendonly", "no");

    @Autowired
    private ManageQuestionnaires questionnaires;

    @Autowired
    private EntityRepository<Question> questionRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        redis.start();

        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);

        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379));
    }

    @BeforeEach
    void cleanState() {
        jdbcTemplate.execute("TRUNCATE TABLE questionnaire_items, questions, questionnaires RESTART IDENTITY CASCADE");
        Set<String> keys = redisTemplate.keys("*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    @Test
    void shouldCacheQuestionnaireInRedisAndServeUpdates() {
        // Given
        Questionnaire created = questionnaires.createQuestionnaire(Map.of(
                "name", "Onboarding", "questionnaire_type", "verification"));

        // When
        assertThat(questionnaires.getQuestionnaire(created.getId())).isPresent();

        // Then
        String key = "questionnaire.questionnaire." + created.getId();
        assertThat(redisTemplate.hasKey(key)).isTrue();

        questionnaires.updateQuestionnaire(created.getId(), Map.of("name", "Onboarding v2"));
        assertThat(redisTemplate.hasKey(key)).isFalse();
        assertThat(questionnaires.getQuestionnaire(created.getId()))
                .map(Questionnaire::getName)
                .contains("Onboarding v2");
    }

    @Test
    void shouldListQuestionnairesByScope() {
        // Given
        questionnaires.createQuestionnaire(Map.of(
                "name", "Draft one", "questionnaire_type", "regular"));
        questionnaires.createQuestionnaire(Map.of(
                "name", "Public one", "questionnaire_type", "regular", "questionnaire_scope", "public"));
        questionnaires.createQuestionnaire(Map.of(
                "name", "Public two", "questionnaire_type", "verification", "questionnaire_scope", "public"));

        // When
        PageResult<Questionnaire> page = questionnaires.listQuestionnaires(QuestionnaireScope.PUBLIC, null, 1, 10);

        // Then
        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.entities()).extracting(Questionnaire::getName)
                .containsExactly("Public one", "Public two");
    }

    @Test
    void shouldAppendQuestionsInOrder() {
        // Given
        Questionnaire questionnaire = questionnaires.createQuestionnaire(Map.of(
                "name", "Source of funds", "questionnaire_type", "regular"));
        Question income = questionRepository.create(Map.of(
                "question_type", "text", "reference_code", "Q-INCOME", "text", "Monthly income"));
        Question employer = questionRepository.create(Map.of(
                "question_type", "text", "reference_code", "Q-EMPLOYER", "text", "Employer"));

        // When
        questionnaires.addQuestion(questionnaire.getId(), income.getId());
        questionnaires.addQuestion(questionnaire.getId(), employer.getId());

        // Then
        List<QuestionnaireItem> items = questionnaires.listQuestions(questionnaire.getId());
        assertThat(items).extracting(QuestionnaireItem::getQuestionId)
                .containsExactly(income.getId(), employer.getId());
        assertThat(items).extracting(QuestionnaireItem::getOrderIndex).containsExactly(0, 1);

        assertThatThrownBy(() -> questionnaires.addQuestion(questionnaire.getId(), income.getId()))
                .isInstanceOf(EntityValidationException.class)
                .hasMessageContaining("already part of questionnaire");
    }

    @Test
    void shouldRejectQuestionsForMissingQuestionnaire() {
        assertThatThrownBy(() -> questionnaires.listQuestions(404L))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessage("Questionnaire with ID 404 not found");
    }
}
