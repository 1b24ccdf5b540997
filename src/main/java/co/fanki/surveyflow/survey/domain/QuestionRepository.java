package co.fanki.surveyflow.survey.domain;

import co.fanki.surveyflow.flow.domain.FlowGraph;
import co.fanki.surveyflow.flow.domain.NavigationDeterminantJson;
import co.fanki.surveyflow.flow.domain.QuestionKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving questions and their navigation.
 *
 * <p>Methods taking a {@link Handle} join the caller's transaction; the
 * batch compiler uses them to replace a survey's questions atomically.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class QuestionRepository {

    /** Find question by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM questions WHERE id = :id";

    /** Find questions of a survey in order. Uses: idx_questions_survey_order. */
    public static final String FIND_BY_SURVEY_ID = """
            SELECT * FROM questions
            WHERE survey_id = :surveyId
            ORDER BY order_index
            """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<String>> OPTIONS_TYPE =
            new TypeReference<>() { };

    private final Jdbi jdbi;

    /**
     * Creates a new QuestionRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public QuestionRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Inserts a question inside the caller's transaction.
     *
     * @param handle the transactional handle
     * @param question the question to insert
     */
    public void insert(final Handle handle, final Question question) {
        handle.createUpdate("""
                INSERT INTO questions (
                    id, survey_id, order_index, question_text, question_kind,
                    is_required, options, default_next, option_next,
                    created_at
                ) VALUES (
                    :id, :surveyId, :orderIndex, :text, :kind,
                    :required, CAST(:options AS JSONB),
                    CAST(:defaultNext AS JSONB), CAST(:optionNext AS JSONB),
                    :createdAt
                )
                """)
                .bind("id", question.id())
                .bind("surveyId", question.surveyId())
                .bind("orderIndex", question.orderIndex())
                .bind("text", question.text())
                .bind("kind", question.kind().name())
                .bind("required", question.required())
                .bind("options", writeOptions(question.options()))
                .bind("defaultNext", NavigationDeterminantJson.toJson(
                        question.defaultNext()))
                .bind("optionNext", NavigationDeterminantJson.overridesToJson(
                        question.optionNext()))
                .bind("createdAt", Timestamp.from(question.createdAt()))
                .execute();
    }

    /**
     * Writes the navigation of a question inside the caller's transaction.
     *
     * @param handle the transactional handle
     * @param question the question whose flow to write
     */
    public void updateFlow(final Handle handle, final Question question) {
        handle.createUpdate("""
                UPDATE questions SET
                    default_next = CAST(:defaultNext AS JSONB),
                    option_next = CAST(:optionNext AS JSONB)
                WHERE id = :id
                """)
                .bind("id", question.id())
                .bind("defaultNext", NavigationDeterminantJson.toJson(
                        question.defaultNext()))
                .bind("optionNext", NavigationDeterminantJson.overridesToJson(
                        question.optionNext()))
                .execute();
    }

    /**
     * Deletes every question of a survey inside the caller's transaction.
     *
     * <p>Answers to those questions are removed by the database cascade.</p>
     *
     * @param handle the transactional handle
     * @param surveyId the survey ID
     * @return the number of deleted questions
     */
    public int deleteBySurveyId(final Handle handle, final String surveyId) {
        return handle.createUpdate(
                        "DELETE FROM questions WHERE survey_id = :surveyId")
                .bind("surveyId", surveyId)
                .execute();
    }

    /**
     * Finds the questions of a survey in order position.
     *
     * @param surveyId the survey ID
     * @return the ordered questions
     */
    public List<Question> findBySurveyId(final String surveyId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_SURVEY_ID)
                .bind("surveyId", surveyId)
                .map(new QuestionRowMapper())
                .list());
    }

    /**
     * Finds a question by its ID.
     *
     * @param id the question ID
     * @return the question if found
     */
    public Optional<Question> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new QuestionRowMapper())
                .findOne());
    }

    /**
     * Loads the persisted flow graph of a survey.
     *
     * @param surveyId the survey ID
     * @return the id-addressed graph, empty if the survey has no questions
     */
    public FlowGraph<String> findGraphBySurveyId(final String surveyId) {
        return FlowGraph.of(findBySurveyId(surveyId).stream()
                .map(Question::toFlowNode)
                .toList());
    }

    private static String writeOptions(final List<String> options) {
        try {
            return MAPPER.writeValueAsString(options);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize options", e);
        }
    }

    private static List<String> readOptions(final String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, OPTIONS_TYPE);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse options", e);
        }
    }

    private static final class QuestionRowMapper
            implements RowMapper<Question> {

        @Override
        public Question map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Question.reconstitute(
                    rs.getString("id"),
                    rs.getString("survey_id"),
                    rs.getInt("order_index"),
                    rs.getString("question_text"),
                    QuestionKind.valueOf(rs.getString("question_kind")),
                    rs.getBoolean("is_required"),
                    readOptions(rs.getString("options")),
                    NavigationDeterminantJson.fromJson(
                            rs.getString("default_next")),
                    NavigationDeterminantJson.overridesFromJson(
                            rs.getString("option_next")),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
