package co.fanki.surveyflow.response.domain;

import co.fanki.surveyflow.flow.domain.NavigationDeterminantJson;
import com.fasterxml.jackson.core.JsonProcessingException;
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
 * Repository for answers and their stamped steps.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class AnswerRepository {

    /** Answers of a response, oldest first. Uses: idx_answers_response. */
    public static final String FIND_BY_RESPONSE_ID = """
            SELECT * FROM answers
            WHERE response_id = :responseId
            ORDER BY created_at
            """;

    /** Most recent answer of a response. Uses: idx_answers_response. */
    public static final String FIND_LATEST_BY_RESPONSE_ID = """
            SELECT * FROM answers
            WHERE response_id = :responseId
            ORDER BY created_at DESC
            LIMIT 1
            """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Jdbi jdbi;

    /**
     * Creates a new AnswerRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public AnswerRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Inserts an answer inside the caller's transaction.
     *
     * @param handle the transactional handle
     * @param answer the answer to insert
     */
    public void insert(final Handle handle, final Answer answer) {
        handle.createUpdate("""
                INSERT INTO answers (
                    id, response_id, question_id, answer, next_step,
                    created_at
                ) VALUES (
                    :id, :responseId, :questionId, CAST(:answer AS JSONB),
                    CAST(:nextStep AS JSONB), :createdAt
                )
                """)
                .bind("id", answer.id())
                .bind("responseId", answer.responseId())
                .bind("questionId", answer.questionId())
                .bind("answer", writePayload(answer.payload()))
                .bind("nextStep", NavigationDeterminantJson.toJson(
                        answer.nextStep()))
                .bind("createdAt", Timestamp.from(answer.createdAt()))
                .execute();
    }

    /**
     * Removes the previous answer to a question inside the caller's
     * transaction, so it can be answered again.
     *
     * @param handle the transactional handle
     * @param responseId the response ID
     * @param questionId the question ID
     * @return the number of deleted answers
     */
    public int deleteByResponseAndQuestion(final Handle handle,
            final String responseId, final String questionId) {
        return handle.createUpdate("""
                DELETE FROM answers
                WHERE response_id = :responseId AND question_id = :questionId
                """)
                .bind("responseId", responseId)
                .bind("questionId", questionId)
                .execute();
    }

    /**
     * Finds the answers of a response, oldest first.
     *
     * @param responseId the response ID
     * @return the answers
     */
    public List<Answer> findByResponseId(final String responseId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_RESPONSE_ID)
                .bind("responseId", responseId)
                .map(new AnswerRowMapper())
                .list());
    }

    /**
     * Finds the most recent answer of a response.
     *
     * @param responseId the response ID
     * @return the latest answer, empty if nothing was answered yet
     */
    public Optional<Answer> findLatestByResponseId(final String responseId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_LATEST_BY_RESPONSE_ID)
                .bind("responseId", responseId)
                .map(new AnswerRowMapper())
                .findOne());
    }

    private static String writePayload(final AnswerPayload payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize answer", e);
        }
    }

    private static AnswerPayload readPayload(final String json) {
        try {
            return MAPPER.readValue(json, AnswerPayload.class);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse answer", e);
        }
    }

    private static final class AnswerRowMapper implements RowMapper<Answer> {

        @Override
        public Answer map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Answer.reconstitute(
                    rs.getString("id"),
                    rs.getString("response_id"),
                    rs.getString("question_id"),
                    readPayload(rs.getString("answer")),
                    NavigationDeterminantJson.fromJson(
                            rs.getString("next_step")),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
