package co.fanki.surveyflow.response.domain;

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
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving responses.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ResponseRepository {

    /** Find response by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM responses WHERE id = :id";

    /** Lock the response row for the rest of the transaction. */
    public static final String LOCK_BY_ID =
            "SELECT * FROM responses WHERE id = :id FOR UPDATE";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<String>> VISITED_TYPE =
            new TypeReference<>() { };

    private final Jdbi jdbi;

    /**
     * Creates a new ResponseRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public ResponseRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new response.
     *
     * @param response the response to save
     */
    public void save(final Response response) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO responses (
                    id, survey_id, respondent_id, is_complete, visited,
                    started_at, submitted_at
                ) VALUES (
                    :id, :surveyId, :respondentId, :complete,
                    CAST(:visited AS JSONB), :startedAt, :submittedAt
                )
                """)
                .bind("id", response.id())
                .bind("surveyId", response.surveyId())
                .bind("respondentId", response.respondentId())
                .bind("complete", response.isComplete())
                .bind("visited", writeVisited(response.visited()))
                .bind("startedAt", toTimestamp(response.startedAt()))
                .bind("submittedAt", toTimestamp(response.submittedAt()))
                .execute());
    }

    /**
     * Updates the state of a response inside the caller's transaction.
     *
     * @param handle the transactional handle
     * @param response the response to update
     */
    public void update(final Handle handle, final Response response) {
        handle.createUpdate("""
                UPDATE responses SET
                    is_complete = :complete,
                    visited = CAST(:visited AS JSONB),
                    submitted_at = :submittedAt
                WHERE id = :id
                """)
                .bind("id", response.id())
                .bind("complete", response.isComplete())
                .bind("visited", writeVisited(response.visited()))
                .bind("submittedAt", toTimestamp(response.submittedAt()))
                .execute();
    }

    /**
     * Finds a response by its ID.
     *
     * @param id the response ID
     * @return the response if found
     */
    public Optional<Response> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new ResponseRowMapper())
                .findOne());
    }

    /**
     * Loads a response and holds a row lock on it until the caller's
     * transaction ends.
     *
     * @param handle the transactional handle
     * @param id the response ID
     * @return the locked response if found
     */
    public Optional<Response> lockById(final Handle handle, final String id) {
        return handle.createQuery(LOCK_BY_ID)
                .bind("id", id)
                .map(new ResponseRowMapper())
                .findOne();
    }

    /**
     * Deletes every response of a survey inside the caller's transaction.
     *
     * <p>Their answers are removed by the database cascade.</p>
     *
     * @param handle the transactional handle
     * @param surveyId the survey ID
     * @return the number of deleted responses
     */
    public int deleteBySurveyId(final Handle handle, final String surveyId) {
        return handle.createUpdate(
                        "DELETE FROM responses WHERE survey_id = :surveyId")
                .bind("surveyId", surveyId)
                .execute();
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static String writeVisited(final List<String> visited) {
        try {
            return MAPPER.writeValueAsString(visited);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize visited"
                    + " questions", e);
        }
    }

    private static List<String> readVisited(final String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, VISITED_TYPE);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse visited"
                    + " questions", e);
        }
    }

    private static final class ResponseRowMapper
            implements RowMapper<Response> {

        @Override
        public Response map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp submittedAt = rs.getTimestamp("submitted_at");
            return Response.reconstitute(
                    rs.getString("id"),
                    rs.getString("survey_id"),
                    rs.getString("respondent_id"),
                    rs.getBoolean("is_complete"),
                    readVisited(rs.getString("visited")),
                    rs.getTimestamp("started_at").toInstant(),
                    submittedAt != null ? submittedAt.toInstant() : null);
        }
    }

}
