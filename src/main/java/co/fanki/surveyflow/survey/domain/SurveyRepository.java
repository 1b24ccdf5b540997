package co.fanki.surveyflow.survey.domain;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Repository for persisting and retrieving surveys.
 *
 * <p>Methods taking a {@link Handle} join the caller's transaction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class SurveyRepository {

    /** Find survey by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM surveys WHERE id = :id";

    /** Lock the survey row for the rest of the transaction. Uses: PK index. */
    public static final String LOCK_BY_ID =
            "SELECT * FROM surveys WHERE id = :id FOR UPDATE";

    private final Jdbi jdbi;

    /**
     * Creates a new SurveyRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public SurveyRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new survey.
     *
     * @param survey the survey to save
     */
    public void save(final Survey survey) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO surveys (
                    id, title, description, is_active, version,
                    created_at, updated_at
                ) VALUES (
                    :id, :title, :description, :active, :version,
                    :createdAt, :updatedAt
                )
                """)
                .bind("id", survey.id())
                .bind("title", survey.title())
                .bind("description", survey.description())
                .bind("active", survey.isActive())
                .bind("version", survey.version())
                .bind("createdAt", toTimestamp(survey.createdAt()))
                .bind("updatedAt", toTimestamp(survey.updatedAt()))
                .execute());
    }

    /**
     * Updates an existing survey inside the caller's transaction.
     *
     * @param handle the transactional handle
     * @param survey the survey to update
     */
    public void update(final Handle handle, final Survey survey) {
        handle.createUpdate("""
                UPDATE surveys SET
                    title = :title,
                    description = :description,
                    is_active = :active,
                    version = :version,
                    updated_at = :updatedAt
                WHERE id = :id
                """)
                .bind("id", survey.id())
                .bind("title", survey.title())
                .bind("description", survey.description())
                .bind("active", survey.isActive())
                .bind("version", survey.version())
                .bind("updatedAt", toTimestamp(survey.updatedAt()))
                .execute();
    }

    /**
     * Finds a survey by its ID.
     *
     * @param id the survey ID
     * @return the survey if found
     */
    public Optional<Survey> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new SurveyRowMapper())
                .findOne());
    }

    /**
     * Loads a survey and holds an exclusive row lock on it until the
     * caller's transaction ends.
     *
     * <p>Serializes every full replace of the same survey.</p>
     *
     * @param handle the transactional handle
     * @param id the survey ID
     * @return the locked survey if found
     */
    public Optional<Survey> lockById(final Handle handle, final String id) {
        return handle.createQuery(LOCK_BY_ID)
                .bind("id", id)
                .map(new SurveyRowMapper())
                .findOne();
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class SurveyRowMapper implements RowMapper<Survey> {

        @Override
        public Survey map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Survey.reconstitute(
                    rs.getString("id"),
                    rs.getString("title"),
                    rs.getString("description"),
                    rs.getBoolean("is_active"),
                    rs.getInt("version"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

}
