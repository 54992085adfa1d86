package ch.so.arp.rag.qa;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.util.StringUtils;

/**
 * {@link QuestionTree} backed by a single relational table. Each operation runs
 * as one auto-committed statement, so a successful call is durable.
 */
class JdbcQuestionTree implements QuestionTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQuestionTree.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS question_nodes (
              id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
              question VARCHAR NOT NULL,
              answer VARCHAR,
              parent_id BIGINT REFERENCES question_nodes(id)
            )
            """;

    private static final String SELECT_COLUMNS = "SELECT id, question, answer, parent_id FROM question_nodes";

    private final JdbcClient jdbcClient;

    JdbcQuestionTree(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        jdbcClient.sql(CREATE_TABLE_SQL).update();
        LOGGER.info("Question tree table initialised");
    }

    @Override
    public long addQuestion(String question, Long parentId) {
        if (!StringUtils.hasText(question)) {
            throw new IllegalArgumentException("question must not be blank");
        }
        if (parentId != null && !exists(parentId)) {
            throw new QuestionReferenceException("Parent question " + parentId + " does not exist");
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql("INSERT INTO question_nodes (question, parent_id) VALUES (:question, :parentId)")
                .param("question", question)
                .param("parentId", parentId)
                .update(keyHolder);
        // drivers differ in how many generated columns they return, the id is always among them
        Map<String, Object> keys = keyHolder.getKeys();
        Object key = keys == null ? null : keys.get("id");
        if (!(key instanceof Number)) {
            throw new IllegalStateException("No id generated for question '" + question + "'");
        }
        LOGGER.debug("Stored question {} under parent {}", key, parentId);
        return ((Number) key).longValue();
    }

    @Override
    public QuestionNode getQuestion(long id) {
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE id = :id")
                .param("id", id)
                .query(QuestionNodeMapper.INSTANCE)
                .optional()
                .orElseThrow(() -> QuestionNotFoundException.forId(id));
    }

    @Override
    public List<QuestionNode> getChildren(long id) {
        requireExisting(id);
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE parent_id = :id ORDER BY id")
                .param("id", id)
                .query(QuestionNodeMapper.INSTANCE)
                .list();
    }

    @Override
    public void updateAnswer(long id, String answer) {
        int updated = jdbcClient.sql("UPDATE question_nodes SET answer = :answer WHERE id = :id")
                .param("answer", answer)
                .param("id", id)
                .update();
        if (updated == 0) {
            throw QuestionNotFoundException.forId(id);
        }
        LOGGER.debug("Answer of question {} updated", id);
    }

    @Override
    public boolean isAnswered(long id) {
        return getQuestion(id).isAnswered();
    }

    @Override
    public List<QuestionNode> getAllQuestions() {
        return jdbcClient.sql(SELECT_COLUMNS + " ORDER BY id").query(QuestionNodeMapper.INSTANCE).list();
    }

    @Override
    public List<QuestionNode> getUnansweredQuestions() {
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE answer IS NULL ORDER BY id")
                .query(QuestionNodeMapper.INSTANCE)
                .list();
    }

    @Override
    public List<QuestionNode> getAnsweredQuestions() {
        return jdbcClient.sql(SELECT_COLUMNS + " WHERE answer IS NOT NULL ORDER BY id")
                .query(QuestionNodeMapper.INSTANCE)
                .list();
    }

    @Override
    public QuestionTreeView buildTree() {
        return QuestionTreeView.of(getAllQuestions());
    }

    private boolean exists(long id) {
        return jdbcClient.sql("SELECT COUNT(*) FROM question_nodes WHERE id = :id")
                .param("id", id)
                .query(Long.class)
                .single() > 0;
    }

    private void requireExisting(long id) {
        if (!exists(id)) {
            throw QuestionNotFoundException.forId(id);
        }
    }

    private enum QuestionNodeMapper implements RowMapper<QuestionNode> {
        INSTANCE;

        @Override
        public QuestionNode mapRow(ResultSet rs, int rowNum) throws SQLException {
            long parentId = rs.getLong("parent_id");
            Long parent = rs.wasNull() ? null : parentId;
            return new QuestionNode(rs.getLong("id"), rs.getString("question"), rs.getString("answer"), parent);
        }
    }
}
