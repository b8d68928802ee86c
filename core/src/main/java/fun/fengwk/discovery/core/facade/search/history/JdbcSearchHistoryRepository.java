package fun.fengwk.discovery.core.facade.search.history;

import fun.fengwk.discovery.core.exception.StorageUnavailableException;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcSearchHistoryRepository implements SearchHistoryRepository {

    private static final String INSERT_SQL = """
        INSERT INTO search_history (id, user_id, search_text, status, created_at)
        VALUES (:id, :userId, :searchText, :status, :createdAt)
        """;

    private static final String SELECT_SQL = """
        SELECT id, user_id, search_text, status, created_at
        FROM search_history
        WHERE user_id = :userId AND status = 'ACTIVE'
        ORDER BY created_at DESC, id DESC
        LIMIT :limit OFFSET :offset
        """;

    private static final String COUNT_SQL = """
        SELECT COUNT(*) FROM search_history
        WHERE user_id = :userId AND status = 'ACTIVE'
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public SearchHistoryEntry save(SearchHistoryEntry entry) {
        SearchHistoryEntry stored = SearchHistoryEntry.builder()
            .id(entry.getId() == null ? UUID.randomUUID().toString() : entry.getId())
            .userId(entry.getUserId())
            .searchText(entry.getSearchText())
            .status(entry.getStatus() == null ? SearchHistoryEntry.STATUS_ACTIVE : entry.getStatus())
            .createdAt(entry.getCreatedAt())
            .build();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", stored.getId())
            .addValue("userId", stored.getUserId())
            .addValue("searchText", stored.getSearchText())
            .addValue("status", stored.getStatus())
            .addValue("createdAt", Timestamp.from(stored.getCreatedAt()));
        try {
            jdbcTemplate.update(INSERT_SQL, params);
            return stored;
        } catch (DataAccessException ex) {
            log.warn("save search history failed, userId={}, error={}", stored.getUserId(), ex.getMessage());
            throw new StorageUnavailableException("history store unavailable: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<SearchHistoryEntry> findByUserId(String userId, long offset, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("offset", offset)
            .addValue("limit", limit);
        try {
            return jdbcTemplate.query(SELECT_SQL, params, (rs, rowNum) -> mapEntry(rs));
        } catch (DataAccessException ex) {
            log.warn("read search history failed, userId={}, error={}", userId, ex.getMessage());
            throw new StorageUnavailableException("history store unavailable: " + ex.getMessage(), ex);
        }
    }

    @Override
    public long countByUserId(String userId) {
        try {
            Long count = jdbcTemplate.queryForObject(COUNT_SQL, new MapSqlParameterSource("userId", userId), Long.class);
            return count == null ? 0L : count;
        } catch (DataAccessException ex) {
            log.warn("count search history failed, userId={}, error={}", userId, ex.getMessage());
            throw new StorageUnavailableException("history store unavailable: " + ex.getMessage(), ex);
        }
    }

    private static SearchHistoryEntry mapEntry(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return SearchHistoryEntry.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .searchText(rs.getString("search_text"))
            .status(rs.getString("status"))
            .createdAt(createdAt == null ? null : createdAt.toInstant())
            .build();
    }

}
