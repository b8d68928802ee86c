package fun.fengwk.discovery.core.facade.search.catalog;

import fun.fengwk.discovery.core.exception.StorageUnavailableException;
import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.CategorySummary;
import fun.fengwk.discovery.core.geo.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Catalog reader over the relational store.
 *
 * <p>Text, category, rating and bounding-box filters run in SQL; categories and locations are loaded
 * in two follow-up queries keyed by the matched ids.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcCatalogReader implements CatalogReader {

    private static final String BUSINESS_SQL = """
        SELECT b.id, b.name, b.username, b.logo_url, b.about, b.rating_sum, b.rating_count
        FROM business b
        WHERE b.status = 'ACTIVE'
          AND (LOWER(b.name) LIKE :pattern ESCAPE '\\'
            OR LOWER(b.username) LIKE :pattern ESCAPE '\\'
            OR LOWER(b.about) LIKE :pattern ESCAPE '\\')
        """;

    private static final String CATEGORY_FILTER_SQL = """
          AND EXISTS (SELECT 1 FROM business_category bc
                      WHERE bc.business_id = b.id AND bc.category_id IN (:categoryIds))
        """;

    // loose by the rounding half step, the caller applies the exact floor on the rounded rating
    private static final String RATING_FILTER_SQL = """
          AND b.rating_count > 0
          AND b.rating_sum >= (:minRating - 0.06) * b.rating_count
        """;

    private static final String BOX_FILTER_SQL = """
          AND EXISTS (SELECT 1 FROM business_location bl
                      WHERE bl.business_id = b.id
                        AND bl.latitude BETWEEN :minLatitude AND :maxLatitude
        """;

    private static final String BOX_LONGITUDE_SQL = """
                        AND bl.longitude BETWEEN :minLongitude AND :maxLongitude
        """;

    private static final String ORDER_SQL = """
        ORDER BY b.rating_count DESC, b.id ASC
        """;

    private static final String CATEGORIES_SQL = """
        SELECT bc.business_id, c.id, c.name
        FROM business_category bc
        JOIN category c ON c.id = bc.category_id
        WHERE bc.business_id IN (:ids)
        ORDER BY c.name ASC, c.id ASC
        """;

    private static final String LOCATIONS_SQL = """
        SELECT l.id, l.business_id, l.address, l.latitude, l.longitude, l.city, l.state, l.country
        FROM business_location l
        WHERE l.business_id IN (:ids)
        ORDER BY l.updated_at DESC, l.id ASC
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public List<CatalogBusinessRecord> findBusinesses(CatalogQuery query) {
        StringBuilder sql = new StringBuilder(BUSINESS_SQL);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("pattern", toLikePattern(query.getText()));
        if (query.getCategoryIds() != null && !query.getCategoryIds().isEmpty()) {
            sql.append(CATEGORY_FILTER_SQL);
            params.addValue("categoryIds", query.getCategoryIds());
        }
        if (query.getMinRating() != null) {
            sql.append(RATING_FILTER_SQL);
            params.addValue("minRating", query.getMinRating());
        }
        GeoMath.BoundingBox box = query.getBoundingBox();
        if (box != null) {
            sql.append(BOX_FILTER_SQL);
            params.addValue("minLatitude", box.minLatitude())
                .addValue("maxLatitude", box.maxLatitude());
            if (box.hasLongitudeBounds()) {
                sql.append(BOX_LONGITUDE_SQL);
                params.addValue("minLongitude", box.minLongitude())
                    .addValue("maxLongitude", box.maxLongitude());
            }
            sql.append("          )\n");
        }
        sql.append(ORDER_SQL);

        try {
            List<BusinessRow> rows = jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> mapBusiness(rs));
            if (rows.isEmpty()) {
                return List.of();
            }
            List<String> ids = rows.stream().map(BusinessRow::id).toList();
            Map<String, List<CategorySummary>> categories = loadCategories(ids);
            Map<String, List<BusinessLocation>> locations = loadLocations(ids);

            List<CatalogBusinessRecord> records = new ArrayList<>(rows.size());
            for (BusinessRow row : rows) {
                records.add(CatalogBusinessRecord.builder()
                    .id(row.id())
                    .name(row.name())
                    .username(row.username())
                    .logoUrl(row.logoUrl())
                    .about(row.about())
                    .ratingSum(row.ratingSum())
                    .ratingCount(row.ratingCount())
                    .categories(categories.getOrDefault(row.id(), List.of()))
                    .locations(locations.getOrDefault(row.id(), List.of()))
                    .build());
            }
            return records;
        } catch (DataAccessException ex) {
            log.warn("catalog query failed, text={}, error={}", query.getText(), ex.getMessage());
            throw new StorageUnavailableException("catalog store unavailable: " + ex.getMessage(), ex);
        }
    }

    private Map<String, List<CategorySummary>> loadCategories(List<String> ids) {
        Map<String, List<CategorySummary>> result = new LinkedHashMap<>();
        jdbcTemplate.query(CATEGORIES_SQL, Map.of("ids", ids), rs -> {
            result.computeIfAbsent(rs.getString("business_id"), key -> new ArrayList<>())
                .add(new CategorySummary(rs.getString("id"), rs.getString("name")));
        });
        return result;
    }

    private Map<String, List<BusinessLocation>> loadLocations(List<String> ids) {
        Map<String, List<BusinessLocation>> result = new LinkedHashMap<>();
        jdbcTemplate.query(LOCATIONS_SQL, Map.of("ids", ids), rs -> {
            BusinessLocation location = BusinessLocation.builder()
                .id(rs.getString("id"))
                .address(rs.getString("address"))
                .latitude(nullableDouble(rs, "latitude"))
                .longitude(nullableDouble(rs, "longitude"))
                .city(rs.getString("city"))
                .state(rs.getString("state"))
                .country(rs.getString("country"))
                .build();
            result.computeIfAbsent(rs.getString("business_id"), key -> new ArrayList<>()).add(location);
        });
        return result;
    }

    private static BusinessRow mapBusiness(ResultSet rs) throws SQLException {
        return new BusinessRow(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("username"),
            rs.getString("logo_url"),
            rs.getString("about"),
            rs.getDouble("rating_sum"),
            rs.getInt("rating_count")
        );
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static String toLikePattern(String text) {
        String lower = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        StringBuilder pattern = new StringBuilder(lower.length() + 2).append('%');
        for (char ch : lower.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == '\\') {
                pattern.append('\\');
            }
            pattern.append(ch);
        }
        return pattern.append('%').toString();
    }

    private record BusinessRow(String id, String name, String username, String logoUrl, String about,
                               double ratingSum, int ratingCount) {
    }

}
