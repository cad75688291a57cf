package com.example.Lily.repository;

import com.example.Lily.model.CatalogPart;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only, parameterized queries over the imported {@code parts} table.
 */
@Repository
@RequiredArgsConstructor
public class PartsCatalogRepository {

    private static final String COLUMNS = """
            part_name, part_id, mpn_id, part_price, install_difficulty, install_time,
            symptoms, appliance_types, replace_parts, brand, availability,
            install_video_url, product_url
            """;

    private static final int MAX_TERMS = 6;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "have", "what", "how",
            "does", "are", "you", "can", "not", "need", "part", "parts", "my"
    );

    private final JdbcTemplate jdbcTemplate;

    public List<CatalogPart> findByNumber(String partId, String mpnId, int limit) {
        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (partId != null) {
            conditions.add("UPPER(part_id) = ?");
            args.add(upper(partId));
        }
        if (mpnId != null) {
            conditions.add("UPPER(mpn_id) = ?");
            args.add(upper(mpnId));
        }
        if (conditions.isEmpty()) {
            return List.of();
        }
        args.add(limit);

        String sql = "SELECT " + COLUMNS + " FROM parts WHERE " + String.join(" OR ", conditions) + " LIMIT ?";
        return jdbcTemplate.query(sql, new CatalogPartRowMapper(), args.toArray());
    }

    /**
     * Keyword search. A row matches when any search term appears in its name, symptoms or
     * replaced parts; rows with more name hits come first.
     */
    public List<CatalogPart> search(String keyword, String appliance, String brand, int limit) {
        List<String> terms = terms(keyword);
        if (terms.isEmpty()) {
            return List.of();
        }

        List<String> scoreParts = new ArrayList<>();
        List<String> matchParts = new ArrayList<>();
        List<Object> scoreArgs = new ArrayList<>();
        List<Object> matchArgs = new ArrayList<>();
        for (String term : terms) {
            String like = "%" + term + "%";
            scoreParts.add("(CASE WHEN LOWER(part_name) LIKE ? THEN 2 ELSE 0 END"
                    + " + CASE WHEN LOWER(symptoms) LIKE ? THEN 1 ELSE 0 END"
                    + " + CASE WHEN LOWER(replace_parts) LIKE ? THEN 1 ELSE 0 END)");
            scoreArgs.add(like);
            scoreArgs.add(like);
            scoreArgs.add(like);
            matchParts.add("LOWER(part_name) LIKE ? OR LOWER(symptoms) LIKE ? OR LOWER(replace_parts) LIKE ?");
            matchArgs.add(like);
            matchArgs.add(like);
            matchArgs.add(like);
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(", ").append(String.join(" + ", scoreParts)).append(" AS score")
                .append(" FROM parts WHERE (").append(String.join(" OR ", matchParts)).append(")");
        List<Object> args = new ArrayList<>(scoreArgs);
        args.addAll(matchArgs);

        if (appliance != null && !appliance.isBlank()) {
            sql.append(" AND LOWER(appliance_types) LIKE ?");
            args.add("%" + appliance.toLowerCase(Locale.ROOT) + "%");
        }
        if (brand != null && !brand.isBlank()) {
            sql.append(" AND LOWER(brand) = ?");
            args.add(brand.toLowerCase(Locale.ROOT));
        }
        sql.append(" ORDER BY score DESC LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(sql.toString(), new CatalogPartRowMapper(), args.toArray());
    }

    static List<String> terms(String keyword) {
        if (keyword == null) {
            return List.of();
        }
        return Arrays.stream(keyword.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(t -> t.length() >= 3)
                .filter(t -> !STOP_WORDS.contains(t))
                .distinct()
                .limit(MAX_TERMS)
                .toList();
    }

    private static String upper(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private static class CatalogPartRowMapper implements RowMapper<CatalogPart> {
        @Override
        public CatalogPart mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CatalogPart(
                    rs.getString("part_name"),
                    rs.getString("part_id"),
                    rs.getString("mpn_id"),
                    rs.getBigDecimal("part_price"),
                    rs.getString("install_difficulty"),
                    rs.getString("install_time"),
                    rs.getString("symptoms"),
                    rs.getString("appliance_types"),
                    rs.getString("replace_parts"),
                    rs.getString("brand"),
                    rs.getString("availability"),
                    rs.getString("install_video_url"),
                    rs.getString("product_url")
            );
        }
    }
}
