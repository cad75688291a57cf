package com.example.Lily.tools;

import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.CatalogPart;
import com.example.Lily.model.ToolCall;
import com.example.Lily.repository.PartsCatalogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured lookups in the parts catalog: by part number, or by keyword with optional filters.
 */
@Component
@RequiredArgsConstructor
public class PartsCatalogTool implements RetrievalTool {

    public static final String NAME = "queryParts";

    private static final int MAX_LIMIT = 20;

    private final PartsCatalogRepository partsCatalogRepository;
    private final LilyProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return """
                Look up parts in the catalog. Rows carry part name, PartSelect number (part_id),
                manufacturer number (mpn_id), price, install difficulty and time, symptoms fixed,
                appliance types, replaced parts, brand, availability and URLs.
                Give part_id or mpn_id for an exact lookup, otherwise a keyword.
                """;
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("part_id", "optional PartSelect number, e.g. PS11752778");
        params.put("mpn_id", "optional manufacturer part number");
        params.put("keyword", "optional words matched against part name, symptoms and replaced parts");
        params.put("appliance", "optional appliance type filter, e.g. refrigerator or dishwasher");
        params.put("brand", "optional brand filter, e.g. Whirlpool");
        params.put("limit", "optional max rows, default " + properties.getRetrieval().getCatalogLimit());
        return params;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String partId = RetrievalTool.stringArg(arguments, "part_id");
        String mpnId = RetrievalTool.stringArg(arguments, "mpn_id");
        String keyword = RetrievalTool.stringArg(arguments, "keyword");
        int limit = resolveLimit(RetrievalTool.stringArg(arguments, "limit"));

        List<CatalogPart> parts;
        try {
            if (partId != null || mpnId != null) {
                parts = partsCatalogRepository.findByNumber(partId, mpnId, limit);
            } else if (keyword != null) {
                parts = partsCatalogRepository.search(
                        keyword,
                        RetrievalTool.stringArg(arguments, "appliance"),
                        RetrievalTool.stringArg(arguments, "brand"),
                        limit
                );
            } else {
                throw new RetrievalException("Give part_id, mpn_id or keyword");
            }
        } catch (DataAccessException e) {
            throw new RetrievalException("Catalog query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
        return parts.isEmpty() ? "No matching parts found." : parts;
    }

    @Override
    public Optional<ToolCall> defaultCall(String query) {
        return Optional.of(new ToolCall(NAME, Map.of("keyword", query)));
    }

    private int resolveLimit(String raw) {
        int defaultLimit = properties.getRetrieval().getCatalogLimit();
        if (raw == null) {
            return defaultLimit;
        }
        try {
            int parsed = Integer.parseInt(raw);
            return parsed <= 0 ? defaultLimit : Math.min(parsed, MAX_LIMIT);
        } catch (NumberFormatException e) {
            return defaultLimit;
        }
    }
}
