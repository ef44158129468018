package com.vantage.storage;

import com.vantage.domain.CategoryValue;
import com.vantage.domain.ItemValuation;
import com.vantage.domain.PortfolioSummary;
import com.vantage.domain.ValuationMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to {@code item_valuations}.
 *
 * The current valuation of an item is its most recent row by {@code valued_at}.
 */
@Repository
public class ValuationRepository {

    private static final Logger log = LoggerFactory.getLogger(ValuationRepository.class);

    private static final String COLUMNS = "id, item_id, value, currency, method, confidence, notes, valued_by, valued_at";

    private static final RowMapper<ItemValuation> ROW_MAPPER = (rs, rowNum) -> {
        ItemValuation valuation = new ItemValuation();
        valuation.setId(rs.getString("id"));
        valuation.setItemId(rs.getString("item_id"));
        valuation.setValue(rs.getDouble("value"));
        valuation.setCurrency(rs.getString("currency"));
        valuation.setMethod(ValuationMethod.valueOf(rs.getString("method")));
        valuation.setConfidence(rs.getObject("confidence", Double.class));
        valuation.setNotes(rs.getString("notes"));
        valuation.setValuedBy(rs.getString("valued_by"));
        valuation.setValuedAt(rs.getObject("valued_at", OffsetDateTime.class));
        return valuation;
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public ValuationRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<ItemValuation> findByIds(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM item_valuations WHERE id IN (:ids)",
                Map.of("ids", ids), ROW_MAPPER);
    }

    public Optional<ItemValuation> findById(String id) {
        return findByIds(List.of(id)).stream().findFirst();
    }

    public List<ItemValuation> findByItemIds(List<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM item_valuations WHERE item_id IN (:ids)"
                + " ORDER BY valued_at DESC, id", Map.of("ids", itemIds), ROW_MAPPER);
    }

    public List<ItemValuation> findCurrentByItemIds(List<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT DISTINCT ON (item_id) " + COLUMNS + " FROM item_valuations"
                + " WHERE item_id IN (:ids) ORDER BY item_id, valued_at DESC, id", Map.of("ids", itemIds), ROW_MAPPER);
    }

    public ItemValuation insert(ItemValuation valuation) {
        jdbcTemplate.update("INSERT INTO item_valuations (" + COLUMNS + ") VALUES (:id, :itemId, :value, :currency, "
                + ":method, :confidence, :notes, :valuedBy, :valuedAt)", parameters(valuation));
        log.info("Stored valuation {} for item {}", valuation.getId(), valuation.getItemId());
        return valuation;
    }

    public ItemValuation update(ItemValuation valuation) {
        jdbcTemplate.update("UPDATE item_valuations SET value = :value, method = :method, confidence = :confidence, "
                + "notes = :notes, valued_by = :valuedBy, valued_at = :valuedAt WHERE id = :id", parameters(valuation));
        return valuation;
    }

    /**
     * Sums the current valuation of every item, grouped by item category.
     */
    public PortfolioSummary summarizeCurrentValues() {
        List<CategoryValue> categories = jdbcTemplate.query(
                "SELECT i.category, COALESCE(SUM(v.value), 0) AS total, COUNT(i.id) AS items FROM items i"
                        + " LEFT JOIN (SELECT DISTINCT ON (item_id) item_id, value FROM item_valuations"
                        + " ORDER BY item_id, valued_at DESC, id) v ON v.item_id = i.id"
                        + " GROUP BY i.category ORDER BY i.category",
                Map.of(),
                (rs, rowNum) -> new CategoryValue(rs.getString("category"), rs.getDouble("total"), rs.getInt("items")));
        Integer valued = jdbcTemplate.queryForObject(
                "SELECT COUNT(DISTINCT item_id) FROM item_valuations", Map.of(), Integer.class);

        PortfolioSummary summary = new PortfolioSummary();
        summary.setValueByCategory(categories);
        summary.setTotalValue(categories.stream().mapToDouble(CategoryValue::getValue).sum());
        summary.setItemCount(categories.stream().mapToInt(CategoryValue::getItemCount).sum());
        summary.setValuedItemCount(valued != null ? valued : 0);
        summary.setComputedAt(OffsetDateTime.now(ZoneOffset.UTC));
        return summary;
    }

    private MapSqlParameterSource parameters(ItemValuation valuation) {
        return new MapSqlParameterSource()
                .addValue("id", valuation.getId())
                .addValue("itemId", valuation.getItemId())
                .addValue("value", valuation.getValue())
                .addValue("currency", valuation.getCurrency())
                .addValue("method", valuation.getMethod().name())
                .addValue("confidence", valuation.getConfidence())
                .addValue("notes", valuation.getNotes())
                .addValue("valuedBy", valuation.getValuedBy())
                .addValue("valuedAt", valuation.getValuedAt());
    }
}
