package com.vantage.storage;

import com.vantage.domain.PriceRecord;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to the append-only {@code price_history} table.
 */
@Repository
public class PriceHistoryRepository {

    private static final String COLUMNS = "id, item_id, price, price_type, source, recorded_at";

    private static final RowMapper<PriceRecord> ROW_MAPPER = (rs, rowNum) -> {
        PriceRecord record = new PriceRecord();
        record.setId(rs.getString("id"));
        record.setItemId(rs.getString("item_id"));
        record.setPrice(rs.getDouble("price"));
        record.setPriceType(rs.getString("price_type"));
        record.setSource(rs.getString("source"));
        record.setRecordedAt(rs.getObject("recorded_at", OffsetDateTime.class));
        return record;
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public PriceHistoryRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<PriceRecord> findByItemIds(List<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM price_history WHERE item_id IN (:ids)"
                + " ORDER BY recorded_at DESC, id", Map.of("ids", itemIds), ROW_MAPPER);
    }

    public Optional<PriceRecord> findLatest(String itemId, String priceType) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM price_history WHERE item_id = :itemId"
                                + " AND price_type = :priceType ORDER BY recorded_at DESC, id DESC LIMIT 1",
                        Map.of("itemId", itemId, "priceType", priceType), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    public PriceRecord insert(PriceRecord record) {
        jdbcTemplate.update("INSERT INTO price_history (" + COLUMNS + ") VALUES (:id, :itemId, :price, :priceType, "
                        + ":source, :recordedAt)",
                new MapSqlParameterSource()
                        .addValue("id", record.getId())
                        .addValue("itemId", record.getItemId())
                        .addValue("price", record.getPrice())
                        .addValue("priceType", record.getPriceType())
                        .addValue("source", record.getSource())
                        .addValue("recordedAt", record.getRecordedAt()));
        return record;
    }
}
