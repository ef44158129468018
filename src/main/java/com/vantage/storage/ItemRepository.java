package com.vantage.storage;

import com.vantage.domain.Item;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Repository
public class ItemRepository {

    private static final RowMapper<Item> ROW_MAPPER = (rs, rowNum) -> {
        Item item = new Item();
        item.setId(rs.getString("id"));
        item.setName(rs.getString("name"));
        item.setCategory(rs.getString("category"));
        item.setDescription(rs.getString("description"));
        item.setAcquisitionPrice(rs.getObject("acquisition_price", Double.class));
        item.setAcquiredAt(rs.getObject("acquired_at", OffsetDateTime.class));
        return item;
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public ItemRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Item> findByIds(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT id, name, category, description, acquisition_price, acquired_at"
                + " FROM items WHERE id IN (:ids)", Map.of("ids", ids), ROW_MAPPER);
    }
}
