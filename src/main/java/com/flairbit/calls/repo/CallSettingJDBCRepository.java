package com.flairbit.calls.repo;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;

@Repository
@RequiredArgsConstructor
public class CallSettingJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String SQL_FIND_ALL = "SELECT setting_key, setting_value FROM call_settings ORDER BY setting_key";

    private static final String SQL_UPDATE = """
        UPDATE call_settings SET setting_value = ?, updated_by = ?, updated_at = ? WHERE setting_key = ?
        """;

    private static final String SQL_INSERT = """
        INSERT INTO call_settings (setting_key, setting_value, updated_by, updated_at) VALUES (?, ?, ?, ?)
        """;

    public Map<String, String> findAll() {
        Map<String, String> settings = new LinkedHashMap<>();
        jdbc.query(SQL_FIND_ALL, rs -> {
            settings.put(rs.getString("setting_key"), rs.getString("setting_value"));
        });
        return settings;
    }

    public void upsert(String key, String value, UUID updatedBy, Instant at) {
        int updated = jdbc.update(SQL_UPDATE, value, updatedBy, from(at), key);
        if (updated == 0) {
            jdbc.update(SQL_INSERT, key, value, updatedBy, from(at));
        }
    }
}
