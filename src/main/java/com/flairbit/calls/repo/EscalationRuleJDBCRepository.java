package com.flairbit.calls.repo;

import com.flairbit.calls.models.EscalationRule;
import com.flairbit.calls.models.TriggerCondition;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.flairbit.calls.utils.SqlTimestamps.from;
import static com.flairbit.calls.utils.SqlTimestamps.instant;
import static com.flairbit.calls.utils.SqlTimestamps.uuid;

@Repository
@RequiredArgsConstructor
public class EscalationRuleJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, trigger_condition, threshold_seconds, escalate_to_role, priority_level, notification_channels,
        cooldown_seconds, active, created_at, updated_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO escalation_rules
        (id, trigger_condition, threshold_seconds, escalate_to_role, priority_level, notification_channels,
         cooldown_seconds, active, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SQL_UPDATE = """
        UPDATE escalation_rules
        SET trigger_condition = ?, threshold_seconds = ?, escalate_to_role = ?, priority_level = ?,
            notification_channels = ?, cooldown_seconds = ?, active = ?, updated_at = ?
        WHERE id = ?
        """;

    private static final String SQL_DEACTIVATE = """
        UPDATE escalation_rules SET active = false, updated_at = ? WHERE id = ?
        """;

    // lower priority_level value = evaluated first; ties go to the shortest threshold
    private static final String SQL_FIND_ACTIVE = "SELECT " + COLUMNS + """
         FROM escalation_rules
        WHERE active = true
        ORDER BY priority_level, threshold_seconds, created_at
        """;

    private static final String SQL_FIND_ALL = "SELECT " + COLUMNS + " FROM escalation_rules ORDER BY priority_level, threshold_seconds";

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM escalation_rules WHERE id = ?";

    public EscalationRule insert(EscalationRule rule) {
        jdbc.update(SQL_INSERT,
                rule.getId(),
                rule.getTriggerCondition().getValue(),
                rule.getThresholdSeconds(),
                rule.getEscalateToRole(),
                rule.getPriorityLevel(),
                joinChannels(rule.getNotificationChannels()),
                rule.getCooldownSeconds(),
                rule.isActive(),
                from(rule.getCreatedAt()),
                from(rule.getUpdatedAt()));
        return rule;
    }

    public boolean update(EscalationRule rule) {
        return jdbc.update(SQL_UPDATE,
                rule.getTriggerCondition().getValue(),
                rule.getThresholdSeconds(),
                rule.getEscalateToRole(),
                rule.getPriorityLevel(),
                joinChannels(rule.getNotificationChannels()),
                rule.getCooldownSeconds(),
                rule.isActive(),
                from(rule.getUpdatedAt()),
                rule.getId()) == 1;
    }

    public boolean deactivate(UUID id, Instant at) {
        return jdbc.update(SQL_DEACTIVATE, from(at), id) == 1;
    }

    public List<EscalationRule> findActive() {
        return jdbc.query(SQL_FIND_ACTIVE, new EscalationRuleRowMapper());
    }

    public List<EscalationRule> findAll() {
        return jdbc.query(SQL_FIND_ALL, new EscalationRuleRowMapper());
    }

    public Optional<EscalationRule> findById(UUID id) {
        return jdbc.query(SQL_FIND_BY_ID, new EscalationRuleRowMapper(), id).stream().findFirst();
    }

    private static String joinChannels(List<String> channels) {
        return String.join(",", channels);
    }

    private static class EscalationRuleRowMapper implements RowMapper<EscalationRule> {
        @Override
        public EscalationRule mapRow(ResultSet rs, int rowNum) throws SQLException {
            List<String> channels = Arrays.stream(rs.getString("notification_channels").split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
            return EscalationRule.builder()
                    .id(uuid(rs, "id"))
                    .triggerCondition(TriggerCondition.fromValue(rs.getString("trigger_condition")))
                    .thresholdSeconds(rs.getInt("threshold_seconds"))
                    .escalateToRole(rs.getString("escalate_to_role"))
                    .priorityLevel(rs.getInt("priority_level"))
                    .notificationChannels(channels)
                    .cooldownSeconds(rs.getInt("cooldown_seconds"))
                    .active(rs.getBoolean("active"))
                    .createdAt(instant(rs, "created_at"))
                    .updatedAt(instant(rs, "updated_at"))
                    .build();
        }
    }
}
