package com.callqueue.dispatch.directory.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Serialized dynamic rosters keyed by queue name.
 */
@Repository
public class PersistedMemberRepository {

    private final JdbcTemplate jdbcTemplate;

    public PersistedMemberRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> findRoster(String queueName) {
        var sql = "select members_json from queue_persisted_member where queue_name = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("members_json"), queueName);
        return list.stream().findFirst();
    }

    public void upsertRoster(String queueName, String membersJson) {
        var pgUpsert = """
                insert into queue_persisted_member(queue_name, members_json, updated_at)
                values (?, ?, now())
                on conflict (queue_name) do update set members_json = excluded.members_json, updated_at = now()
                """;
        var h2Merge = """
                merge into queue_persisted_member key(queue_name)
                values (?, ?, current_timestamp)
                """;
        try {
            jdbcTemplate.update(pgUpsert, queueName, membersJson);
        } catch (Exception ignored) {
            jdbcTemplate.update(h2Merge, queueName, membersJson);
        }
    }

    public void deleteRoster(String queueName) {
        jdbcTemplate.update("delete from queue_persisted_member where queue_name = ?", queueName);
    }
}
