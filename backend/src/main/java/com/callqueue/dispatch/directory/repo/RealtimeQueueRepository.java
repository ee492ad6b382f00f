package com.callqueue.dispatch.directory.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;

@Repository
public class RealtimeQueueRepository {

    public record ParamRow(String queueName, String paramName, String paramValue) {
    }

    private final JdbcTemplate jdbcTemplate;

    public RealtimeQueueRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return queue name to its parameter map
     */
    public Map<String, Map<String, String>> loadAll() {
        var sql = """
                select queue_name, param_name, param_value
                from queue_config
                order by queue_name, param_name
                """;
        var rows = jdbcTemplate.query(sql, (rs, rowNum) -> new ParamRow(
                rs.getString("queue_name"),
                rs.getString("param_name"),
                rs.getString("param_value")
        ));
        var out = new LinkedHashMap<String, Map<String, String>>();
        for (var row : rows) {
            if (row.queueName() == null || row.paramName() == null) continue;
            out.computeIfAbsent(row.queueName(), k -> new LinkedHashMap<>()).put(row.paramName(), row.paramValue());
        }
        return out;
    }

    public void upsertParam(String queueName, String paramName, String paramValue) {
        var pgUpsert = """
                insert into queue_config(queue_name, param_name, param_value)
                values (?, ?, ?)
                on conflict (queue_name, param_name) do update set param_value = excluded.param_value
                """;
        var h2Merge = """
                merge into queue_config key(queue_name, param_name)
                values (?, ?, ?)
                """;
        try {
            jdbcTemplate.update(pgUpsert, queueName, paramName, paramValue);
        } catch (Exception ignored) {
            jdbcTemplate.update(h2Merge, queueName, paramName, paramValue);
        }
    }
}
