package com.callqueue.dispatch.directory.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class RealtimeMemberRepository {

    public record RealtimeMemberRow(
            String uniqueId,
            String queueName,
            String iface,
            String memberName,
            String stateInterface,
            int penalty,
            boolean paused,
            String reasonPaused,
            int wrapupSeconds,
            Boolean ringInUse
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public RealtimeMemberRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<RealtimeMemberRow> findByQueue(String queueName) {
        var sql = """
                select uniqueid, queue_name, interface, membername, state_interface,
                       penalty, paused, reason_paused, wrapuptime, ringinuse
                from queue_member
                where queue_name = ?
                order by uniqueid
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            var ringInUse = rs.getBoolean("ringinuse");
            var ringInUseSet = !rs.wasNull();
            return new RealtimeMemberRow(
                    rs.getString("uniqueid"),
                    rs.getString("queue_name"),
                    rs.getString("interface"),
                    rs.getString("membername"),
                    rs.getString("state_interface"),
                    rs.getInt("penalty"),
                    rs.getBoolean("paused"),
                    rs.getString("reason_paused"),
                    rs.getInt("wrapuptime"),
                    ringInUseSet ? ringInUse : null
            );
        }, queueName);
    }

    public int updatePaused(String uniqueId, boolean paused, String reason) {
        var sql = """
                update queue_member
                set paused = ?, reason_paused = ?
                where uniqueid = ?
                """;
        return jdbcTemplate.update(sql, paused, paused ? reason : null, uniqueId);
    }
}
