package com.company.netperf.repository;

import com.company.netperf.domain.NetworkPerfRecord;
import com.company.netperf.domain.NetworkPerfSample;
import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.domain.enums.PathType;
import com.company.netperf.dto.response.NetworkPathResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only time series of network path measurements (table network_perf).
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class NetworkPerfRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, timestamp, source_host, dest_host, path_type, status,
               ping_min_ms, ping_avg_ms, ping_max_ms, ping_mdev_ms, ping_loss_pct,
               throughput_mbps, bytes_transferred, tcp_retrans, throughput_estimated,
               cold_mbps, write_mbps
        FROM network_perf
        """;

    /**
     * Append one row for a collected record
     */
    public NetworkPerfSample save(NetworkPerfRecord record) {
        NetworkPerfSample sample = NetworkPerfSample.fromRecord(record);

        String sql = """
            INSERT INTO network_perf (
                timestamp, source_host, dest_host, path_type, status,
                ping_min_ms, ping_avg_ms, ping_max_ms, ping_mdev_ms, ping_loss_pct,
                throughput_mbps, bytes_transferred, tcp_retrans, throughput_estimated,
                cold_mbps, write_mbps
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                    toUtc(sample.getTimestamp()),
                    sample.getSourceHost(),
                    sample.getDestHost(),
                    sample.getPathType() != null ? sample.getPathType().getValue() : null,
                    sample.getStatus() != null ? sample.getStatus().getValue() : null,
                    sample.getPingMinMs(),
                    sample.getPingAvgMs(),
                    sample.getPingMaxMs(),
                    sample.getPingMdevMs(),
                    sample.getPingLossPct(),
                    sample.getThroughputMbps(),
                    sample.getBytesTransferred(),
                    sample.getTcpRetrans(),
                    sample.getThroughputEstimated(),
                    sample.getColdMbps(),
                    sample.getWriteMbps()
            );

            log.debug("Stored network_perf row for {} ({})", sample.pathLabel(), sample.getStatus());
            return sample;

        } catch (Exception e) {
            log.error("Failed to store network_perf row for {}", sample.pathLabel(), e);
            throw new IllegalStateException("Failed to save network performance record", e);
        }
    }

    /**
     * Latest row for a path, or for any path when source or dest is null
     */
    public Optional<NetworkPerfSample> findLatest(String source, String dest) {
        List<Object> params = new ArrayList<>();
        String sql = SELECT_BASE + buildPathFilter(source, dest, params, false)
                + " ORDER BY timestamp DESC, id DESC LIMIT 1";

        List<NetworkPerfSample> results = jdbcTemplate.query(sql, new NetworkPerfRowMapper(), params.toArray());
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Rows newer than since, newest first. A null source or dest widens the query.
     */
    public List<NetworkPerfSample> findSince(String source, String dest, Instant since) {
        List<Object> params = new ArrayList<>();
        String sql = SELECT_BASE + buildPathFilter(source, dest, params, true)
                + " ORDER BY timestamp DESC, id DESC";
        params.add(toUtc(since));

        return jdbcTemplate.query(sql, new NetworkPerfRowMapper(), params.toArray());
    }

    /**
     * Distinct measured paths with the time of their latest measurement
     */
    public List<NetworkPathResponse> findPaths() {
        return jdbcTemplate.query("""
            SELECT source_host, dest_host, MAX(path_type) AS path_type,
                   COUNT(*) AS samples, MAX(timestamp) AS last_seen
            FROM network_perf
            GROUP BY source_host, dest_host
            ORDER BY source_host, dest_host
            """,
                (rs, rowNum) -> NetworkPathResponse.builder()
                        .sourceHost(rs.getString("source_host"))
                        .destHost(rs.getString("dest_host"))
                        .pathType(PathType.fromString(rs.getString("path_type")).getValue())
                        .samples(rs.getLong("samples"))
                        .lastSeen(getInstant(rs, "last_seen"))
                        .build());
    }

    private String buildPathFilter(String source, String dest, List<Object> params, boolean withSince) {
        List<String> clauses = new ArrayList<>();
        if (source != null && !source.isBlank()) {
            clauses.add("source_host = ?");
            params.add(source);
        }
        if (dest != null && !dest.isBlank()) {
            clauses.add("dest_host = ?");
            params.add(dest);
        }
        if (withSince) {
            clauses.add("timestamp > ?");
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    // timestamptz columns, bound and read as UTC offsets so the JVM zone never applies
    private static OffsetDateTime toUtc(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
        OffsetDateTime timestamp = rs.getObject(columnName, OffsetDateTime.class);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static class NetworkPerfRowMapper implements RowMapper<NetworkPerfSample> {
        @Override
        public NetworkPerfSample mapRow(ResultSet rs, int rowNum) throws SQLException {
            return NetworkPerfSample.builder()
                    .id(rs.getLong("id"))
                    .timestamp(getInstant(rs, "timestamp"))
                    .sourceHost(rs.getString("source_host"))
                    .destHost(rs.getString("dest_host"))
                    .pathType(PathType.fromString(rs.getString("path_type")))
                    .status(PathStatus.fromString(rs.getString("status")))
                    .pingMinMs(rs.getObject("ping_min_ms", Double.class))
                    .pingAvgMs(rs.getObject("ping_avg_ms", Double.class))
                    .pingMaxMs(rs.getObject("ping_max_ms", Double.class))
                    .pingMdevMs(rs.getObject("ping_mdev_ms", Double.class))
                    .pingLossPct(rs.getObject("ping_loss_pct", Double.class))
                    .throughputMbps(rs.getObject("throughput_mbps", Double.class))
                    .bytesTransferred(rs.getObject("bytes_transferred", Long.class))
                    .tcpRetrans(rs.getObject("tcp_retrans", Long.class))
                    .throughputEstimated(rs.getObject("throughput_estimated", Boolean.class))
                    .coldMbps(rs.getObject("cold_mbps", Double.class))
                    .writeMbps(rs.getObject("write_mbps", Double.class))
                    .build();
        }
    }
}
