package com.hubzone.designations.importer.persistence;

import com.hubzone.designations.importer.model.CacheEntry;
import com.hubzone.designations.importer.model.CacheStats;
import com.hubzone.designations.importer.model.DatasetSource;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class DatasetCacheJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final SqlDialect dialect;

    private final RowMapper<CacheEntry> rowMapper = (rs, rowNum) -> new CacheEntry(
        rs.getString("cache_key"),
        DatasetSource.valueOf(rs.getString("source_id")),
        rs.getString("state_fips"),
        rs.getString("source_url"),
        rs.getString("local_path"),
        toInstant(rs.getTimestamp("downloaded_at")),
        toInstant(rs.getTimestamp("expires_at")),
        rs.getString("checksum"),
        rs.getLong("byte_size")
    );

    public DatasetCacheJdbcRepository(NamedParameterJdbcTemplate jdbc, SqlDialect dialect) {
        this.jdbc = jdbc;
        this.dialect = dialect;
    }

    public CacheEntry findByKey(String cacheKey) {
        List<CacheEntry> rows = jdbc.query(
            """
                SELECT cache_key, source_id, state_fips, source_url, local_path,
                       downloaded_at, expires_at, checksum, byte_size
                FROM dataset_cache_entries
                WHERE cache_key = :cacheKey
                """,
            new MapSqlParameterSource("cacheKey", cacheKey),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<CacheEntry> findExpired(Instant now) {
        return jdbc.query(
            """
                SELECT cache_key, source_id, state_fips, source_url, local_path,
                       downloaded_at, expires_at, checksum, byte_size
                FROM dataset_cache_entries
                WHERE expires_at <= :now
                ORDER BY cache_key
                """,
            new MapSqlParameterSource("now", toTimestamp(now)),
            rowMapper
        );
    }

    public List<CacheEntry> findAll() {
        return jdbc.query(
            """
                SELECT cache_key, source_id, state_fips, source_url, local_path,
                       downloaded_at, expires_at, checksum, byte_size
                FROM dataset_cache_entries
                ORDER BY cache_key
                """,
            rowMapper
        );
    }

    public void upsert(CacheEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cacheKey", entry.cacheKey())
            .addValue("sourceId", entry.source().name())
            .addValue("stateFips", entry.stateFips())
            .addValue("sourceUrl", entry.sourceUrl())
            .addValue("localPath", entry.localPath())
            .addValue("downloadedAt", toTimestamp(entry.downloadedAt()))
            .addValue("expiresAt", toTimestamp(entry.expiresAt()))
            .addValue("checksum", entry.checksum())
            .addValue("byteSize", entry.byteSize());
        if (dialect.isPostgres()) {
            jdbc.update(
                """
                    INSERT INTO dataset_cache_entries (
                        cache_key, source_id, state_fips, source_url, local_path,
                        downloaded_at, expires_at, checksum, byte_size
                    )
                    VALUES (
                        :cacheKey, :sourceId, :stateFips, :sourceUrl, :localPath,
                        :downloadedAt, :expiresAt, :checksum, :byteSize
                    )
                    ON CONFLICT (cache_key)
                    DO UPDATE SET
                        source_id = EXCLUDED.source_id,
                        state_fips = EXCLUDED.state_fips,
                        source_url = EXCLUDED.source_url,
                        local_path = EXCLUDED.local_path,
                        downloaded_at = EXCLUDED.downloaded_at,
                        expires_at = EXCLUDED.expires_at,
                        checksum = EXCLUDED.checksum,
                        byte_size = EXCLUDED.byte_size
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO dataset_cache_entries (
                    cache_key, source_id, state_fips, source_url, local_path,
                    downloaded_at, expires_at, checksum, byte_size
                )
                KEY(cache_key)
                VALUES (
                    :cacheKey, :sourceId, :stateFips, :sourceUrl, :localPath,
                    :downloadedAt, :expiresAt, :checksum, :byteSize
                )
                """,
            params
        );
    }

    public int delete(String cacheKey) {
        return jdbc.update(
            "DELETE FROM dataset_cache_entries WHERE cache_key = :cacheKey",
            new MapSqlParameterSource("cacheKey", cacheKey)
        );
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM dataset_cache_entries", new MapSqlParameterSource());
    }

    public CacheStats stats(Instant now) {
        return jdbc.queryForObject(
            """
                SELECT COUNT(*) AS entry_count,
                       COALESCE(SUM(CASE WHEN expires_at <= :now THEN 1 ELSE 0 END), 0) AS expired_count,
                       COALESCE(SUM(byte_size), 0) AS total_bytes
                FROM dataset_cache_entries
                """,
            new MapSqlParameterSource("now", toTimestamp(now)),
            (rs, rowNum) -> new CacheStats(
                rs.getLong("entry_count"),
                rs.getLong("expired_count"),
                rs.getLong("total_bytes")
            )
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
