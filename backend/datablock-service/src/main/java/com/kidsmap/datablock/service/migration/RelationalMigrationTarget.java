package com.kidsmap.datablock.service.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.entity.MigrationCheckpoint;
import com.kidsmap.datablock.entity.MigrationTargetType;
import com.kidsmap.datablock.exception.ConfigurationException;
import com.kidsmap.datablock.exception.DataBlockException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 별도 PostgreSQL(Supabase, NCP Cloud DB) 대상.
 * id 기준 upsert 하고 migration_run 컬럼에 체크포인트 ID 를 남긴다.
 * 덮어쓰는 기존 행은 {table}_migration_preimage 에 체크포인트별로 보관했다가 롤백 시 되돌린다.
 *
 * 대상 테이블: (id uuid primary key, dedupe_hash, payload jsonb, migration_run, migrated_at)
 */
@Component
@ConditionalOnProperty(name = "datablock.migration.relational.enabled", havingValue = "true")
@Slf4j
public class RelationalMigrationTarget implements MigrationTarget {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final HikariDataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Map<String, String> tables;
    private final Set<String> preimageTablesReady = ConcurrentHashMap.newKeySet();

    public RelationalMigrationTarget(DataBlockProperties properties, ObjectMapper objectMapper) {
        DataBlockProperties.Relational relational = properties.getMigration().getRelational();
        if (relational.getUrl() == null || relational.getUrl().isBlank()) {
            throw ConfigurationException.missing("RelationalMigrationTarget", "datablock.migration.relational.url");
        }
        this.tables = Map.of(
                "places", checkTableName(relational.getPlaceTable()),
                "contents", checkTableName(relational.getContentTable()));

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(relational.getUrl());
        config.setUsername(relational.getUsername());
        config.setPassword(relational.getPassword());
        config.setMaximumPoolSize(relational.getMaxPoolSize());
        config.setPoolName("migration-target");
        // 기동 시 연결을 강제하지 않는다
        config.setInitializationFailTimeout(-1);

        this.dataSource = new HikariDataSource(config);
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
        log.info("Relational migration target initialized: url={}, tables={}", relational.getUrl(), tables.values());
    }

    @Override
    public boolean supports(MigrationTargetType type) {
        return type.isRelational();
    }

    @Override
    public void writeBatch(MigrationCheckpoint checkpoint, String blockType, List<MigrationRecord> records, int batchIndex) {
        String table = table(blockType);
        String preimages = ensurePreimageTable(table);

        // 이번 실행 전의 행을 먼저 보관. 같은 실행이 다시 쓰는 행은 건너뛴다.
        String capture = "INSERT INTO " + preimages +
                " (checkpoint_id, id, dedupe_hash, payload, migration_run, migrated_at) " +
                "SELECT :run, id, dedupe_hash, payload, migration_run, migrated_at FROM " + table +
                " WHERE id IN (:ids) AND migration_run IS DISTINCT FROM :run " +
                "ON CONFLICT (checkpoint_id, id) DO NOTHING";
        String upsert = "INSERT INTO " + table + " (id, dedupe_hash, payload, migration_run, migrated_at) " +
                "VALUES (:id, :dedupeHash, CAST(:payload AS jsonb), :run, :migratedAt) " +
                "ON CONFLICT (id) DO UPDATE SET dedupe_hash = EXCLUDED.dedupe_hash, payload = EXCLUDED.payload, " +
                "migration_run = EXCLUDED.migration_run, migrated_at = EXCLUDED.migrated_at";

        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        List<UUID> ids = records.stream().map(MigrationRecord::id).toList();
        MapSqlParameterSource[] batch = records.stream()
                .map(record -> new MapSqlParameterSource()
                        .addValue("id", record.id())
                        .addValue("dedupeHash", record.dedupeHash())
                        .addValue("payload", toJson(record))
                        .addValue("run", checkpoint.getId())
                        .addValue("migratedAt", now))
                .toArray(MapSqlParameterSource[]::new);

        Integer preserved = transactionTemplate.execute(status -> {
            int captured = jdbc.update(capture, new MapSqlParameterSource()
                    .addValue("run", checkpoint.getId())
                    .addValue("ids", ids));
            jdbc.batchUpdate(upsert, batch);
            return captured;
        });
        log.debug("Upserted {} {} rows for run {} (preserved {} existing rows)",
                records.size(), blockType, checkpoint.getId(), preserved);
    }

    @Override
    public long countWritten(MigrationCheckpoint checkpoint, String blockType) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM " + table(blockType) + " WHERE migration_run = :run",
                new MapSqlParameterSource("run", checkpoint.getId()),
                Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public void rollback(MigrationCheckpoint checkpoint) {
        String table = table(checkpoint.getBlockType());
        String preimages = ensurePreimageTable(table);
        MapSqlParameterSource run = new MapSqlParameterSource("run", checkpoint.getId());

        int[] counts = transactionTemplate.execute(status -> {
            int deleted = jdbc.update("DELETE FROM " + table + " WHERE migration_run = :run", run);
            // 이후 실행이 다시 덮어쓴 행은 그 실행의 것이므로 건드리지 않는다
            int restored = jdbc.update("INSERT INTO " + table +
                    " (id, dedupe_hash, payload, migration_run, migrated_at) " +
                    "SELECT id, dedupe_hash, payload, migration_run, migrated_at FROM " + preimages +
                    " WHERE checkpoint_id = :run ON CONFLICT (id) DO NOTHING", run);
            jdbc.update("DELETE FROM " + preimages + " WHERE checkpoint_id = :run", run);
            return new int[]{deleted, restored};
        });
        log.info("[Migration] Rolled back checkpoint {}: deleted={}, restored={}",
                checkpoint.getId(), counts[0], counts[1]);
    }

    @PreDestroy
    public void close() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    private String table(String blockType) {
        String table = tables.get(blockType);
        if (table == null) {
            throw new IllegalArgumentException("Unknown block type: " + blockType);
        }
        return table;
    }

    private String ensurePreimageTable(String table) {
        String preimages = table + "_migration_preimage";
        if (preimageTablesReady.add(preimages)) {
            try {
                jdbc.getJdbcTemplate().execute("CREATE TABLE IF NOT EXISTS " + preimages + " (" +
                        "checkpoint_id varchar(100) NOT NULL, " +
                        "id uuid NOT NULL, " +
                        "dedupe_hash varchar(128), " +
                        "payload jsonb, " +
                        "migration_run varchar(100), " +
                        "migrated_at timestamp, " +
                        "PRIMARY KEY (checkpoint_id, id))");
            } catch (RuntimeException e) {
                preimageTablesReady.remove(preimages);
                throw e;
            }
        }
        return preimages;
    }

    private String toJson(MigrationRecord record) {
        try {
            return objectMapper.writeValueAsString(record.document());
        } catch (JsonProcessingException e) {
            throw new DataBlockException("MIGRATION_ERROR", "Failed to serialize block " + record.id() + ": " + e.getMessage(), e);
        }
    }

    private static String checkTableName(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new ConfigurationException("Invalid migration table name: " + table);
        }
        return table;
    }
}
