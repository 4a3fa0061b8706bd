package com.kidsmap.datablock.controller;

import com.kidsmap.datablock.dto.migration.MigrationRequest;
import com.kidsmap.datablock.dto.migration.MigrationResult;
import com.kidsmap.datablock.entity.MigrationCheckpoint;
import com.kidsmap.datablock.service.migration.BlockMigrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.kidsmap.datablock.controller.BlockingCalls.async;

/**
 * 외부 저장소로의 블록 이관 및 롤백 API
 */
@RestController
@RequestMapping("/api/v1/migrations")
@RequiredArgsConstructor
@Slf4j
public class MigrationController {

    private final BlockMigrator blockMigrator;

    @PostMapping("/places")
    public Mono<ResponseEntity<MigrationResult>> migratePlaces(@Valid @RequestBody MigrationRequest request) {
        log.info("Place migration requested: target={}, dryRun={}",
                request.getConfig().getTarget(), request.getConfig().isDryRun());
        return async(() -> blockMigrator.migratePlaces(request.getConfig(), request.getFilter()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/contents")
    public Mono<ResponseEntity<MigrationResult>> migrateContents(@Valid @RequestBody MigrationRequest request) {
        log.info("Content migration requested: target={}, dryRun={}",
                request.getConfig().getTarget(), request.getConfig().isDryRun());
        return async(() -> blockMigrator.migrateContents(request.getConfig()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/rollback/{checkpointId}")
    public Mono<ResponseEntity<MigrationCheckpoint>> rollback(@PathVariable String checkpointId) {
        return async(() -> blockMigrator.rollback(checkpointId))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/checkpoints")
    public Mono<ResponseEntity<List<MigrationCheckpoint>>> listCheckpoints() {
        return async(blockMigrator::listCheckpoints)
                .map(ResponseEntity::ok);
    }
}
