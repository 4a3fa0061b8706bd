package com.kidsmap.datablock.controller;

import com.kidsmap.datablock.dto.block.BlockStats;
import com.kidsmap.datablock.dto.block.ContentBlockDto;
import com.kidsmap.datablock.dto.block.ContentBlockFilter;
import com.kidsmap.datablock.dto.block.PageResponse;
import com.kidsmap.datablock.dto.block.PlaceBlockDto;
import com.kidsmap.datablock.dto.block.PlaceBlockFilter;
import com.kidsmap.datablock.dto.block.StatusChangeRequest;
import com.kidsmap.datablock.exception.BlockNotFoundException;
import com.kidsmap.datablock.service.block.BlockStatsService;
import com.kidsmap.datablock.service.block.ContentBlockService;
import com.kidsmap.datablock.service.block.PlaceBlockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

import static com.kidsmap.datablock.controller.BlockingCalls.async;

/**
 * 장소/콘텐츠 블록 조회 및 상태 변경 API
 */
@RestController
@RequestMapping("/api/v1/blocks")
@RequiredArgsConstructor
public class BlockController {

    private final PlaceBlockService placeBlockService;
    private final ContentBlockService contentBlockService;
    private final BlockStatsService blockStatsService;

    // ========================================
    // 장소
    // ========================================

    @GetMapping("/places")
    public Mono<ResponseEntity<PageResponse<PlaceBlockDto>>> searchPlaces(@ModelAttribute PlaceBlockFilter filter) {
        return async(() -> placeBlockService.search(filter))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/places/{id}")
    public Mono<ResponseEntity<PlaceBlockDto>> getPlace(@PathVariable UUID id) {
        return async(() -> placeBlockService.findById(id)
                .orElseThrow(() -> BlockNotFoundException.of("PlaceBlock", id)))
                .map(ResponseEntity::ok);
    }

    @PatchMapping("/places/{id}/status")
    public Mono<ResponseEntity<PlaceBlockDto>> changePlaceStatus(
            @PathVariable UUID id,
            @Valid @RequestBody StatusChangeRequest request) {
        return async(() -> placeBlockService.toDto(placeBlockService.updateStatus(id, request.getStatus())))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/places/{id}/contents")
    public Mono<ResponseEntity<List<ContentBlockDto>>> getPlaceContents(@PathVariable UUID id) {
        return async(() -> contentBlockService.findByPlaceId(id))
                .map(ResponseEntity::ok);
    }

    // ========================================
    // 콘텐츠
    // ========================================

    @GetMapping("/contents")
    public Mono<ResponseEntity<PageResponse<ContentBlockDto>>> searchContents(@ModelAttribute ContentBlockFilter filter) {
        return async(() -> contentBlockService.search(filter))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/contents/{id}")
    public Mono<ResponseEntity<ContentBlockDto>> getContent(@PathVariable UUID id) {
        return async(() -> contentBlockService.findById(id)
                .orElseThrow(() -> BlockNotFoundException.of("ContentBlock", id)))
                .map(ResponseEntity::ok);
    }

    // ========================================
    // 통계
    // ========================================

    @GetMapping("/stats")
    public Mono<ResponseEntity<BlockStats>> getStats() {
        return async(blockStatsService::getStats)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/stats/refresh")
    public Mono<ResponseEntity<BlockStats>> refreshStats() {
        return async(blockStatsService::refreshStats)
                .map(ResponseEntity::ok);
    }
}
