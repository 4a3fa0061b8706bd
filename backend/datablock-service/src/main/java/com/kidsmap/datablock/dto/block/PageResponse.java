package com.kidsmap.datablock.dto.block;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import org.springframework.data.domain.Page;

/**
 * 1부터 시작하는 페이지 응답
 */
public record PageResponse<T>(
        List<T> content,
        int page,
        int pageSize,
        long total,
        int totalPages,
        boolean hasNext,
        boolean hasPrev
) {
    public PageResponse {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        Objects.requireNonNull(page, "page must not be null");
        int pageSize = page.getSize();
        long total = page.getTotalElements();
        int totalPages = pageSize > 0 ? (int) Math.ceil((double) total / pageSize) : 0;
        int current = page.getNumber() + 1;
        return new PageResponse<>(
                page.getContent().stream().map(mapper).toList(),
                current,
                pageSize,
                total,
                totalPages,
                current < totalPages,
                current > 1
        );
    }
}
