package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.dto.block.ContentBlockFilter;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.ContentBlock;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ContentBlockSpecifications {

    private ContentBlockSpecifications() {
    }

    public static Specification<ContentBlock> from(ContentBlockFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            List<BlockStatus> statuses = isEmpty(filter.getStatuses()) ? List.of(BlockStatus.ACTIVE) : filter.getStatuses();
            predicates.add(root.get("status").in(statuses));

            if (!isEmpty(filter.getSources())) {
                predicates.add(root.get("source").in(filter.getSources()));
            }
            if (!isEmpty(filter.getContentTypes())) {
                predicates.add(root.get("contentType").in(filter.getContentTypes()));
            }
            if (filter.getRelatedPlaceId() != null) {
                predicates.add(cb.equal(root.get("relatedPlaceId"), filter.getRelatedPlaceId()));
            }
            if (!isEmpty(filter.getQualityGrades())) {
                predicates.add(root.get("qualityGrade").in(filter.getQualityGrades()));
            }
            if (filter.getKeyword() != null && !filter.getKeyword().isBlank()) {
                String pattern = "%" + filter.getKeyword().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.like(cb.lower(root.<String>get("title")), pattern));
            }
            if (filter.getPublishedAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDateTime>get("publishedAt"), filter.getPublishedAfter()));
            }
            if (filter.getPublishedBefore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDateTime>get("publishedAt"), filter.getPublishedBefore()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static boolean isEmpty(List<?> values) {
        return values == null || values.isEmpty();
    }
}
