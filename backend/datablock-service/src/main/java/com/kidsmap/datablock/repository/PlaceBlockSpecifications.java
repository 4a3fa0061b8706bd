package com.kidsmap.datablock.repository;

import com.kidsmap.datablock.dto.block.PlaceBlockFilter;
import com.kidsmap.datablock.entity.BlockStatus;
import com.kidsmap.datablock.entity.PlaceBlock;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PlaceBlockFilter → JPA Specification
 */
public final class PlaceBlockSpecifications {

    /** 위도 1도 당 거리 (km) */
    public static final double KM_PER_DEGREE = 111.0;

    private PlaceBlockSpecifications() {
    }

    public static Specification<PlaceBlock> from(PlaceBlockFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            List<BlockStatus> statuses = isEmpty(filter.getStatuses()) ? List.of(BlockStatus.ACTIVE) : filter.getStatuses();
            predicates.add(root.get("status").in(statuses));

            if (!isEmpty(filter.getCategories())) {
                predicates.add(root.get("category").in(filter.getCategories()));
            }
            if (!isEmpty(filter.getRegionCodes())) {
                predicates.add(root.get("regionCode").in(filter.getRegionCodes()));
            }
            if (!isEmpty(filter.getQualityGrades())) {
                predicates.add(root.get("qualityGrade").in(filter.getQualityGrades()));
            }
            if (!isEmpty(filter.getFreshness())) {
                predicates.add(root.get("freshness").in(filter.getFreshness()));
            }

            if (filter.getKeyword() != null && !filter.getKeyword().isBlank()) {
                String pattern = "%" + filter.getKeyword().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.<String>get("name")), pattern),
                        cb.like(cb.lower(root.<String>get("address")), pattern)
                ));
            }

            if (filter.hasRadius()) {
                double[] box = boundingBox(filter.getLatitude(), filter.getLongitude(), filter.getRadiusKm());
                predicates.add(cb.between(root.<Double>get("latitude"), box[0], box[1]));
                predicates.add(cb.between(root.<Double>get("longitude"), box[2], box[3]));
            }

            if (filter.getMinCompleteness() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Integer>get("completeness"), filter.getMinCompleteness()));
            }
            if (filter.getMaxCompleteness() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Integer>get("completeness"), filter.getMaxCompleteness()));
            }
            if (filter.getCrawledAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDateTime>get("lastCrawledAt"), filter.getCrawledAfter()));
            }
            if (filter.getCrawledBefore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDateTime>get("lastCrawledAt"), filter.getCrawledBefore()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * 반경 검색용 사각형 [minLat, maxLat, minLng, maxLng].
     * latDelta = r/111, lngDelta = r/(111·cos(lat)) 근사이며 측지선 거리가 아니다.
     */
    public static double[] boundingBox(double latitude, double longitude, double radiusKm) {
        double latDelta = radiusKm / KM_PER_DEGREE;
        double lngDelta = radiusKm / (KM_PER_DEGREE * Math.cos(Math.toRadians(latitude)));
        return new double[]{
                latitude - latDelta,
                latitude + latDelta,
                longitude - lngDelta,
                longitude + lngDelta
        };
    }

    private static boolean isEmpty(List<?> values) {
        return values == null || values.isEmpty();
    }
}
