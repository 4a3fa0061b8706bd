package com.kidsmap.datablock.service.quality;

import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.QualityGrade;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 중복 제거 해시, 완성도, 품질 등급, 검색 키워드 계산.
 *
 * 모든 메서드는 부수효과가 없고 네트워크/DB 에 접근하지 않는다.
 */
@Component
public class BlockQualityEngine {

    public static final String UNKNOWN_REGION_CODE = "99";

    private static final int HASH_LENGTH = 64;
    private static final String SEPARATOR = "|";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REGION_TOKEN = Pattern.compile("([가-힣]+[시도군구])");
    private static final Pattern PROVINCE_PREFIX = Pattern.compile("^([가-힣]+[시도])");

    /**
     * 주소 시/도 접두어 → TourAPI 지역 코드
     */
    private static final Map<String, String> PROVINCE_CODES = Map.ofEntries(
            Map.entry("서울시", "1"), Map.entry("서울특별시", "1"),
            Map.entry("인천시", "2"), Map.entry("인천광역시", "2"),
            Map.entry("대전시", "3"), Map.entry("대전광역시", "3"),
            Map.entry("대구시", "4"), Map.entry("대구광역시", "4"),
            Map.entry("광주시", "5"), Map.entry("광주광역시", "5"),
            Map.entry("부산시", "6"), Map.entry("부산광역시", "6"),
            Map.entry("울산시", "7"), Map.entry("울산광역시", "7"),
            Map.entry("세종시", "8"), Map.entry("세종특별자치시", "8"),
            Map.entry("경기도", "31"),
            Map.entry("강원도", "32"), Map.entry("강원특별자치도", "32"),
            Map.entry("충북", "33"), Map.entry("충청북도", "33"),
            Map.entry("충남", "34"), Map.entry("충청남도", "34"),
            Map.entry("경북", "35"), Map.entry("경상북도", "35"),
            Map.entry("경남", "36"), Map.entry("경상남도", "36"),
            Map.entry("전북", "37"), Map.entry("전라북도", "37"), Map.entry("전북특별자치도", "37"),
            Map.entry("전남", "38"), Map.entry("전라남도", "38"),
            Map.entry("제주도", "39"), Map.entry("제주특별자치도", "39")
    );

    // ========================================
    // 중복 제거 해시
    // ========================================

    /**
     * 장소 식별 해시: 이름|주소|위도(소수 6자리)|경도(소수 6자리)
     */
    public String placeDedupeHash(NormalizedPlace place) {
        String normalized = String.join(SEPARATOR,
                normalizeText(place.getName()),
                normalizeText(place.getAddress()),
                formatCoordinate(place.getLatitude()),
                formatCoordinate(place.getLongitude()));
        return sha256(normalized);
    }

    /**
     * 콘텐츠 식별 해시: source|sourceUrl
     */
    public String contentDedupeHash(NormalizedContent content) {
        String source = content.getSource() != null ? content.getSource().name() : "";
        String url = content.getSourceUrl() != null ? content.getSourceUrl().trim() : "";
        return sha256(source + SEPARATOR + url);
    }

    // ========================================
    // 완성도 / 등급
    // ========================================

    /**
     * 장소 완성도 (가중치 합계 100)
     */
    public int placeCompleteness(NormalizedPlace place) {
        int score = 0;
        score += present(place.getName()) ? 15 : 0;
        score += present(place.getAddress()) ? 15 : 0;
        score += present(place.getLatitude()) ? 10 : 0;
        score += present(place.getLongitude()) ? 10 : 0;
        score += present(place.getDescription()) ? 10 : 0;
        score += present(place.getTel()) ? 5 : 0;
        score += present(place.getHomepage()) ? 5 : 0;
        score += present(place.getImageUrl()) ? 10 : 0;
        score += present(place.getOperatingHours()) ? 10 : 0;
        score += present(place.getAdmissionFee()) ? 5 : 0;
        score += present(place.getRecommendedAges()) ? 5 : 0;
        return Math.min(100, score);
    }

    /**
     * 콘텐츠 완성도 (가중치 합계 100)
     */
    public int contentCompleteness(NormalizedContent content) {
        int score = 0;
        score += present(content.getTitle()) ? 20 : 0;
        score += present(content.getDescription()) ? 15 : 0;
        score += present(content.getThumbnailUrl()) ? 15 : 0;
        score += present(content.getAuthor()) ? 10 : 0;
        score += present(content.getAuthorUrl()) ? 5 : 0;
        score += present(content.getPublishedAt()) ? 15 : 0;
        score += present(content.getViewCount()) ? 10 : 0;
        score += present(content.getLikeCount()) ? 5 : 0;
        score += present(content.getCommentCount()) ? 5 : 0;
        return Math.min(100, score);
    }

    public static QualityGrade qualityGrade(int completeness, boolean hasImage) {
        if (completeness >= 90 && hasImage) return QualityGrade.A;
        if (completeness >= 70 && hasImage) return QualityGrade.B;
        if (completeness >= 50) return QualityGrade.C;
        if (completeness >= 30) return QualityGrade.D;
        return QualityGrade.F;
    }

    public QualityAssessment assessPlace(NormalizedPlace place) {
        int completeness = placeCompleteness(place);
        return new QualityAssessment(
                placeDedupeHash(place),
                completeness,
                qualityGrade(completeness, present(place.getImageUrl())));
    }

    public QualityAssessment assessContent(NormalizedContent content) {
        int completeness = contentCompleteness(content);
        return new QualityAssessment(
                contentDedupeHash(content),
                completeness,
                qualityGrade(completeness, present(content.getThumbnailUrl())));
    }

    // ========================================
    // 검색 키워드 / 지역 코드
    // ========================================

    /**
     * 이름 토큰(2자 이상) + 주소의 지역명 + 카테고리 키워드
     */
    public List<String> searchKeywords(NormalizedPlace place) {
        Set<String> keywords = new LinkedHashSet<>();

        if (place.getName() != null) {
            for (String token : WHITESPACE.split(place.getName().trim())) {
                if (token.length() >= 2) keywords.add(token);
            }
        }

        if (place.getAddress() != null) {
            Matcher matcher = REGION_TOKEN.matcher(place.getAddress());
            while (matcher.find()) {
                keywords.add(matcher.group(1));
            }
        }

        PlaceCategory category = place.getCategory();
        if (category != null) {
            keywords.addAll(category.getKeywords());
        }

        return new ArrayList<>(keywords);
    }

    public String regionCode(NormalizedPlace place) {
        if (present(place.getAreaCode())) {
            return place.getAreaCode().trim();
        }
        if (place.getAddress() != null) {
            Matcher matcher = PROVINCE_PREFIX.matcher(place.getAddress().trim());
            if (matcher.find()) {
                return PROVINCE_CODES.getOrDefault(matcher.group(1), UNKNOWN_REGION_CODE);
            }
        }
        return UNKNOWN_REGION_CODE;
    }

    // ========================================
    // 유틸리티
    // ========================================

    private static String normalizeText(String value) {
        if (value == null) return "";
        return WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    private static String formatCoordinate(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) return "";
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).toPlainString();
    }

    static boolean present(Object value) {
        if (value == null) return false;
        if (value instanceof String s) return !s.isBlank();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        return true;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
