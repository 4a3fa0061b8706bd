package com.kidsmap.datablock.service.quality;

import com.kidsmap.datablock.dto.block.AdmissionFee;
import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.block.OperatingHours;
import com.kidsmap.datablock.entity.AgeGroup;
import com.kidsmap.datablock.entity.ContentSourceType;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.entity.QualityGrade;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BlockQualityEngine 단위 테스트
 */
class BlockQualityEngineTest {

    private final BlockQualityEngine engine = new BlockQualityEngine();

    private static NormalizedPlace basePlace() {
        return NormalizedPlace.builder()
                .name("서울 어린이 대공원")
                .category(PlaceCategory.AMUSEMENT_PARK)
                .address("서울특별시 광진구 능동로 216")
                .latitude(37.548014)
                .longitude(127.074658)
                .build();
    }

    private static NormalizedPlace fullPlace() {
        return basePlace().toBuilder()
                .description("가족 나들이 명소")
                .tel("02-450-9311")
                .homepage("https://www.sisul.or.kr")
                .imageUrl("https://img.example.com/park.jpg")
                .operatingHours(OperatingHours.builder().weekday("10:00-17:00").build())
                .admissionFee(AdmissionFee.builder().isFree(true).build())
                .recommendedAges(List.of(AgeGroup.TODDLER))
                .build();
    }

    @Nested
    @DisplayName("중복 제거 해시")
    class DedupeHash {

        @Test
        @DisplayName("대소문자와 공백 차이는 같은 해시로 본다")
        void normalizesCaseAndWhitespace() {
            NormalizedPlace a = basePlace().toBuilder().name("Kids  Cafe ").build();
            NormalizedPlace b = basePlace().toBuilder().name("kids cafe").build();

            assertThat(engine.placeDedupeHash(a)).isEqualTo(engine.placeDedupeHash(b));
        }

        @Test
        @DisplayName("좌표는 소수 6자리까지만 반영한다")
        void roundsCoordinates() {
            NormalizedPlace a = basePlace().toBuilder().latitude(37.5480141).build();
            NormalizedPlace b = basePlace().toBuilder().latitude(37.5480139).build();
            NormalizedPlace c = basePlace().toBuilder().latitude(37.548100).build();

            assertThat(engine.placeDedupeHash(a)).isEqualTo(engine.placeDedupeHash(b));
            assertThat(engine.placeDedupeHash(a)).isNotEqualTo(engine.placeDedupeHash(c));
        }

        @Test
        @DisplayName("설명 등 식별 필드가 아닌 값은 해시에 영향이 없다")
        void ignoresNonIdentityFields() {
            assertThat(engine.placeDedupeHash(basePlace()))
                    .isEqualTo(engine.placeDedupeHash(fullPlace()))
                    .hasSize(64);
        }

        @Test
        @DisplayName("콘텐츠 해시는 출처와 URL 로 결정된다")
        void contentHashUsesSourceAndUrl() {
            NormalizedContent youtube = NormalizedContent.builder()
                    .source(ContentSourceType.YOUTUBE)
                    .sourceUrl("https://youtu.be/abc")
                    .title("첫 번째 제목")
                    .build();
            NormalizedContent retitled = youtube.toBuilder().title("바뀐 제목").build();
            NormalizedContent blog = youtube.toBuilder().source(ContentSourceType.NAVER_BLOG).build();

            assertThat(engine.contentDedupeHash(youtube)).isEqualTo(engine.contentDedupeHash(retitled));
            assertThat(engine.contentDedupeHash(youtube)).isNotEqualTo(engine.contentDedupeHash(blog));
        }
    }

    @Nested
    @DisplayName("완성도와 등급")
    class CompletenessAndGrade {

        @Test
        @DisplayName("모든 필드가 채워진 장소는 100점, A 등급")
        void fullPlaceScoresHundred() {
            QualityAssessment assessment = engine.assessPlace(fullPlace());

            assertThat(assessment.completeness()).isEqualTo(100);
            assertThat(assessment.grade()).isEqualTo(QualityGrade.A);
        }

        @Test
        @DisplayName("이름/주소/좌표만 있으면 50점, C 등급")
        void basePlaceScoresFifty() {
            QualityAssessment assessment = engine.assessPlace(basePlace());

            assertThat(assessment.completeness()).isEqualTo(50);
            assertThat(assessment.grade()).isEqualTo(QualityGrade.C);
        }

        @Test
        @DisplayName("공백 문자열과 빈 목록은 채워지지 않은 필드로 본다")
        void blankValuesAreMissing() {
            NormalizedPlace place = basePlace().toBuilder()
                    .description("   ")
                    .recommendedAges(List.of())
                    .build();

            assertThat(engine.placeCompleteness(place)).isEqualTo(50);
        }

        @Test
        @DisplayName("필드를 추가하면 완성도는 줄지 않는다")
        void completenessIsMonotonic() {
            NormalizedPlace place = basePlace();
            int before = engine.placeCompleteness(place);
            int after = engine.placeCompleteness(place.toBuilder().tel("02-000-0000").build());

            assertThat(after).isGreaterThanOrEqualTo(before);
        }

        @Test
        @DisplayName("콘텐츠 완성도는 가중치 합계를 따른다")
        void contentCompleteness() {
            NormalizedContent content = NormalizedContent.builder()
                    .source(ContentSourceType.YOUTUBE)
                    .sourceUrl("https://youtu.be/abc")
                    .title("아이와 가볼 만한 곳")
                    .thumbnailUrl("https://img.example.com/t.jpg")
                    .publishedAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                    .viewCount(100L)
                    .build();

            assertThat(engine.contentCompleteness(content)).isEqualTo(60);
            assertThat(engine.assessContent(content).grade()).isEqualTo(QualityGrade.C);
        }

        @ParameterizedTest(name = "completeness={0}, image={1} -> {2}")
        @CsvSource({
                "100, true, A",
                "90, true, A",
                "95, false, C",
                "89, true, B",
                "70, true, B",
                "70, false, C",
                "50, false, C",
                "49, true, D",
                "30, false, D",
                "29, true, F",
                "0, false, F"
        })
        @DisplayName("등급 기준표")
        void gradeTable(int completeness, boolean hasImage, QualityGrade expected) {
            assertThat(BlockQualityEngine.qualityGrade(completeness, hasImage)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("키워드와 지역 코드")
    class KeywordsAndRegion {

        @Test
        @DisplayName("이름 토큰, 주소 지역명, 카테고리 키워드를 중복 없이 모은다")
        void searchKeywords() {
            List<String> keywords = engine.searchKeywords(basePlace());

            assertThat(keywords).contains("서울", "어린이", "대공원", "서울특별시", "광진구", "놀이공원", "테마파크");
            assertThat(keywords).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("areaCode 가 있으면 그대로 사용한다")
        void areaCodeWins() {
            NormalizedPlace place = basePlace().toBuilder().areaCode(" 31 ").build();

            assertThat(engine.regionCode(place)).isEqualTo("31");
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "서울특별시 광진구 능동로 216, 1",
                "경기도 용인시 처인구, 31",
                "제주특별자치도 서귀포시, 39",
                "알 수 없는 주소, 99"
        })
        @DisplayName("주소 시/도 접두어로 지역 코드를 추론한다")
        void regionFromAddress(String address, String expected) {
            NormalizedPlace place = basePlace().toBuilder().address(address).build();

            assertThat(engine.regionCode(place)).isEqualTo(expected);
        }

        @Test
        @DisplayName("주소가 없으면 99")
        void unknownRegion() {
            NormalizedPlace place = basePlace().toBuilder().address(null).build();

            assertThat(engine.regionCode(place)).isEqualTo(BlockQualityEngine.UNKNOWN_REGION_CODE);
        }
    }
}
