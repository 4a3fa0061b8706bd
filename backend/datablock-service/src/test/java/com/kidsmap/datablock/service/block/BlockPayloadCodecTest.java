package com.kidsmap.datablock.service.block;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.dto.block.OperatingHours;
import com.kidsmap.datablock.entity.PlaceCategory;
import com.kidsmap.datablock.exception.DataBlockException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BlockPayloadCodec 단위 테스트
 */
class BlockPayloadCodecTest {

    private final BlockPayloadCodec codec = new BlockPayloadCodec(new ObjectMapper());

    @Test
    @DisplayName("인코딩 결과에는 현재 schemaVersion 이 붙는다")
    void encodeAddsVersion() {
        String json = codec.encodePlace(NormalizedPlace.builder().name("키즈카페").build());

        assertThat(json).contains("\"schemaVersion\":2");
        assertThat(codec.decodePlace(json).getName()).isEqualTo("키즈카페");
    }

    @Test
    @DisplayName("v1 문서의 문자열 운영시간은 weekday 로 올려서 읽는다")
    void upgradesV1OperatingHours() {
        String v1 = "{\"name\":\"실내놀이터\",\"operatingHours\":\"09:00-18:00\"}";

        NormalizedPlace place = codec.decodePlace(v1);

        assertThat(place.getName()).isEqualTo("실내놀이터");
        assertThat(place.getOperatingHours().getWeekday()).isEqualTo("09:00-18:00");
        assertThat(place.getOperatingHours().getSaturday()).isNull();
    }

    @Test
    @DisplayName("지원하지 않는 상위 버전은 거부한다")
    void rejectsNewerVersion() {
        assertThatThrownBy(() -> codec.decodePlace("{\"schemaVersion\":3,\"name\":\"x\"}"))
                .isInstanceOf(DataBlockException.class)
                .hasMessageContaining("schemaVersion 3");
    }

    @Test
    @DisplayName("JSON 객체가 아니면 디코딩 오류")
    void rejectsNonObject() {
        assertThatThrownBy(() -> codec.decodePlace("[1,2]"))
                .isInstanceOf(DataBlockException.class);
    }

    @Test
    @DisplayName("병합은 patch 의 null 이 아닌 최상위 필드만 덮어쓴다")
    void shallowMerge() {
        NormalizedPlace existing = NormalizedPlace.builder()
                .name("어린이 박물관")
                .category(PlaceCategory.MUSEUM)
                .tel("02-111-1111")
                .operatingHours(OperatingHours.builder().weekday("10:00-18:00").sunday("10:00-17:00").build())
                .build();
        NormalizedPlace patch = NormalizedPlace.builder()
                .tel("02-222-2222")
                .operatingHours(OperatingHours.builder().weekday("09:00-18:00").build())
                .build();

        NormalizedPlace merged = codec.mergePlace(existing, patch);

        assertThat(merged.getName()).isEqualTo("어린이 박물관");
        assertThat(merged.getCategory()).isEqualTo(PlaceCategory.MUSEUM);
        assertThat(merged.getTel()).isEqualTo("02-222-2222");
        // 중첩 객체는 통째로 교체
        assertThat(merged.getOperatingHours().getWeekday()).isEqualTo("09:00-18:00");
        assertThat(merged.getOperatingHours().getSunday()).isNull();
        // 원본은 변경되지 않는다
        assertThat(existing.getTel()).isEqualTo("02-111-1111");
    }
}
