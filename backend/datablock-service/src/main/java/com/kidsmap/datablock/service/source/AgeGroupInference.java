package com.kidsmap.datablock.service.source;

import com.kidsmap.datablock.entity.AgeGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 이름/설명 키워드 기반 추천 연령대 추정
 */
final class AgeGroupInference {

    static final List<AgeGroup> DEFAULT_AGES = List.of(AgeGroup.TODDLER, AgeGroup.CHILD, AgeGroup.ELEMENTARY);

    private AgeGroupInference() {
    }

    static List<AgeGroup> infer(String title, String description) {
        String text = ((title != null ? title : "") + " " + (description != null ? description : ""))
                .toLowerCase(Locale.ROOT);
        List<AgeGroup> ages = new ArrayList<>();

        if (containsAny(text, "영아", "0세", "1세", "2세")) {
            ages.add(AgeGroup.INFANT);
        }
        if (containsAny(text, "유아", "3세", "4세", "5세", "어린이")) {
            ages.add(AgeGroup.TODDLER);
        }
        if (containsAny(text, "아동", "초등", "키즈")) {
            ages.add(AgeGroup.CHILD);
            ages.add(AgeGroup.ELEMENTARY);
        }
        return ages.isEmpty() ? DEFAULT_AGES : ages;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }
}
