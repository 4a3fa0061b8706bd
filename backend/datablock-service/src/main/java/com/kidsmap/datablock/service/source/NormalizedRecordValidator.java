package com.kidsmap.datablock.service.source;

import com.kidsmap.datablock.dto.block.NormalizedContent;
import com.kidsmap.datablock.dto.block.NormalizedPlace;
import com.kidsmap.datablock.exception.MalformedRecordException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extract 경계의 엄격 검증. 통과하지 못한 레코드는 Dedup/Quality 단계로 넘어가지 않는다.
 */
@Component
public class NormalizedRecordValidator {

    public NormalizedPlace validate(NormalizedPlace place) {
        List<String> problems = new ArrayList<>();
        if (isBlank(place.getName())) problems.add("name is required");
        if (place.getSource() == null) problems.add("source is required");
        if (isBlank(place.getSourceUrl())) problems.add("sourceUrl is required");
        if (place.getCategory() == null) problems.add("category is unknown");
        if (place.getLatitude() != null && (place.getLatitude() < -90 || place.getLatitude() > 90)) {
            problems.add("latitude out of range: " + place.getLatitude());
        }
        if (place.getLongitude() != null && (place.getLongitude() < -180 || place.getLongitude() > 180)) {
            problems.add("longitude out of range: " + place.getLongitude());
        }
        if (!problems.isEmpty()) {
            throw new MalformedRecordException("Rejected place " + place.getId() + ": " + String.join(", ", problems));
        }
        return place;
    }

    public NormalizedContent validate(NormalizedContent content) {
        List<String> problems = new ArrayList<>();
        if (isBlank(content.getTitle())) problems.add("title is required");
        if (content.getSource() == null) problems.add("source is required");
        if (content.getType() == null) problems.add("type is required");
        if (isBlank(content.getSourceUrl())) problems.add("sourceUrl is required");
        if (!problems.isEmpty()) {
            throw new MalformedRecordException("Rejected content " + content.getId() + ": " + String.join(", ", problems));
        }
        return content;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
