package com.kidsmap.datablock.dto.migration;

import com.kidsmap.datablock.entity.PlaceCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationFilter {

    private List<String> regionCodes;

    private List<PlaceCategory> categories;
}
