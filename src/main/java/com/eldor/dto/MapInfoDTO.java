package com.eldor.dto;

import com.eldor.config.MapDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for listing available maps.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapInfoDTO {

    private String id;
    private String name;
    private String description;
    private String author;
    private int width;
    private int height;
    private int objectCount;

    public static MapInfoDTO fromDefinition(MapDefinition def) {
        return MapInfoDTO.builder()
                .id(def.id())
                .name(def.name())
                .description(def.description())
                .author(def.author())
                .width(def.width())
                .height(def.height())
                .objectCount(def.objectCount())
                .build();
    }
}
