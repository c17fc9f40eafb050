package com.eldor.dto;

import com.eldor.model.MapObject;
import com.eldor.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for an object placed on a live map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapObjectDTO {

    private int instanceId;
    private String type;
    private String name;
    private Position position;
    private String owner;
    private String ownerColor;
    private boolean blocking;
    private boolean visitable;

    public static MapObjectDTO fromObject(MapObject obj) {
        return MapObjectDTO.builder()
                .instanceId(obj.getInstanceId())
                .type(obj.getObjectType().name())
                .name(obj.getInstanceName())
                .position(obj.getPosition())
                .owner(obj.getOwner().name())
                .ownerColor(obj.getOwner().getHexCode())
                .blocking(obj.blocksMovement())
                .visitable(obj.isVisitable())
                .build();
    }
}
