package com.wildcam.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Camera {
    private String cameraId;
    private String name;
    private String locationName;
    @Builder.Default
    private String status = "active";   // active, inactive, maintenance

    public boolean isActive() {
        return "active".equalsIgnoreCase(status);
    }
}
