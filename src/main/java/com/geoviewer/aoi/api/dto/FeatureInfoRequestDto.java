package com.geoviewer.aoi.api.dto;

import com.geoviewer.aoi.domain.model.FeatureInfoQuery;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Query parameters of GET /wms/feature-info.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FeatureInfoRequestDto {

    @NotNull(message = "x is required")
    @Min(value = 0, message = "x must be >= 0")
    private Integer x;

    @NotNull(message = "y is required")
    @Min(value = 0, message = "y must be >= 0")
    private Integer y;

    @NotBlank(message = "bbox is required")
    private String bbox;

    @NotNull(message = "width is required")
    @Min(value = 1, message = "width must be >= 1")
    private Integer width;

    @NotNull(message = "height is required")
    @Min(value = 1, message = "height must be >= 1")
    private Integer height;

    @NotBlank(message = "layers is required")
    private String layers;

    public FeatureInfoQuery toQuery() {
        return new FeatureInfoQuery(x, y, bbox, width, height, layers);
    }
}
