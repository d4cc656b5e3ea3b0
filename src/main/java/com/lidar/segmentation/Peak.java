package com.lidar.segmentation;

import lombok.Value;

/**
 * Local maximum of a raster, in pixel coordinates
 */
@Value
public class Peak {
    int row;
    int col;
    float value;
}
