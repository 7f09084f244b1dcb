/* (C)2026 */
package com.ammann.impact.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Leave-one-out accuracy of the interpolation method on observed points")
public record InterpolationQualityDTO(double meanSquaredError, double r2Score) {

    public static InterpolationQualityDTO none() {
        return new InterpolationQualityDTO(0.0, 0.0);
    }
}
