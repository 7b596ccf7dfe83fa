package com.restaurant.simulator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Sales for one 15-minute service bucket")
public class SalesBucketRow {

    @Schema(description = "Location identifier", example = "loc-centro")
    private String locationId;

    @Schema(description = "Bucket start in the location's wall-clock zone", example = "2026-02-14T13:15:00+01:00")
    private OffsetDateTime timestamp;

    @Schema(description = "Gross sales before discounts (EUR)", example = "412.35")
    private double salesGross;

    @Schema(description = "Gross sales minus discounts (EUR)", example = "391.73")
    private double salesNet;

    @Schema(description = "Tickets closed in the bucket", example = "6")
    private int tickets;

    @Schema(description = "Guests served in the bucket", example = "16")
    private int covers;

    private double discounts;
    private double voids;
    private double comps;
    private double refunds;

    @Schema(description = "Dine-in share of gross sales (EUR)")
    private double channelDineIn;

    @Schema(description = "Pickup share of gross sales (EUR)")
    private double channelPickup;

    @Schema(description = "Delivery share of gross sales (EUR)")
    private double channelDelivery;
}
