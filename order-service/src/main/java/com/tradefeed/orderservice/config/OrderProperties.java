package com.tradefeed.orderservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "tradefeed.orders")
public class OrderProperties {

    // PREFIX part of PREFIX-YYYYMMDD-XXXX
    @NotBlank
    private String numberPrefix = "TF";

    // zone used for the YYYYMMDD part
    @NotBlank
    private String zoneId = "UTC";

    @Min(1)
    private int maxNumberAttempts = 5;

    @NotNull
    private StockPolicy stockPolicy = StockPolicy.CONDITIONAL;

    @Min(0)
    private int lowStockThreshold = 5;

    @Min(1)
    private int defaultPageSize = 20;

    @Min(1)
    @Max(500)
    private int maxPageSize = 100;

    // base of the public tracking link put into chat messages
    @NotBlank
    private String publicBaseUrl = "https://tradefeed.co.za";

    @NotBlank
    private String currencySymbol = "R";
}
