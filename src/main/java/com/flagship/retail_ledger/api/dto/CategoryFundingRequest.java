package com.flagship.retail_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for funding a third-party category, e.g. "Betting Funding".
 */
@Value
public class CategoryFundingRequest {

    @NotBlank(message = "Category is required")
    @Size(max = 50, message = "Category must be at most 50 characters")
    @JsonProperty("category")
    String category;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 200, message = "Description must be at most 200 characters")
    @JsonProperty("description")
    String description;
}
