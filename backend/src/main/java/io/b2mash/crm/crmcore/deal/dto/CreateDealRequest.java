package io.b2mash.crm.crmcore.deal.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * @param currency ISO 4217 code, {@code USD} when omitted
 */
public record CreateDealRequest(
    @NotBlank @Size(max = 255) String title,
    @NotNull UUID companyId,
    UUID contactId,
    @NotNull @DecimalMin("0") @Digits(integer = 13, fraction = 2) BigDecimal value,
    @Size(min = 3, max = 3) String currency,
    @NotBlank @Size(max = 100) String stage,
    @NotNull @Min(0) @Max(100) Integer probability,
    LocalDate closeDate,
    Map<String, Object> customFields) {

  public static final String DEFAULT_CURRENCY = "USD";

  public static CreateDealRequest of(
      String title, UUID companyId, BigDecimal value, String stage, Integer probability) {
    return new CreateDealRequest(
        title, companyId, null, value, null, stage, probability, null, Map.of());
  }

  public CreateDealRequest withContact(UUID contactId) {
    return new CreateDealRequest(
        title, companyId, contactId, value, currency, stage, probability, closeDate, customFields);
  }

  public CreateDealRequest withCustomFields(Map<String, Object> customFields) {
    return new CreateDealRequest(
        title, companyId, contactId, value, currency, stage, probability, closeDate, customFields);
  }
}
