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
import org.openapitools.jackson.nullable.JsonNullable;

public class UpdateDealRequest {

  @NotBlank
  @Size(max = 255)
  private JsonNullable<String> title = JsonNullable.undefined();

  @NotNull private JsonNullable<UUID> companyId = JsonNullable.undefined();

  private JsonNullable<UUID> contactId = JsonNullable.undefined();

  @NotNull
  @DecimalMin("0")
  @Digits(integer = 13, fraction = 2)
  private JsonNullable<BigDecimal> value = JsonNullable.undefined();

  @NotNull
  @Size(min = 3, max = 3)
  private JsonNullable<String> currency = JsonNullable.undefined();

  @NotBlank
  @Size(max = 100)
  private JsonNullable<String> stage = JsonNullable.undefined();

  @NotNull
  @Min(0)
  @Max(100)
  private JsonNullable<Integer> probability = JsonNullable.undefined();

  private JsonNullable<LocalDate> closeDate = JsonNullable.undefined();

  private JsonNullable<Map<String, Object>> customFields = JsonNullable.undefined();

  public JsonNullable<String> getTitle() {
    return title;
  }

  public UpdateDealRequest title(String title) {
    this.title = JsonNullable.of(title);
    return this;
  }

  public JsonNullable<UUID> getCompanyId() {
    return companyId;
  }

  public UpdateDealRequest companyId(UUID companyId) {
    this.companyId = JsonNullable.of(companyId);
    return this;
  }

  public JsonNullable<UUID> getContactId() {
    return contactId;
  }

  public UpdateDealRequest contactId(UUID contactId) {
    this.contactId = JsonNullable.of(contactId);
    return this;
  }

  public JsonNullable<BigDecimal> getValue() {
    return value;
  }

  public UpdateDealRequest value(BigDecimal value) {
    this.value = JsonNullable.of(value);
    return this;
  }

  public JsonNullable<String> getCurrency() {
    return currency;
  }

  public UpdateDealRequest currency(String currency) {
    this.currency = JsonNullable.of(currency);
    return this;
  }

  public JsonNullable<String> getStage() {
    return stage;
  }

  public UpdateDealRequest stage(String stage) {
    this.stage = JsonNullable.of(stage);
    return this;
  }

  public JsonNullable<Integer> getProbability() {
    return probability;
  }

  public UpdateDealRequest probability(Integer probability) {
    this.probability = JsonNullable.of(probability);
    return this;
  }

  public JsonNullable<LocalDate> getCloseDate() {
    return closeDate;
  }

  public UpdateDealRequest closeDate(LocalDate closeDate) {
    this.closeDate = JsonNullable.of(closeDate);
    return this;
  }

  public JsonNullable<Map<String, Object>> getCustomFields() {
    return customFields;
  }

  public UpdateDealRequest customFields(Map<String, Object> customFields) {
    this.customFields = JsonNullable.of(customFields);
    return this;
  }

  /** Returns a copy carrying {@code customFields} in place of this update's value. */
  public UpdateDealRequest withCustomFields(Map<String, Object> customFields) {
    var copy = new UpdateDealRequest();
    copy.title = title;
    copy.companyId = companyId;
    copy.contactId = contactId;
    copy.value = value;
    copy.currency = currency;
    copy.stage = stage;
    copy.probability = probability;
    copy.closeDate = closeDate;
    copy.customFields = JsonNullable.of(customFields);
    return copy;
  }
}
