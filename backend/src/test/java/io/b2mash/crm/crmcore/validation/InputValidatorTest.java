package io.b2mash.crm.crmcore.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.company.dto.UpdateCompanyRequest;
import io.b2mash.crm.crmcore.deal.dto.CreateDealRequest;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import io.b2mash.crm.crmcore.note.dto.UpdateNoteRequest;
import io.b2mash.crm.crmcore.task.dto.UpdateTaskRequest;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InputValidatorTest {

  private ValidatorFactory factory;
  private InputValidator inputValidator;

  @BeforeEach
  void setUp() {
    factory = Validation.buildDefaultValidatorFactory();
    inputValidator = new InputValidator(factory.getValidator());
  }

  @AfterEach
  void tearDown() {
    factory.close();
  }

  @Test
  void validInputIsReturnedAsIs() {
    var request = CreateDealRequest.of("Deal", UUID.randomUUID(), BigDecimal.TEN, "lead", 50);

    assertThat(inputValidator.validate(request)).isSameAs(request);
  }

  @Test
  void reportsEveryViolationGroupedByField() {
    var request = CreateDealRequest.of(" ", null, new BigDecimal("-1"), "lead", 101);

    assertThatThrownBy(() -> inputValidator.validate(request))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> {
              assertThat(e.getFieldErrors())
                  .containsOnlyKeys("companyId", "probability", "title", "value");
              assertThat(e.getSummary())
                  .isEqualTo("Invalid input: companyId, probability, title, value");
            });
  }

  @Test
  void nullInputIsRejected() {
    assertThatThrownBy(() -> inputValidator.validate(null))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> assertThat(e.getFieldErrors()).containsKey("input"));
  }

  @Test
  void undefinedUpdateFieldsAreNotValidated() {
    assertThat(inputValidator.validate(new UpdateCompanyRequest())).isNotNull();
  }

  @Test
  void presentUpdateFieldsAreValidated() {
    assertThatThrownBy(() -> inputValidator.validate(new UpdateCompanyRequest().name("")))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> assertThat(e.getFieldErrors()).containsOnlyKeys("name"));
  }

  @Test
  void reattachmentTargetPartsAreValidated() {
    var target = new EntityReference(null, UUID.randomUUID());

    assertThatThrownBy(
            () -> inputValidator.validate(new UpdateTaskRequest().attachedTo(target)))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> assertThat(e.getFieldErrors()).containsKey("attachedTo.type"));
    assertThatThrownBy(
            () -> inputValidator.validate(new UpdateNoteRequest().attachedTo(target)))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> assertThat(e.getFieldErrors()).containsKey("attachedTo.type"));
  }
}
