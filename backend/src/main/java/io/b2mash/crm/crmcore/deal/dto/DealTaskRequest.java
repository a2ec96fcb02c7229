package io.b2mash.crm.crmcore.deal.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

/** Follow-up task created together with a deal; it is attached to the new deal and open. */
public record DealTaskRequest(
    @NotBlank String description, LocalDate dueDate, @Size(max = 255) String assignedTo) {}
