package io.b2mash.crm.crmcore.deal;

import io.b2mash.crm.crmcore.task.Task;
import java.util.List;

public record DealWithTasks(Deal deal, List<Task> tasks) {}
