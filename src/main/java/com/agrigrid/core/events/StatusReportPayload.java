package com.agrigrid.core.events;

import com.agrigrid.core.model.AgentStatus;
import com.agrigrid.core.model.AgentType;
import com.agrigrid.core.model.Position;

public record StatusReportPayload(
    String agentId,
    AgentType agentType,
    Position position,
    AgentStatus status,
    String taskId,
    String message
) implements MessagePayload {}
