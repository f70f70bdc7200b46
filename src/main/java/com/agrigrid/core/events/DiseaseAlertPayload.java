package com.agrigrid.core.events;

import com.agrigrid.core.model.Position;

public record DiseaseAlertPayload(Position cell, double diseaseProbability, double waterLevel) implements MessagePayload {}
