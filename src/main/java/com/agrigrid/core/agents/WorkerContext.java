package com.agrigrid.core.agents;

import com.agrigrid.core.events.MessageChannel;
import com.agrigrid.core.pathfinding.GridPathfinder;
import com.agrigrid.core.world.FarmWorld;
import com.agrigrid.core.world.SimulationClock;

/**
 * Collaborators shared by every worker of one simulation.
 */
public record WorkerContext(
    FarmWorld world,
    MessageChannel channel,
    SimulationClock clock,
    GridPathfinder pathfinder,
    int moveBurst
) {}
