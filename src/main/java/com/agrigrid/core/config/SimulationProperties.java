package com.agrigrid.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the farm simulation, bound from {@code agrigrid.*}.
 * All bursts and caps are explicit constants so tick output stays reproducible.
 */
@Component
@ConfigurationProperties(prefix = "agrigrid")
public class SimulationProperties {

    private long seed = 42L;
    private Grid grid = new Grid();
    private Planner planner = new Planner();
    private Worker worker = new Worker();
    private Weather weather = new Weather();
    private Monitoring monitoring = new Monitoring();
    private Scheduler scheduler = new Scheduler();

    public long getSeed() { return seed; }
    public void setSeed(long seed) { this.seed = seed; }
    public Grid getGrid() { return grid; }
    public void setGrid(Grid grid) { this.grid = grid; }
    public Planner getPlanner() { return planner; }
    public void setPlanner(Planner planner) { this.planner = planner; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Weather getWeather() { return weather; }
    public void setWeather(Weather weather) { this.weather = weather; }
    public Monitoring getMonitoring() { return monitoring; }
    public void setMonitoring(Monitoring monitoring) { this.monitoring = monitoring; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class Grid {
        private int width = 20;
        private int height = 20;

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }
        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }
    }

    public static class Planner {
        private int maxTasksPerType = 10;
        private int assignBurst = 20;
        private int diseaseAlertPriority = 95;
        private int backlogWarningThreshold = 200;

        public int getMaxTasksPerType() { return maxTasksPerType; }
        public void setMaxTasksPerType(int maxTasksPerType) { this.maxTasksPerType = maxTasksPerType; }
        public int getAssignBurst() { return assignBurst; }
        public void setAssignBurst(int assignBurst) { this.assignBurst = assignBurst; }
        public int getDiseaseAlertPriority() { return diseaseAlertPriority; }
        public void setDiseaseAlertPriority(int diseaseAlertPriority) { this.diseaseAlertPriority = diseaseAlertPriority; }
        public int getBacklogWarningThreshold() { return backlogWarningThreshold; }
        public void setBacklogWarningThreshold(int backlogWarningThreshold) { this.backlogWarningThreshold = backlogWarningThreshold; }
    }

    public static class Worker {
        private int moveBurst = 3;

        public int getMoveBurst() { return moveBurst; }
        public void setMoveBurst(int moveBurst) { this.moveBurst = moveBurst; }
    }

    public static class Weather {
        private int updateInterval = 5;
        private double rainProbability = 0.1;

        public int getUpdateInterval() { return updateInterval; }
        public void setUpdateInterval(int updateInterval) { this.updateInterval = updateInterval; }
        public double getRainProbability() { return rainProbability; }
        public void setRainProbability(double rainProbability) { this.rainProbability = rainProbability; }
    }

    public static class Monitoring {
        private int scanInterval = 15;
        private double diseaseThreshold = 0.85;

        public int getScanInterval() { return scanInterval; }
        public void setScanInterval(int scanInterval) { this.scanInterval = scanInterval; }
        public double getDiseaseThreshold() { return diseaseThreshold; }
        public void setDiseaseThreshold(double diseaseThreshold) { this.diseaseThreshold = diseaseThreshold; }
    }

    public static class Scheduler {
        private int horizon = 100;
        private double waterCapacity = 1000.0;
        private double fuelCapacity = 500.0;
        private double toolsCapacity = 5.0;
        private int agentsPerType = 1;

        public int getHorizon() { return horizon; }
        public void setHorizon(int horizon) { this.horizon = horizon; }
        public double getWaterCapacity() { return waterCapacity; }
        public void setWaterCapacity(double waterCapacity) { this.waterCapacity = waterCapacity; }
        public double getFuelCapacity() { return fuelCapacity; }
        public void setFuelCapacity(double fuelCapacity) { this.fuelCapacity = fuelCapacity; }
        public double getToolsCapacity() { return toolsCapacity; }
        public void setToolsCapacity(double toolsCapacity) { this.toolsCapacity = toolsCapacity; }
        public int getAgentsPerType() { return agentsPerType; }
        public void setAgentsPerType(int agentsPerType) { this.agentsPerType = agentsPerType; }
    }
}
