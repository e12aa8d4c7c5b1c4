package com.devicesim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "devicesim")
public class SimulatorProperties {

    private String definitionsPath = "definitions";
    private String outputDirectory = "output";
    private Clarification clarification = new Clarification();
    private Simulation simulation = new Simulation();

    // -- nested accessors --
    public int getClarificationMaxAttempts() { return clarification.maxAttempts; }
    public int getLayerWarningThreshold() { return simulation.layerWarningThreshold; }

    public String getDefinitionsPath() { return definitionsPath; }
    public void setDefinitionsPath(String definitionsPath) { this.definitionsPath = definitionsPath; }
    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }
    public Clarification getClarification() { return clarification; }
    public void setClarification(Clarification clarification) { this.clarification = clarification; }
    public Simulation getSimulation() { return simulation; }
    public void setSimulation(Simulation simulation) { this.simulation = simulation; }

    public static class Clarification {
        private int maxAttempts = 3;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Simulation {
        /** Layer width above which a warning is logged. */
        private int layerWarningThreshold = 256;

        public int getLayerWarningThreshold() { return layerWarningThreshold; }
        public void setLayerWarningThreshold(int layerWarningThreshold) { this.layerWarningThreshold = layerWarningThreshold; }
    }
}
