package com.codeswarm.orchestrator;

/**
 * Input of one refactoring run.
 *
 * maxIterations and model are optional; a null maxIterations falls back to
 * {@code codeswarm.loop.max-iterations}, a null or blank model to the
 * client's configured model.
 */
public class RunRequest {

    private final String  targetDir;
    private final Integer maxIterations;
    private final String  model;

    public RunRequest(String targetDir, Integer maxIterations, String model) {
        this.targetDir     = targetDir;
        this.maxIterations = maxIterations;
        this.model         = model;
    }

    public static RunRequest forTarget(String targetDir) {
        return new RunRequest(targetDir, null, null);
    }

    public String  getTargetDir()     { return targetDir; }
    public Integer getMaxIterations() { return maxIterations; }
    public String  getModel()         { return model; }

    @Override
    public String toString() {
        return "RunRequest{targetDir=" + targetDir + ", maxIterations=" + maxIterations + ", model=" + model + "}";
    }
}
