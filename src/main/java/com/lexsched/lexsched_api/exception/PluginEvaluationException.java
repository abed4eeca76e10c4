package com.lexsched.lexsched_api.exception;

import java.util.List;

import com.lexsched.lexsched_api.solver.engine.StageResult;

/**
 * A constraint or objective plugin threw while generating its relations or expression.
 * Constraint failures are reported at stage 0.
 */
public class PluginEvaluationException extends OptimizationFailureException {

    private final String pluginName;

    public PluginEvaluationException(String pluginName, int stageIndex, List<StageResult> completedStages, Throwable cause) {
        super(String.format("Plugin '%s' failed at stage %d: %s", pluginName, stageIndex, cause.getMessage()),
                stageIndex, pluginName, completedStages, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }

    @Override
    public String getKind() {
        return "PLUGIN_EVALUATION";
    }
}
