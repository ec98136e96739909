package com.stagehand.orchestrator.prompt;

import java.util.Map;

/**
 * Named bag of values a stage prompt may reference.
 *
 * Every field except {@code taskDescription} is optional; the renderer decides
 * what an absent field turns into (empty string, or a legacy placeholder).
 */
public record PromptContext(
        String taskDescription,
        String previousOutput,
        String userInput,
        String userDecision,
        String priorAttemptOutput,
        String stageSummaries,
        String allStageOutputs,
        String availableStages,
        Map<String, StageOutput> stageOutputs
) {

    /** Output and summary of one completed stage, addressed as {{stages.Name.output|summary}}. */
    public record StageOutput(String output, String summary) {}

    public PromptContext {
        stageOutputs = stageOutputs == null ? Map.of() : Map.copyOf(stageOutputs);
    }

    public static Builder forTask(String taskDescription) {
        return new Builder(taskDescription);
    }

    public static final class Builder {
        private final String taskDescription;
        private String previousOutput;
        private String userInput;
        private String userDecision;
        private String priorAttemptOutput;
        private String stageSummaries;
        private String allStageOutputs;
        private String availableStages;
        private Map<String, StageOutput> stageOutputs = Map.of();

        private Builder(String taskDescription) {
            this.taskDescription = taskDescription;
        }

        public Builder previousOutput(String v)     { this.previousOutput = v;     return this; }
        public Builder userInput(String v)          { this.userInput = v;          return this; }
        public Builder userDecision(String v)       { this.userDecision = v;       return this; }
        public Builder priorAttemptOutput(String v) { this.priorAttemptOutput = v; return this; }
        public Builder stageSummaries(String v)     { this.stageSummaries = v;     return this; }
        public Builder allStageOutputs(String v)    { this.allStageOutputs = v;    return this; }
        public Builder availableStages(String v)    { this.availableStages = v;    return this; }
        public Builder stageOutputs(Map<String, StageOutput> v) { this.stageOutputs = v; return this; }

        public PromptContext build() {
            return new PromptContext(taskDescription, previousOutput, userInput, userDecision,
                    priorAttemptOutput, stageSummaries, allStageOutputs, availableStages, stageOutputs);
        }
    }
}
