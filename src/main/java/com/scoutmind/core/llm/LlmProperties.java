package com.scoutmind.core.llm;

import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Model selection and sampling settings for every LLM call the research
 * pipeline makes.
 * <p>
 * Blank model names leave the choice to {@code spring.ai.openai.chat.options.model}.
 */
@Component
@ConfigurationProperties(prefix = "scoutmind.llm")
public class LlmProperties {

    private static final String PLACEHOLDER_KEY = "not-set";

    private String apiKey = "";
    private String model = "";
    private String plannerModel = "";
    private String deepResearchModel = "";
    private double temperature = 0.7;
    private double plannerTemperature = 0.3;
    private int maxTokens = 8192;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getPlannerModel() {
        return plannerModel;
    }

    public void setPlannerModel(String plannerModel) {
        this.plannerModel = plannerModel;
    }

    public String getDeepResearchModel() {
        return deepResearchModel;
    }

    public void setDeepResearchModel(String deepResearchModel) {
        this.deepResearchModel = deepResearchModel;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public double getPlannerTemperature() {
        return plannerTemperature;
    }

    public void setPlannerTemperature(double plannerTemperature) {
        this.plannerTemperature = plannerTemperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_KEY.equals(apiKey);
    }

    public ChatOptions plannerOptions() {
        return buildOptions(firstNonBlank(plannerModel, model), plannerTemperature, maxTokens);
    }

    /**
     * Options for a task-level call. Deep research switches to the deep model
     * when one is configured.
     */
    public ChatOptions taskOptions(boolean deepResearch, double taskTemperature) {
        String selected = deepResearch ? firstNonBlank(deepResearchModel, model) : model;
        return buildOptions(selected, taskTemperature, maxTokens);
    }

    public ChatOptions taskOptions(boolean deepResearch, double taskTemperature, int taskMaxTokens) {
        String selected = deepResearch ? firstNonBlank(deepResearchModel, model) : model;
        return buildOptions(selected, taskTemperature, Math.min(taskMaxTokens, maxTokens));
    }

    private static ChatOptions buildOptions(String modelName, double temp, int tokens) {
        var builder = ChatOptions.builder()
                .temperature(temp)
                .maxTokens(tokens);
        if (modelName != null && !modelName.isBlank()) {
            builder.model(modelName);
        }
        return builder.build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
