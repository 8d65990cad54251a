package com.vibeloop.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "vibe.llm")
public class LlmProperties {

    /** "echo" (offline, no API calls) or "openai" (any OpenAI-compatible endpoint, e.g. OpenRouter). */
    private String provider = "echo";
    private String codeModel = "openai/gpt-4o-mini";
    private String visionModel = "openai/gpt-4o-mini";
    private String codeSystemPrompt = """
            You are a front-end developer iterating on a single self-contained web page.
            Reply with the complete updated page in one ```html fenced block, followed by a short summary.""";
    private String visionSystemPrompt = """
            You are a UI reviewer. You are shown a screenshot of a web page under development.
            Reply with a concise, prioritized list of concrete changes for the next revision.""";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getCodeModel() {
        return codeModel;
    }

    public void setCodeModel(String codeModel) {
        this.codeModel = codeModel;
    }

    public String getVisionModel() {
        return visionModel;
    }

    public void setVisionModel(String visionModel) {
        this.visionModel = visionModel;
    }

    public String getCodeSystemPrompt() {
        return codeSystemPrompt;
    }

    public void setCodeSystemPrompt(String codeSystemPrompt) {
        this.codeSystemPrompt = codeSystemPrompt;
    }

    public String getVisionSystemPrompt() {
        return visionSystemPrompt;
    }

    public void setVisionSystemPrompt(String visionSystemPrompt) {
        this.visionSystemPrompt = visionSystemPrompt;
    }
}
