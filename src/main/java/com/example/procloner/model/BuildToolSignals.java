package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Page-level evidence collected from the entry page: framework marker flags, the ordered
 * script sources and any generator meta tags.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BuildToolSignals {

    private boolean hasVue;
    private boolean hasReact;
    private boolean hasVite;
    private boolean hasWebpack;
    private boolean hasAngular;
    private List<String> scriptSources = new ArrayList<>();
    private List<String> metaGenerators = new ArrayList<>();

    public boolean isHasVue() { return hasVue; }
    public void setHasVue(boolean hasVue) { this.hasVue = hasVue; }
    public boolean isHasReact() { return hasReact; }
    public void setHasReact(boolean hasReact) { this.hasReact = hasReact; }
    public boolean isHasVite() { return hasVite; }
    public void setHasVite(boolean hasVite) { this.hasVite = hasVite; }
    public boolean isHasWebpack() { return hasWebpack; }
    public void setHasWebpack(boolean hasWebpack) { this.hasWebpack = hasWebpack; }
    public boolean isHasAngular() { return hasAngular; }
    public void setHasAngular(boolean hasAngular) { this.hasAngular = hasAngular; }

    public List<String> getScriptSources() { return scriptSources; }
    public void setScriptSources(List<String> scriptSources) {
        this.scriptSources = scriptSources == null ? new ArrayList<String>() : scriptSources;
    }

    public List<String> getMetaGenerators() { return metaGenerators; }
    public void setMetaGenerators(List<String> metaGenerators) {
        this.metaGenerators = metaGenerators == null ? new ArrayList<String>() : metaGenerators;
    }

    public boolean anyScriptContains(String... needles) {
        for (String src : scriptSources) {
            if (src == null) continue;
            String lower = src.toLowerCase();
            for (String n : needles) {
                if (lower.contains(n)) return true;
            }
        }
        return false;
    }

    public boolean anyGeneratorContains(String needle) {
        for (String g : metaGenerators) {
            if (g != null && g.toLowerCase().contains(needle)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return !hasVue && !hasReact && !hasVite && !hasWebpack && !hasAngular
                && scriptSources.isEmpty() && metaGenerators.isEmpty();
    }
}
