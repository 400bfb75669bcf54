package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashSet;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CloneOptions {

    // page levels to fetch; the root page is level 1
    private Integer depth;

    // empty means every asset type
    private Set<AssetType> includeAssets = new LinkedHashSet<>();

    private boolean optimizeImages = false;

    private boolean generateServiceWorker = false;

    private Set<ExportFormat> exportFormat = new LinkedHashSet<>();

    public Integer getDepth() {
        return depth;
    }

    public void setDepth(Integer depth) {
        this.depth = depth;
    }

    public Set<AssetType> getIncludeAssets() {
        return includeAssets;
    }

    public void setIncludeAssets(Set<AssetType> includeAssets) {
        this.includeAssets = includeAssets == null ? new LinkedHashSet<AssetType>() : includeAssets;
    }

    public boolean isOptimizeImages() {
        return optimizeImages;
    }

    public void setOptimizeImages(boolean optimizeImages) {
        this.optimizeImages = optimizeImages;
    }

    public boolean isGenerateServiceWorker() {
        return generateServiceWorker;
    }

    public void setGenerateServiceWorker(boolean generateServiceWorker) {
        this.generateServiceWorker = generateServiceWorker;
    }

    public Set<ExportFormat> getExportFormat() {
        return exportFormat;
    }

    public void setExportFormat(Set<ExportFormat> exportFormat) {
        this.exportFormat = exportFormat == null ? new LinkedHashSet<ExportFormat>() : exportFormat;
    }

    public boolean includes(AssetType type) {
        return includeAssets.isEmpty() || type == AssetType.HTML || includeAssets.contains(type);
    }
}
