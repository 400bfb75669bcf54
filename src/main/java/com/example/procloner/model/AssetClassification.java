package com.example.procloner.model;

import java.util.Objects;

public class AssetClassification {

    private final AssetType type;
    private final String subtype;

    public AssetClassification(AssetType type, String subtype) {
        this.type = type == null ? AssetType.OTHER : type;
        this.subtype = subtype;
    }

    public static AssetClassification of(AssetType type, String subtype) {
        return new AssetClassification(type, subtype);
    }

    public AssetType getType() { return type; }
    public String getSubtype() { return subtype; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetClassification)) return false;
        AssetClassification that = (AssetClassification) o;
        return type == that.type && Objects.equals(subtype, that.subtype);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, subtype);
    }

    @Override
    public String toString() {
        return subtype == null ? type.value() : type.value() + "/" + subtype;
    }
}
