package com.codeswarm.core.agent;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Read-only view of what a worker operates on: the sandbox-resolved target
 * directory and the model selector forwarded from the run request.
 */
public final class ResourceSet {

    private final Path   root;
    private final String modelSelector;   // null = client default

    public ResourceSet(Path root, String modelSelector) {
        this.root          = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.modelSelector = modelSelector == null || modelSelector.isBlank() ? null : modelSelector.trim();
    }

    public Path   getRoot()          { return root; }
    public String getModelSelector() { return modelSelector; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceSet)) return false;
        ResourceSet that = (ResourceSet) o;
        return root.equals(that.root) && Objects.equals(modelSelector, that.modelSelector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, modelSelector);
    }

    @Override
    public String toString() {
        return "ResourceSet{root=" + root + (modelSelector != null ? ", model=" + modelSelector : "") + "}";
    }
}
