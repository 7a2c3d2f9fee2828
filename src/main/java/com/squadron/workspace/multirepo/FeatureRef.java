package com.squadron.workspace.multirepo;

/**
 * The feature a set of pull requests belongs to.
 *
 * @param name        short feature name, used in the title prefix
 * @param description optional description, used as the title
 * @param branchName  feature branch
 */
public record FeatureRef(String name, String description, String branchName) {

    /** {@code [name] description}, or {@code [name] Feature implementation} without a description. */
    public String pullRequestTitle() {
        String text = description == null || description.isBlank() ? "Feature implementation" : description;
        return "[%s] %s".formatted(name, text);
    }
}
