package com.layeredconfig.core.subset;

import com.layeredconfig.core.config.Config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A configuration composed for one {@link SubsetDescriptor}.
 *
 * <p>
 * Besides the merged values it records the descriptor it was built for and
 * the default files that were read, in the order they were applied.
 * Instances are produced by {@link DefaultsComposer}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigSubset extends Config {

    private final SubsetDescriptor descriptor;

    private final List<Path> filesRead = new ArrayList<>();

    ConfigSubset(SubsetDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "Descriptor must not be null");
    }

    private ConfigSubset(ConfigSubset other) {
        super(other);
        this.descriptor = other.descriptor;
        this.filesRead.addAll(other.filesRead);
    }

    /**
     * @return independent copy keeping the descriptor and the files read
     */
    @Override
    public ConfigSubset copy() {
        return new ConfigSubset(this);
    }

    public SubsetDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * @return unmodifiable list of default files merged into this configuration
     */
    public List<Path> getFilesRead() {
        return Collections.unmodifiableList(filesRead);
    }

    void recordFileRead(Path file) {
        filesRead.add(file);
    }

    /**
     * Check that the descriptor's mandatory keys are present.
     *
     * @throws MissingRequiredKeysException listing every missing key
     */
    public void validate() {
        RequiredKeysValidator.validate(this, descriptor);
    }
}
