package com.layeredconfig.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SnakeYAML constructor adding the {@code !include} tag.
 *
 * <p>
 * The tagged value names one or more YAML files relative to the directory of
 * the file being parsed, and is replaced by their parsed content:
 * </p>
 *
 * <pre>
 * storageClasses: !include storageClasses.yaml
 * formatters: !include [a.yaml, b.yaml]
 * templates: !include {default: templates.yaml}
 * </pre>
 *
 * @since 1.0.0
 */
final class IncludeConstructor extends SafeConstructor {

    private static final Logger LOG = LoggerFactory.getLogger(IncludeConstructor.class);

    static final Tag INCLUDE_TAG = new Tag("!include");

    private final Path root;

    /**
     * @param root    directory against which included file names are resolved
     * @param options loader options shared with the including document
     */
    IncludeConstructor(Path root, LoaderOptions options) {
        super(options);
        this.root = root;
        this.yamlConstructors.put(INCLUDE_TAG, new ConstructInclude());
    }

    private Object extractFile(String fileName) {
        Path filePath = root.resolve(fileName);
        LOG.debug("Opening YAML file via !include: {}", filePath);
        if (!Files.exists(filePath)) {
            throw new UnresolvedIncludeException(filePath.toString());
        }
        return ConfigLoader.readYamlDocument(filePath);
    }

    private final class ConstructInclude extends AbstractConstruct {

        @Override
        public Object construct(Node node) {
            if (node instanceof ScalarNode scalar) {
                return extractFile(String.valueOf(constructScalar(scalar)));
            }
            if (node instanceof SequenceNode sequence) {
                List<Object> result = new ArrayList<>();
                for (Object fileName : constructSequence(sequence)) {
                    result.add(extractFile(String.valueOf(fileName)));
                }
                return result;
            }
            if (node instanceof MappingNode mapping) {
                Map<Object, Object> result = new LinkedHashMap<>();
                for (Map.Entry<Object, Object> entry : constructMapping(mapping).entrySet()) {
                    result.put(entry.getKey(), extractFile(String.valueOf(entry.getValue())));
                }
                return result;
            }
            throw new ConfigException("Unrecognised node type in !include statement at "
                    + node.getStartMark());
        }
    }
}
