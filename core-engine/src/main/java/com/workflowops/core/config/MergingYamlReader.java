package com.workflowops.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a YAML document into plain maps, lists and scalars, resolving
 * {@code <<} merge keys with {@link DefaultsMerger}.
 *
 * <p>
 * SnakeYAML flattens merge keys shallowly, which would replace a nested
 * mapping such as {@code gcp_connection} as a whole. This reader therefore
 * composes the node graph and walks it itself; only scalar construction is
 * delegated to SnakeYAML's safe constructor.
 * </p>
 *
 * <p>
 * Not thread-safe; create one reader per load.
 * </p>
 */
final class MergingYamlReader {

    private final LoaderOptions options;
    private final ScalarConstructor scalars;
    private final Set<Node> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

    MergingYamlReader() {
        this.options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        options.setAllowRecursiveKeys(false);
        this.scalars = new ScalarConstructor(options);
    }

    /**
     * @param source YAML text
     * @return the document root, or {@code null} for an empty document
     * @throws ConfigParseException if the text is not valid YAML or uses a
     *                              merge key incorrectly
     */
    Object read(String source) {
        Node root;
        try {
            root = new Yaml(options).compose(new StringReader(source));
        } catch (MarkedYAMLException e) {
            throw new ConfigParseException("", "Malformed YAML" + at(e.getProblemMark()) + ": " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new ConfigParseException("", "Malformed YAML: " + e.getMessage(), e);
        }
        return root == null ? null : toValue(root, "");
    }

    // ---------------------------------------------------------------
    // Node walk
    // ---------------------------------------------------------------

    private Object toValue(Node node, String path) {
        if (!inProgress.add(node)) {
            throw new ConfigParseException(path, "recursive alias" + at(node.getStartMark()));
        }
        try {
            if (node instanceof MappingNode mapping) {
                return toMap(mapping, path);
            }
            if (node instanceof SequenceNode sequence) {
                List<Object> items = new ArrayList<>();
                List<Node> children = sequence.getValue();
                for (int i = 0; i < children.size(); i++) {
                    items.add(toValue(children.get(i), path + "[" + i + "]"));
                }
                return items;
            }
            if (node instanceof ScalarNode scalar) {
                return scalars.construct(scalar, path);
            }
            throw new ConfigParseException(path, "unsupported YAML node " + node.getNodeId());
        } finally {
            inProgress.remove(node);
        }
    }

    private Map<String, Object> toMap(MappingNode node, String path) {
        Map<String, Object> local = new LinkedHashMap<>();
        List<Map<String, Object>> sources = new ArrayList<>();

        for (NodeTuple tuple : node.getValue()) {
            Node keyNode = tuple.getKeyNode();
            if (Tag.MERGE.equals(keyNode.getTag())) {
                sources.addAll(mergeSources(tuple.getValueNode(), path));
                continue;
            }
            if (!(keyNode instanceof ScalarNode scalarKey)) {
                throw new ConfigParseException(path, "mapping keys must be scalars" + at(keyNode.getStartMark()));
            }
            String key = scalarKey.getValue();
            if (local.containsKey(key)) {
                throw new ConfigParseException(path, "duplicate key '" + key + "'" + at(keyNode.getStartMark()));
            }
            local.put(key, toValue(tuple.getValueNode(), child(path, key)));
        }

        if (sources.isEmpty()) {
            return local;
        }
        // Earlier merge sources take precedence over later ones.
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (int i = sources.size() - 1; i >= 0; i--) {
            defaults = DefaultsMerger.merge(defaults, sources.get(i));
        }
        return DefaultsMerger.merge(defaults, local);
    }

    private List<Map<String, Object>> mergeSources(Node value, String path) {
        if (value instanceof MappingNode mapping) {
            return List.of(mergeSource(mapping, path));
        }
        if (value instanceof SequenceNode sequence) {
            List<Map<String, Object>> maps = new ArrayList<>();
            for (Node item : sequence.getValue()) {
                if (!(item instanceof MappingNode mapping)) {
                    throw new ConfigParseException(path,
                            "merge key '<<' expects mappings, found " + item.getNodeId() + at(item.getStartMark()));
                }
                maps.add(mergeSource(mapping, path));
            }
            return maps;
        }
        throw new ConfigParseException(path,
                "merge key '<<' expects a mapping or a sequence of mappings" + at(value.getStartMark()));
    }

    // A source that is still being read is an alias back into its own mapping.
    private Map<String, Object> mergeSource(MappingNode mapping, String path) {
        if (!inProgress.add(mapping)) {
            throw new ConfigParseException(path, "recursive alias in merge key" + at(mapping.getStartMark()));
        }
        try {
            return toMap(mapping, path);
        } finally {
            inProgress.remove(mapping);
        }
    }

    static String child(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    private static String at(Mark mark) {
        return mark == null ? "" : " (line " + (mark.getLine() + 1) + ", column " + (mark.getColumn() + 1) + ")";
    }

    /**
     * Exposes SnakeYAML's safe scalar construction (ints, booleans, floats,
     * nulls, timestamps, strings) for single nodes.
     */
    private static final class ScalarConstructor extends SafeConstructor {

        ScalarConstructor(LoaderOptions options) {
            super(options);
        }

        Object construct(ScalarNode node, String path) {
            try {
                return constructObject(node);
            } catch (YAMLException e) {
                throw new ConfigParseException(path, "cannot read value: " + e.getMessage(), e);
            }
        }
    }
}
