package com.hartwig.alignpipe.workflow;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.hartwig.alignpipe.ConfigurationException;

import org.apache.commons.lang3.tuple.Pair;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;

/**
 * Validated dependency graph of pipeline nodes. Edges run from the producer of a key to each of its consumers, plus any
 * structural ordering edges requested at construction. The graph is acyclic and every key has at most one producer.
 */
public class PipelineGraph {
    private final String name;
    private final DirectedAcyclicGraph<PipelineNode, NamedEdge> graph;
    private final Set<LogicalFileKey> externalInputKeys;
    private final Map<LogicalFileKey, PipelineNode> producers;

    private PipelineGraph(final String name, final DirectedAcyclicGraph<PipelineNode, NamedEdge> graph,
            final Set<LogicalFileKey> externalInputKeys, final Map<LogicalFileKey, PipelineNode> producers) {
        this.name = name;
        this.graph = graph;
        this.externalInputKeys = Collections.unmodifiableSet(externalInputKeys);
        this.producers = Collections.unmodifiableMap(producers);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Set<PipelineNode> nodes() {
        return Collections.unmodifiableSet(graph.vertexSet());
    }

    public Optional<PipelineNode> node(String nodeName) {
        return graph.vertexSet().stream().filter(node -> node.name().equals(nodeName)).findFirst();
    }

    /**
     * Keys read by this graph that none of its nodes produce.
     */
    public Set<LogicalFileKey> externalInputKeys() {
        return externalInputKeys;
    }

    public Set<LogicalFileKey> producedKeys() {
        return producers.keySet();
    }

    public Optional<PipelineNode> producerOf(LogicalFileKey key) {
        return Optional.ofNullable(producers.get(key));
    }

    public Set<PipelineNode> predecessorsOf(PipelineNode node) {
        return graph.incomingEdgesOf(node).stream().map(graph::getEdgeSource).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<PipelineNode> successorsOf(PipelineNode node) {
        return graph.outgoingEdgesOf(node).stream().map(graph::getEdgeTarget).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean isAncestor(PipelineNode ancestor, PipelineNode node) {
        return graph.getAncestors(node).contains(ancestor);
    }

    /**
     * All stages of this graph, including those inside encapsulated nodes.
     */
    public List<StageDefinition> stages() {
        var stages = new ArrayList<StageDefinition>();
        for (PipelineNode node : graph) {
            if (node instanceof StageDefinition) {
                stages.add((StageDefinition) node);
            } else if (node instanceof EncapsulatedNode) {
                stages.addAll(((EncapsulatedNode) node).graph().stages());
            }
        }
        return stages;
    }

    /**
     * Mutable copy of the graph structure, used to track which nodes are still to run.
     */
    DefaultDirectedGraph<PipelineNode, NamedEdge> copyForRun() {
        var copy = new DefaultDirectedGraph<PipelineNode, NamedEdge>(NamedEdge.class);
        graph.vertexSet().forEach(copy::addVertex);
        for (NamedEdge edge : graph.edgeSet()) {
            copy.addEdge(graph.getEdgeSource(edge), graph.getEdgeTarget(edge), new NamedEdge(edge.name()));
        }
        return copy;
    }

    public String toDotFormat(Function<PipelineNode, String> colorProvider) {
        var exporter = new DOTExporter<PipelineNode, NamedEdge>();
        exporter.setVertexAttributeProvider((v) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(v.name()));
            map.put("color", DefaultAttribute.createAttribute(colorProvider.apply(v)));
            return map;
        });
        exporter.setEdgeAttributeProvider((e) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(e.name()));
            return map;
        });
        var writer = new StringWriter();
        exporter.exportGraph(graph, writer);
        return writer.toString();
    }

    public static class Builder {
        private final String name;
        private final Map<String, PipelineNode> nodesByName = new LinkedHashMap<>();
        private final List<Pair<String, String>> orderingEdges = new ArrayList<>();

        private Builder(final String name) {
            this.name = name;
        }

        public Builder add(PipelineNode node) {
            if (nodesByName.containsKey(node.name())) {
                throw new ConfigurationException(String.format("[%s] Node with name '%s' already exists", name, node.name()));
            }
            nodesByName.put(node.name(), node);
            return this;
        }

        /**
         * Run the node named <code>after</code> only once the node named <code>before</code> has succeeded, even though no
         * file passes between them.
         */
        public Builder addOrderingEdge(String before, String after) {
            orderingEdges.add(Pair.of(before, after));
            return this;
        }

        /**
         * Builds a self-contained graph: every dependency key must be produced by one of its nodes.
         */
        public PipelineGraph build() {
            var result = buildSubGraph();
            if (!result.externalInputKeys().isEmpty()) {
                var missing = result.externalInputKeys().iterator().next();
                var consumer = nodesByName.values()
                        .stream()
                        .filter(node -> node.dependencyKeys().contains(missing))
                        .map(PipelineNode::name)
                        .findFirst()
                        .orElse("unknown");
                throw new ConfigurationException(String.format("[%s] Node '%s' requires '%s' but no stage produces it",
                        name,
                        consumer,
                        missing.path()));
            }
            return result;
        }

        /**
         * Builds a graph that may read keys produced outside of it, as the inside of an {@link EncapsulatedNode}.
         */
        public PipelineGraph buildSubGraph() {
            var graph = new DirectedAcyclicGraph<PipelineNode, NamedEdge>(NamedEdge.class);
            var producers = new LinkedHashMap<LogicalFileKey, PipelineNode>();
            for (PipelineNode node : nodesByName.values()) {
                graph.addVertex(node);
                for (LogicalFileKey key : node.outputKeys()) {
                    var existing = producers.putIfAbsent(key, node);
                    if (existing != null) {
                        throw new ConfigurationException(String.format("[%s] Key '%s' is written by both '%s' and '%s'",
                                name,
                                key.path(),
                                existing.name(),
                                node.name()));
                    }
                }
            }

            var externalInputs = new LinkedHashSet<LogicalFileKey>();
            for (PipelineNode node : nodesByName.values()) {
                for (LogicalFileKey key : node.dependencyKeys()) {
                    var producer = producers.get(key);
                    if (producer == null) {
                        externalInputs.add(key);
                    } else if (producer == node) {
                        throw new ConfigurationException(String.format("[%s] Node '%s' depends on its own output '%s'",
                                name,
                                node.name(),
                                key.path()));
                    } else {
                        addEdge(graph, producer, node, key.role());
                    }
                }
            }
            for (Pair<String, String> ordering : orderingEdges) {
                addEdge(graph, findNode(ordering.getLeft()), findNode(ordering.getRight()), NamedEdge.ORDERING);
            }
            return new PipelineGraph(name, graph, externalInputs, producers);
        }

        private PipelineNode findNode(String nodeName) {
            var node = nodesByName.get(nodeName);
            if (node == null) {
                throw new ConfigurationException(String.format("[%s] Ordering edge refers to unknown node '%s'", name, nodeName));
            }
            return node;
        }

        private void addEdge(DirectedAcyclicGraph<PipelineNode, NamedEdge> graph, PipelineNode source, PipelineNode target,
                String label) {
            if (graph.containsEdge(source, target)) {
                return;
            }
            try {
                graph.addEdge(source, target, new NamedEdge(label));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(String.format("[%s] Edge from '%s' to '%s' would introduce a cycle",
                        name,
                        source.name(),
                        target.name()), e);
            }
        }
    }
}
