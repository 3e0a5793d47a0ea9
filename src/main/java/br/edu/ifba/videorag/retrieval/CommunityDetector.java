package br.edu.ifba.videorag.retrieval;

import br.edu.ifba.videorag.storage.GraphStorage.GraphEdge;
import br.edu.ifba.videorag.storage.GraphStorage.GraphSubgraph;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions a subgraph into communities with the local-moving phase of the Louvain method.
 *
 * <p>Edges are treated as undirected with unit weight per distinct edge; parallel edges of
 * different types add up. Nodes are visited in id order and ties go to the lowest community
 * index, so the same subgraph always yields the same partition.</p>
 */
public class CommunityDetector {

    private static final int MAX_PASSES = 32;
    private static final double EPSILON = 1e-12;

    /**
     * @return community index by node id; indices are dense and numbered by first appearance in id order
     */
    @NotNull
    public Map<String, Integer> detect(@NotNull GraphSubgraph subgraph) {
        final List<String> nodes = new ArrayList<>(subgraph.nodeIds());
        nodes.sort(null);
        final Map<String, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            indexOf.put(nodes.get(i), i);
        }

        final List<Map<Integer, Double>> adjacency = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            adjacency.add(new TreeMap<>());
        }
        for (GraphEdge edge : subgraph.edges()) {
            final Integer source = indexOf.get(edge.sourceId());
            final Integer target = indexOf.get(edge.targetId());
            if (source == null || target == null || source.equals(target)) {
                continue;
            }
            adjacency.get(source).merge(target, 1.0, Double::sum);
            adjacency.get(target).merge(source, 1.0, Double::sum);
        }

        final double[] degree = new double[nodes.size()];
        double totalDegree = 0;
        for (int i = 0; i < nodes.size(); i++) {
            for (double weight : adjacency.get(i).values()) {
                degree[i] += weight;
            }
            totalDegree += degree[i];
        }

        final int[] community = new int[nodes.size()];
        final double[] communityDegree = new double[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            community[i] = i;
            communityDegree[i] = degree[i];
        }

        if (totalDegree > 0) {
            boolean moved = true;
            for (int pass = 0; pass < MAX_PASSES && moved; pass++) {
                moved = false;
                for (int node = 0; node < nodes.size(); node++) {
                    if (moveNode(node, adjacency.get(node), degree, totalDegree, community, communityDegree)) {
                        moved = true;
                    }
                }
            }
        }

        final Map<Integer, Integer> relabel = new HashMap<>();
        final Map<String, Integer> result = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            final int label = relabel.computeIfAbsent(community[i], c -> relabel.size());
            result.put(nodes.get(i), label);
        }
        return result;
    }

    /**
     * Moves one node to the neighbouring community with the best modularity gain.
     *
     * @return true when the node changed community
     */
    private static boolean moveNode(
            int node,
            Map<Integer, Double> neighbours,
            double[] degree,
            double totalDegree,
            int[] community,
            double[] communityDegree) {
        final int current = community[node];
        final Map<Integer, Double> linksToCommunity = new TreeMap<>();
        for (Map.Entry<Integer, Double> neighbour : neighbours.entrySet()) {
            linksToCommunity.merge(community[neighbour.getKey()], neighbour.getValue(), Double::sum);
        }

        communityDegree[current] -= degree[node];

        int best = current;
        double bestGain = linksToCommunity.getOrDefault(current, 0.0)
            - communityDegree[current] * degree[node] / totalDegree;
        for (Map.Entry<Integer, Double> candidate : linksToCommunity.entrySet()) {
            final double gain = candidate.getValue() - communityDegree[candidate.getKey()] * degree[node] / totalDegree;
            if (gain > bestGain + EPSILON) {
                best = candidate.getKey();
                bestGain = gain;
            }
        }

        communityDegree[best] += degree[node];
        community[node] = best;
        return best != current;
    }
}
