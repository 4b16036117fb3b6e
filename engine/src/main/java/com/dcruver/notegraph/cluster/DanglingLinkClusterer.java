package com.dcruver.notegraph.cluster;

import com.dcruver.notegraph.config.NoteGraphProperties;
import com.dcruver.notegraph.graph.DanglingLink;
import com.dcruver.notegraph.similarity.SimilarityScore;
import com.dcruver.notegraph.similarity.SimilarityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Groups dangling links whose targets are spelled alike, so they can be merged
 * into one canonical target.
 *
 * Every pair of targets is scored once; pairs at or above the threshold are
 * joined in a union-find, so a cluster is the transitive closure of similar
 * pairs. Two members of one cluster can score below the threshold against
 * each other.
 */
@Component
@Slf4j
public class DanglingLinkClusterer {

    private static final Comparator<DanglingLink> MOST_REFERENCED_FIRST =
        Comparator.comparingInt(DanglingLink::getTotalOccurrences).reversed()
            .thenComparing(DanglingLink::getTarget);

    private static final Comparator<DanglingLink> REPRESENTATIVE_ORDER =
        Comparator.comparingInt(DanglingLink::getTotalOccurrences).reversed()
            .thenComparing(Comparator.comparingInt((DanglingLink link) -> link.getSources().size()).reversed())
            .thenComparing(DanglingLink::getTarget);

    private final ClusterOptions defaults;

    @Autowired
    public DanglingLinkClusterer(NoteGraphProperties properties) {
        this(ClusterOptions.builder()
            .threshold(properties.getCluster().getThreshold())
            .minClusterSize(properties.getCluster().getMinClusterSize())
            .maxResults(properties.getCluster().getMaxResults())
            .maxTargets(properties.getCluster().getMaxTargets())
            .build());
    }

    public DanglingLinkClusterer(ClusterOptions defaults) {
        defaults.validate();
        this.defaults = defaults;
    }

    public DanglingLinkClusterer() {
        this(ClusterOptions.defaults());
    }

    public ClusterOptions getDefaults() {
        return defaults;
    }

    public List<SimilarLinkCluster> clusterDanglingLinks(List<DanglingLink> danglingLinks) {
        return clusterDanglingLinks(danglingLinks, defaults);
    }

    /**
     * Cluster dangling links by target similarity.
     *
     * @return clusters with at least {@code minClusterSize} members, most referenced first
     */
    public List<SimilarLinkCluster> clusterDanglingLinks(List<DanglingLink> danglingLinks, ClusterOptions options) {
        options.validate();

        if (danglingLinks.size() < 2) {
            return List.of();
        }

        List<DanglingLink> links = limitInput(danglingLinks, options);
        int n = links.size();

        // Pair scores are not stored; members are rescored against their representative
        UnionFind unionFind = new UnionFind(n);

        for (int i = 0; i < n; i++) {
            String first = links.get(i).getTarget();
            for (int j = i + 1; j < n; j++) {
                if (score(first, links.get(j).getTarget()) >= options.getThreshold()) {
                    unionFind.union(i, j);
                }
            }
        }

        List<SimilarLinkCluster> clusters = new ArrayList<>();
        for (List<Integer> group : unionFind.getGroups()) {
            if (group.size() < options.getMinClusterSize()) {
                continue;
            }
            clusters.add(buildCluster(links, group));
        }

        clusters.sort(Comparator.comparingInt(SimilarLinkCluster::getTotalOccurrences).reversed()
            .thenComparing(SimilarLinkCluster::getRepresentativeTarget));

        List<SimilarLinkCluster> result = clusters.size() > options.getMaxResults()
            ? List.copyOf(clusters.subList(0, options.getMaxResults()))
            : List.copyOf(clusters);

        log.debug("Clustered {} dangling links into {} clusters (threshold {})",
            n, result.size(), options.getThreshold());
        return result;
    }

    /**
     * Dangling links similar to one target, best match first. The target itself is excluded.
     */
    public List<SimilarDanglingLink> findSimilarDanglingLinks(String target, List<DanglingLink> danglingLinks,
                                                              double threshold) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }

        List<SimilarDanglingLink> similar = new ArrayList<>();
        for (DanglingLink link : danglingLinks) {
            if (link.getTarget().equals(target)) {
                continue;
            }
            SimilarityScore score = SimilarityScorer.calculateSimilarity(target, link.getTarget());
            if (score.getScore() >= threshold) {
                similar.add(SimilarDanglingLink.builder()
                    .danglingLink(link)
                    .similarity(score)
                    .build());
            }
        }

        similar.sort(Comparator.comparingDouble((SimilarDanglingLink s) -> s.getSimilarity().getScore()).reversed()
            .thenComparing(s -> s.getDanglingLink().getTarget()));
        return similar;
    }

    public List<SimilarDanglingLink> findSimilarDanglingLinks(String target, List<DanglingLink> danglingLinks) {
        return findSimilarDanglingLinks(target, danglingLinks, defaults.getThreshold());
    }

    // Arguments in a fixed order so the result does not depend on input order
    private static double score(String a, String b) {
        return a.compareTo(b) <= 0
            ? SimilarityScorer.calculateSimilarity(a, b).getScore()
            : SimilarityScorer.calculateSimilarity(b, a).getScore();
    }

    private List<DanglingLink> limitInput(List<DanglingLink> danglingLinks, ClusterOptions options) {
        if (danglingLinks.size() <= options.getMaxTargets() || options.isAllowLargeInput()) {
            return danglingLinks;
        }

        log.warn("{} dangling links exceed the clustering limit of {}, keeping the most referenced",
            danglingLinks.size(), options.getMaxTargets());
        return danglingLinks.stream()
            .sorted(MOST_REFERENCED_FIRST)
            .limit(options.getMaxTargets())
            .toList();
    }

    private SimilarLinkCluster buildCluster(List<DanglingLink> links, List<Integer> group) {
        int representative = group.stream()
            .min(Comparator.comparing(links::get, REPRESENTATIVE_ORDER))
            .orElseThrow();

        String representativeTarget = links.get(representative).getTarget();
        List<SimilarLinkMember> members = new ArrayList<>(group.size());
        int totalOccurrences = 0;
        double similaritySum = 0;

        for (int index : group) {
            DanglingLink link = links.get(index);
            double similarity = index == representative ? 1 : score(representativeTarget, link.getTarget());
            if (index != representative) {
                similaritySum += similarity;
            }
            totalOccurrences += link.getTotalOccurrences();
            members.add(SimilarLinkMember.builder()
                .target(link.getTarget())
                .similarity(similarity)
                .sources(link.getSources())
                .build());
        }

        members.sort(Comparator.comparing((SimilarLinkMember m) -> !m.getTarget().equals(representativeTarget))
            .thenComparing(Comparator.comparingDouble(SimilarLinkMember::getSimilarity).reversed())
            .thenComparing(SimilarLinkMember::getTarget));

        return SimilarLinkCluster.builder()
            .id("cluster-" + UUID.randomUUID())
            .representativeTarget(representativeTarget)
            .members(List.copyOf(members))
            .totalOccurrences(totalOccurrences)
            .averageSimilarity(group.size() > 1 ? similaritySum / (group.size() - 1) : 1)
            .build();
    }
}
