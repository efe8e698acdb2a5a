package era.rank.mining;

import era.rank.base.Embeddings;
import era.rank.base.NoFaceFoundException;
import era.rank.building.DetectionException;
import era.rank.building.QualitySignalExtractor;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Connects album clusters with the global registry and answers "who is this face" queries over
 * global people and album clusters.
 */
public class IdentityMatcher {
    private static final Logger logger = LogManager.getLogger(IdentityMatcher.class);

    private static final Comparator<MatchCandidate> CANDIDATE_ORDER =
        Comparator.comparingDouble(MatchCandidate::getSimilarity).reversed()
            .thenComparingInt(MatchCandidate::getCreationRank);

    /**
     * Provides the face pixels used as crop when an album cluster becomes a global person.
     */
    public interface RepresentativeCrops {
        BufferedImage load(String albumId, PersonCluster cluster) throws IOException;
    }

    private final GlobalPersonRegistry registry;
    private final double linkThreshold;

    public IdentityMatcher(GlobalPersonRegistry registry, double linkThreshold) {
        this.registry = registry;
        this.linkThreshold = linkThreshold;
    }

    public GlobalPersonRegistry getRegistry() {
        return registry;
    }

    /**
     * Unlinks clusters pointing at global people that no longer exist.
     *
     * @return number of links dropped
     */
    public int dropDanglingLinks(String albumId, List<PersonCluster> clusters) {
        int dropped = 0;
        for (PersonCluster cluster : clusters) {
            Optional<String> id = cluster.globalId();
            if (id.isPresent() && !registry.contains(id.get())) {
                logger.warn("Album {} cluster {} points to missing global person {}, link dropped",
                    albumId, cluster.getClusterIndex(), id.get());
                cluster.unlink();
                dropped++;
            }
        }
        return dropped;
    }

    /**
     * Links each unlinked cluster to the most similar global person when the similarity exceeds
     * the link threshold.
     *
     * @return number of new links
     */
    public int link(String albumId, List<PersonCluster> clusters) {
        dropDanglingLinks(albumId, clusters);
        List<GlobalPerson> people = registry.list();
        int linked = 0;
        for (PersonCluster cluster : clusters) {
            if (cluster.isLinked()) {
                continue;
            }
            GlobalPerson best = null;
            double bestSimilarity = Double.NEGATIVE_INFINITY;
            for (GlobalPerson person : people) {
                double similarity = Embeddings.similarity(cluster.representativeEmbedding(), person.getRepresentativeEmbedding());
                if (similarity > bestSimilarity) {
                    best = person;
                    bestSimilarity = similarity;
                }
            }
            if (best != null && bestSimilarity > linkThreshold) {
                cluster.linkTo(best.getId());
                linked++;
                logger.info("Album {} cluster {} linked to [{}] ({})", albumId, cluster.getClusterIndex(),
                    best.getName(), String.format("%.3f", bestSimilarity));
            }
        }
        return linked;
    }

    /**
     * @param albumClusters current clusters of every album, keyed by album id
     */
    public MatchResult find(float[] query, double threshold, int topK, SortedMap<String, List<PersonCluster>> albumClusters) {
        Map<PersonRef, MatchCandidate> byRef = new LinkedHashMap<>();
        List<GlobalPerson> people = registry.list();
        int rank = 0;
        for (GlobalPerson person : people) {
            double similarity = Embeddings.similarity(query, person.getRepresentativeEmbedding());
            offer(byRef, new MatchCandidate(PersonRef.global(person.getId()), person.getName(), similarity, rank++));
        }
        for (Map.Entry<String, List<PersonCluster>> album : albumClusters.entrySet()) {
            List<PersonCluster> clusters = new ArrayList<>(album.getValue());
            clusters.sort(Comparator.comparingInt(PersonCluster::getClusterIndex));
            for (PersonCluster cluster : clusters) {
                double similarity = Embeddings.similarity(query, cluster.representativeEmbedding());
                Optional<GlobalPerson> global = cluster.globalId().flatMap(registry::get);
                MatchCandidate candidate;
                if (global.isPresent()) {
                    candidate = new MatchCandidate(PersonRef.global(global.get().getId()), global.get().getName(),
                        similarity, registry.creationOrder(global.get().getId()));
                } else {
                    candidate = new MatchCandidate(PersonRef.album(album.getKey(), cluster.getClusterIndex()),
                        displayName(cluster), similarity, rank++);
                }
                offer(byRef, candidate);
            }
        }

        List<MatchCandidate> sorted = new ArrayList<>(byRef.values());
        sorted.sort(CANDIDATE_ORDER);
        boolean matched = !sorted.isEmpty() && sorted.get(0).getSimilarity() >= threshold;
        if (topK > 0 && sorted.size() > topK) {
            sorted = new ArrayList<>(sorted.subList(0, topK));
        }
        return new MatchResult(matched, sorted);
    }

    public MatchResult findByPhoto(
        QualitySignalExtractor extractor,
        BufferedImage image,
        double threshold,
        int topK,
        SortedMap<String, List<PersonCluster>> albumClusters) throws DetectionException, NoFaceFoundException {
        float[] query = extractor.largestFaceEmbedding(image);
        return find(query, threshold, topK, albumClusters);
    }

    /**
     * Renames a person. An album cluster that is not linked yet becomes a new global person built
     * from its representative face, and is linked to it.
     */
    public GlobalPerson rename(
        PersonRef ref,
        String name,
        SortedMap<String, List<PersonCluster>> albumClusters,
        RepresentativeCrops crops) throws IOException, PersonNotFoundException {
        if (ref.isGlobal()) {
            return registry.rename(ref.getGlobalId(), name);
        }
        PersonCluster cluster = findCluster(ref, albumClusters);
        dropDanglingLinks(ref.getAlbumId(), List.of(cluster));
        if (cluster.isLinked()) {
            return registry.rename(cluster.getGlobalId(), name);
        }
        BufferedImage crop = null;
        try {
            crop = crops == null ? null : crops.load(ref.getAlbumId(), cluster);
        } catch (IOException e) {
            logger.warn("Can not load representative crop for {}: {}", ref, e.getMessage());
        }
        GlobalPerson person = registry.add(name, cluster.representativeEmbedding(), crop);
        cluster.linkTo(person.getId());
        return person;
    }

    public static PersonCluster findCluster(PersonRef ref, SortedMap<String, List<PersonCluster>> albumClusters)
        throws PersonNotFoundException {
        List<PersonCluster> clusters = albumClusters.get(ref.getAlbumId());
        if (clusters != null) {
            for (PersonCluster cluster : clusters) {
                if (cluster.getClusterIndex() == ref.getClusterIndex()) {
                    return cluster;
                }
            }
        }
        throw new PersonNotFoundException("No person " + ref);
    }

    public static String displayName(PersonCluster cluster) {
        return "Person " + (cluster.getClusterIndex() + 1);
    }

    private static void offer(Map<PersonRef, MatchCandidate> byRef, MatchCandidate candidate) {
        MatchCandidate current = byRef.get(candidate.getPersonRef());
        if (current == null) {
            byRef.put(candidate.getPersonRef(), candidate);
        } else if (candidate.getSimilarity() > current.getSimilarity()) {
            byRef.put(candidate.getPersonRef(), current.withSimilarity(candidate.getSimilarity()));
        }
    }
}
