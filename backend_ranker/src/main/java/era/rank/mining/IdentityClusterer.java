package era.rank.mining;

import era.rank.base.Embeddings;
import era.rank.building.FaceRecord;
import era.rank.building.ImageMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Greedy single pass grouping of the faces of one album into unique people. Faces are visited by
 * filename then face index; each joins the most similar existing representative when that
 * similarity reaches the threshold, otherwise it opens a new cluster. The representative is the
 * member with the largest bounding box (ties: smallest face reference).
 */
public class IdentityClusterer {
    private static final Logger logger = LogManager.getLogger(IdentityClusterer.class);

    private final double threshold;

    public IdentityClusterer(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    private static class WorkingCluster {
        final TreeSet<FaceRef> members = new TreeSet<>();
        FaceRef representative;
        FaceRecord representativeFace;

        void add(FaceRef ref, FaceRecord face) {
            members.add(ref);
            if (representative == null || isBetterRepresentative(ref, face)) {
                representative = ref;
                representativeFace = face;
            }
        }

        private boolean isBetterRepresentative(FaceRef ref, FaceRecord face) {
            double area = face.getBoundingBox().area();
            double currentArea = representativeFace.getBoundingBox().area();
            if (area != currentArea) {
                return area > currentArea;
            }
            return ref.compareTo(representative) < 0;
        }
    }

    public List<PersonCluster> cluster(Map<String, ImageMetadata> albumMetadata) {
        SortedMap<String, ImageMetadata> ordered = albumMetadata instanceof SortedMap
            ? (SortedMap<String, ImageMetadata>) albumMetadata
            : new TreeMap<>(albumMetadata);

        List<WorkingCluster> working = new ArrayList<>();
        int totalFaces = 0;
        for (Map.Entry<String, ImageMetadata> entry : ordered.entrySet()) {
            List<FaceRecord> faces = new ArrayList<>(entry.getValue().getFaces());
            faces.sort((a, b) -> Integer.compare(a.getFaceIndex(), b.getFaceIndex()));
            for (FaceRecord face : faces) {
                totalFaces++;
                FaceRef ref = new FaceRef(entry.getKey(), face.getFaceIndex());
                WorkingCluster best = null;
                double bestSimilarity = Double.NEGATIVE_INFINITY;
                for (WorkingCluster candidate : working) {
                    double similarity = Embeddings.similarity(face.getEmbedding(), candidate.representativeFace.getEmbedding());
                    if (similarity > bestSimilarity) {
                        bestSimilarity = similarity;
                        best = candidate;
                    }
                }
                if (best != null && bestSimilarity >= threshold) {
                    best.add(ref, face);
                } else {
                    WorkingCluster created = new WorkingCluster();
                    created.add(ref, face);
                    working.add(created);
                }
            }
        }

        List<PersonCluster> clusters = new ArrayList<>();
        for (int i = 0; i < working.size(); i++) {
            WorkingCluster w = working.get(i);
            clusters.add(new PersonCluster(i, w.representative, w.representativeFace, w.members));
        }
        logger.debug("Clustered {} faces into {} people", totalFaces, clusters.size());
        return clusters;
    }
}
