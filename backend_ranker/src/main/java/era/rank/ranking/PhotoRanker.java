package era.rank.ranking;

import era.rank.base.Embeddings;
import era.rank.building.FaceRecord;
import era.rank.building.ImageMetadata;
import era.rank.building.ImageSource;
import era.rank.building.ModelUnavailableException;
import era.rank.building.QualitySignalExtractor;
import era.rank.mining.FaceRef;
import era.rank.mining.IdentityClusterer;
import era.rank.mining.PersonCluster;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Orders the photos of one person, best first.
 */
public class PhotoRanker {
    private static final Logger logger = LogManager.getLogger(PhotoRanker.class);

    private final PhotoScorer scorer;
    private final IdentityClusterer clusterer;

    public PhotoRanker(PhotoScorer scorer, IdentityClusterer clusterer) {
        this.scorer = scorer;
        this.clusterer = clusterer;
    }

    public PhotoScorer getScorer() {
        return scorer;
    }

    /**
     * Ranks every photo holding at least one face of the target cluster.
     *
     * @param topK maximum length of the result, zero or negative for all
     */
    public List<RankedPhoto> rank(Map<String, ImageMetadata> albumMetadata, PersonCluster target, int topK) {
        // First member face per image, members iterate in (filename, faceIndex) order
        Map<String, Integer> targetFaces = new HashMap<>();
        for (FaceRef ref : target.getMembers()) {
            targetFaces.putIfAbsent(ref.getFilename(), ref.getFaceIndex());
        }

        List<RankedPhoto> ranked = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : targetFaces.entrySet()) {
            ImageMetadata image = albumMetadata.get(entry.getKey());
            if (image == null) {
                continue;
            }
            FaceRecord face = image.face(entry.getValue());
            if (face == null) {
                continue;
            }
            ranked.add(new RankedPhoto(entry.getKey(), scorer.score(image, face)));
        }
        Collections.sort(ranked);
        if (topK > 0 && ranked.size() > topK) {
            return new ArrayList<>(ranked.subList(0, topK));
        }
        return ranked;
    }

    /**
     * Ranks without any cache: re-extracts every image of the source, clusters the fresh signals
     * and ranks the cluster closest to the target embedding. Empty when no cluster reaches the
     * clustering threshold. Unreadable images are logged and skipped; only an unlistable source
     * or an unavailable model fail the whole ranking.
     */
    public List<RankedPhoto> rankLive(ImageSource source, QualitySignalExtractor extractor, float[] targetEmbedding, int topK)
        throws IOException, ModelUnavailableException {
        Map<String, ImageMetadata> fresh = new TreeMap<>();
        for (String filename : source.listImages()) {
            BufferedImage image;
            try {
                image = source.read(filename);
            } catch (IOException e) {
                logger.warn("Can not read {}, skipped from live ranking: {}", filename, e.getMessage());
                continue;
            }
            if (image == null) {
                logger.warn("Can not decode {}, skipped from live ranking", filename);
                continue;
            }
            ImageMetadata extracted = extractor.extract(image);
            fresh.put(filename, extracted.toBuilder().filename(filename).build());
        }

        PersonCluster best = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (PersonCluster cluster : clusterer.cluster(fresh)) {
            double similarity = Embeddings.similarity(targetEmbedding, cluster.representativeEmbedding());
            if (similarity > bestSimilarity) {
                best = cluster;
                bestSimilarity = similarity;
            }
        }
        if (best == null || bestSimilarity < clusterer.getThreshold()) {
            logger.info("Target person not present among {} live images", fresh.size());
            return new ArrayList<>();
        }
        return rank(fresh, best, topK);
    }
}
