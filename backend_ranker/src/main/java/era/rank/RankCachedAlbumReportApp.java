package era.rank;

import era.rank.album.AlbumState;
import era.rank.base.RankerConfiguration;
import era.rank.base.Util;
import era.rank.building.ImageMetadata;
import era.rank.building.MetadataStore;
import era.rank.mining.GlobalPerson;
import era.rank.mining.GlobalPersonRegistry;
import era.rank.mining.IdentityClusterer;
import era.rank.mining.IdentityMatcher;
import era.rank.mining.PersonCluster;
import era.rank.ranking.PhotoRanker;
import era.rank.ranking.PhotoScorer;
import era.rank.ranking.RankedPhoto;
import java.io.File;
import java.io.PrintStream;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class RankCachedAlbumReportApp {
    private static final Logger logger = LogManager.getLogger(RankCachedAlbumReportApp.class);
    private static final int PHOTOS_PER_PERSON = 5;

    static void report(File albumDirectory, GlobalPersonRegistry registry, RankerConfiguration c, PrintStream out) {
        SortedMap<String, ImageMetadata> metadata = MetadataStore.forAlbum(albumDirectory).load();
        if (metadata.isEmpty()) {
            out.println("No cached metadata in " + albumDirectory.getAbsolutePath() + ", sync the album first");
            return;
        }

        IdentityClusterer clusterer = new IdentityClusterer(c.getClusterSimilarityThreshold());
        PhotoRanker ranker = new PhotoRanker(new PhotoScorer(c), clusterer);
        List<PersonCluster> clusters = clusterer.cluster(metadata);
        AlbumState state = AlbumState.load(albumDirectory);
        if (registry != null) {
            for (PersonCluster cluster : clusters) {
                String globalId = state.getLinks().get(cluster.getRepresentative());
                if (globalId != null) {
                    cluster.linkTo(globalId);
                }
            }
            new IdentityMatcher(registry, c.getLinkSimilarityThreshold()).dropDanglingLinks(albumDirectory.getName(), clusters);
        }

        out.println("= ALBUM " + albumDirectory.getName() + ": " + metadata.size() + " images, "
            + clusters.size() + " people =");
        for (PersonCluster cluster : clusters) {
            if (state.getHidden().contains(cluster.getRepresentative())) {
                continue;
            }
            String name = IdentityMatcher.displayName(cluster);
            if (registry != null) {
                Optional<GlobalPerson> person = cluster.globalId().flatMap(registry::get);
                if (person.isPresent()) {
                    name = person.get().getName();
                }
            }
            out.println(name + " (" + cluster.size() + " faces, representative " + cluster.getRepresentative() + ")");
            for (RankedPhoto photo : ranker.rank(metadata, cluster, PHOTOS_PER_PERSON)) {
                out.println("  " + photo);
            }
        }
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            logger.error("Usage: RankCachedAlbumReportApp <albumDirectory> [registryDirectory]");
            return;
        }
        Date startDate = new Date();
        logger.info("Application started, timestamp: {}", startDate);
        try {
            RankerConfiguration c = RankerConfiguration.load();
            GlobalPersonRegistry registry = null;
            if (args.length > 1) {
                registry = new GlobalPersonRegistry(new File(args[1]), c.getFaceCropSize());
            }
            report(new File(args[0]), registry, c, System.out);
        } catch (Exception e) {
            logger.error("Report failed", e);
        }
        Date endDate = new Date();
        logger.info("Application ended, timestamp: {}", endDate);
        Util.reportDeltaTime(startDate, endDate);
    }
}
