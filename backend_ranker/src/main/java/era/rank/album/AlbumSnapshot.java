package era.rank.album;

import era.rank.building.ImageMetadata;
import era.rank.mining.FaceRef;
import era.rank.mining.PersonCluster;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import lombok.Getter;

@Getter
public class AlbumSnapshot {
    private final String albumId;
    private final SortedMap<String, ImageMetadata> metadata;
    private final List<PersonCluster> clusters;
    private final SortedSet<FaceRef> hidden;

    public AlbumSnapshot(String albumId, SortedMap<String, ImageMetadata> metadata, List<PersonCluster> clusters, SortedSet<FaceRef> hidden) {
        this.albumId = albumId;
        this.metadata = Collections.unmodifiableSortedMap(metadata);
        this.clusters = Collections.unmodifiableList(clusters);
        this.hidden = Collections.unmodifiableSortedSet(hidden);
    }

    public boolean isHidden(PersonCluster cluster) {
        return hidden.contains(cluster.getRepresentative());
    }

    public List<PersonCluster> visibleClusters() {
        List<PersonCluster> visible = new ArrayList<>();
        for (PersonCluster cluster : clusters) {
            if (!isHidden(cluster)) {
                visible.add(cluster);
            }
        }
        return visible;
    }

    public PersonCluster cluster(int clusterIndex) {
        for (PersonCluster cluster : clusters) {
            if (cluster.getClusterIndex() == clusterIndex) {
                return cluster;
            }
        }
        return null;
    }

    public PersonCluster clusterOf(FaceRef face) {
        for (PersonCluster cluster : clusters) {
            if (cluster.contains(face)) {
                return cluster;
            }
        }
        return null;
    }
}
