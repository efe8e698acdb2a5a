package era.rank.mining;

import era.rank.building.FaceRecord;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import lombok.Getter;

@Getter
public class PersonCluster {
    private final int clusterIndex;
    private final FaceRef representative;
    private final FaceRecord representativeFace;
    private final SortedSet<FaceRef> members;
    private volatile String globalId;

    public PersonCluster(int clusterIndex, FaceRef representative, FaceRecord representativeFace, SortedSet<FaceRef> members) {
        this.clusterIndex = clusterIndex;
        this.representative = representative;
        this.representativeFace = representativeFace;
        this.members = Collections.unmodifiableSortedSet(members);
    }

    public float[] representativeEmbedding() {
        return representativeFace.getEmbedding();
    }

    public Optional<String> globalId() {
        return Optional.ofNullable(globalId);
    }

    public boolean isLinked() {
        return globalId != null;
    }

    public void linkTo(String globalId) {
        this.globalId = globalId;
    }

    public void unlink() {
        this.globalId = null;
    }

    public boolean contains(FaceRef face) {
        return members.contains(face);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "PersonCluster(" + clusterIndex + ", rep=" + representative + ", members=" + members.size()
            + (globalId == null ? "" : ", global=" + globalId) + ")";
    }
}
