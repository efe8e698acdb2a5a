package era.rank.album;

import era.rank.mining.FaceRef;
import era.rank.mining.PersonRef;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class AlbumPerson {
    private final PersonRef personRef;
    private final String displayName;
    private final int clusterIndex;
    private final FaceRef representative;
    private final String cropName;
    private final int photoCount;
    private final int faceCount;
}
