package era.rank.album;

import era.rank.building.FaceRecord;
import era.rank.mining.FaceRef;
import era.rank.mining.PersonRef;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class PhotoFace {
    private final FaceRef face;
    private final FaceRecord record;
    private final PersonRef personRef;
    private final String displayName;
}
