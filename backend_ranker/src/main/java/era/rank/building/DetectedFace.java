package era.rank.building;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class DetectedFace {
    private final BoundingBox boundingBox;
    private final float[] embedding;
    @Getter(AccessLevel.NONE)
    private final HeadPose pose;
    private final double confidence;

    public Optional<HeadPose> pose() {
        return Optional.ofNullable(pose);
    }
}
