package era.rank.building;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class HeadPose {
    private final double pitch;
    private final double yaw;
    private final double roll;

    public HeadPose(double pitch, double yaw, double roll) {
        this.pitch = pitch;
        this.yaw = yaw;
        this.roll = roll;
    }
}
