package era.rank.building;

import era.rank.base.RankerException;

public class DetectionException extends RankerException {
    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
