package era.rank.album;

import era.rank.base.RankerException;

public class PipelineException extends RankerException {
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
