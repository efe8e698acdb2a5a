package era.rank.base;

public class RankerException extends Exception {
    public RankerException(String message) {
        super(message);
    }

    public RankerException(String message, Throwable cause) {
        super(message, cause);
    }
}
