package era.rank.base;

public class NoFaceFoundException extends RankerException {
    public NoFaceFoundException(String message) {
        super(message);
    }
}
