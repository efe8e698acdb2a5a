package era.rank.album;

public class AlbumBusyException extends PipelineException {
    public AlbumBusyException(String albumId) {
        super("Album " + albumId + " is already being processed", null);
    }
}
