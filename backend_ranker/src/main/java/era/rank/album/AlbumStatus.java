package era.rank.album;

public enum AlbumStatus {
    PENDING,
    PROCESSING,
    DONE,
    ERROR
}
