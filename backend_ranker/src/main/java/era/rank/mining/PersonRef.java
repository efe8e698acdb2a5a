package era.rank.mining;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Textual reference to a person: {@code global:<id>} for a registry entry or
 * {@code album:<albumId>:<clusterIndex>} for an unlinked cluster of one album.
 */
@Getter
@EqualsAndHashCode
public class PersonRef {
    public static final String GLOBAL_PREFIX = "global:";
    public static final String ALBUM_PREFIX = "album:";

    private final String globalId;
    private final String albumId;
    private final int clusterIndex;

    private PersonRef(String globalId, String albumId, int clusterIndex) {
        this.globalId = globalId;
        this.albumId = albumId;
        this.clusterIndex = clusterIndex;
    }

    public static PersonRef global(String globalId) {
        if (globalId == null || globalId.isEmpty()) {
            throw new IllegalArgumentException("Empty global person id");
        }
        return new PersonRef(globalId, null, -1);
    }

    public static PersonRef album(String albumId, int clusterIndex) {
        if (albumId == null || albumId.isEmpty() || clusterIndex < 0) {
            throw new IllegalArgumentException("Invalid album person " + albumId + ":" + clusterIndex);
        }
        return new PersonRef(null, albumId, clusterIndex);
    }

    public static PersonRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Null person reference");
        }
        if (text.startsWith(GLOBAL_PREFIX)) {
            return global(text.substring(GLOBAL_PREFIX.length()));
        }
        if (text.startsWith(ALBUM_PREFIX)) {
            String rest = text.substring(ALBUM_PREFIX.length());
            int separator = rest.lastIndexOf(':');
            if (separator <= 0) {
                throw new IllegalArgumentException("Malformed person reference [" + text + "]");
            }
            try {
                return album(rest.substring(0, separator), Integer.parseInt(rest.substring(separator + 1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed person reference [" + text + "]", e);
            }
        }
        throw new IllegalArgumentException("Unknown person reference [" + text + "]");
    }

    public boolean isGlobal() {
        return globalId != null;
    }

    @Override
    public String toString() {
        return isGlobal() ? GLOBAL_PREFIX + globalId : ALBUM_PREFIX + albumId + ":" + clusterIndex;
    }
}
