package era.rank.building;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

public interface ImageSource {
    /**
     * Filenames of the images currently available, in any order.
     *
     * @throws IOException when the album itself can not be read
     */
    List<String> listImages() throws IOException;

    ImageFingerprint fingerprint(String filename) throws IOException;

    /**
     * @return the decoded image, or null when the file is not a readable image
     */
    BufferedImage read(String filename) throws IOException;
}
