package era.rank.building;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.imageio.ImageIO;
import org.apache.commons.io.FilenameUtils;

public class DirectoryImageSource implements ImageSource {
    public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "gif");

    private final File directory;

    public DirectoryImageSource(File directory) {
        this.directory = directory;
    }

    public File getDirectory() {
        return directory;
    }

    public static boolean isImageFilename(String name) {
        if (name == null || name.startsWith(".")) {
            return false;
        }
        return IMAGE_EXTENSIONS.contains(FilenameUtils.getExtension(name).toLowerCase());
    }

    @Override
    public List<String> listImages() throws IOException {
        if (!directory.isDirectory()) {
            throw new IOException("Can not open directory " + directory.getAbsolutePath());
        }
        File[] children = directory.listFiles();
        if (children == null) {
            throw new IOException("Can not list directory " + directory.getAbsolutePath());
        }
        List<String> names = new ArrayList<>();
        for (File child : children) {
            if (child.isFile() && isImageFilename(child.getName())) {
                names.add(child.getName());
            }
        }
        return names;
    }

    @Override
    public ImageFingerprint fingerprint(String filename) throws IOException {
        File fd = file(filename);
        if (!fd.isFile()) {
            throw new IOException("File does not exist: " + fd.getAbsolutePath());
        }
        return new ImageFingerprint(fd.length(), fd.lastModified());
    }

    @Override
    public BufferedImage read(String filename) throws IOException {
        return ImageIO.read(file(filename));
    }

    public File file(String filename) {
        return new File(directory, FilenameUtils.getName(filename));
    }
}
