package era.rank.base;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Date;
import java.util.Properties;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class Util {
    private static final Logger logger = LogManager.getLogger(Util.class);

    public static void reportDeltaTime(Date start, Date end) {
        long timeDifferenceMilliSeconds = end.getTime() - start.getTime();
        long minutes = timeDifferenceMilliSeconds / (60 * 1000);
        long seconds = (timeDifferenceMilliSeconds / 1000) % 60;
        String msg = String.format("Elapsed time minutes:seconds -> %02d:%02d", minutes, seconds);
        logger.info(msg);
    }

    public static ThreadFactory buildThreadFactory(String threadNamePattern) {
        ThreadFactory threadFactory;
        threadFactory = new ThreadFactory() {
            private final AtomicInteger threadCounter = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                String name = String.format(threadNamePattern, threadCounter.getAndIncrement());
                Thread thread = new Thread(r, name);
                thread.setDaemon(true);
                return thread;
            }
        };
        return threadFactory;
    }

    /**
     * Loads a properties file from the classpath. Returns null when the resource is missing or
     * can not be parsed, so callers fall back to their defaults.
     */
    public static Properties loadClasspathProperties(String resourceName) {
        ClassLoader classLoader = Util.class.getClassLoader();
        try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
            if (input == null) {
                logger.warn("{} not found on classpath, using defaults", resourceName);
                return null;
            }
            Properties properties = new Properties();
            properties.load(input);
            return properties;
        } catch (IOException e) {
            logger.error("Can not read {} from classpath, using defaults", resourceName, e);
            return null;
        }
    }

    /**
     * Writes content next to the target and then moves it over the target, so a reader either
     * sees the previous complete file or the new complete file.
     */
    public static void writeFileAtomically(File target, String content) throws IOException {
        File parent = target.getAbsoluteFile().getParentFile();
        if (parent != null) {
            FileUtils.forceMkdir(parent);
        }
        File temporary = new File(parent, target.getName() + ".tmp");
        FileUtils.writeStringToFile(temporary, content, StandardCharsets.UTF_8);
        try {
            Files.move(temporary.toPath(), target.toPath(),
                StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to plain replace", target.getAbsolutePath());
            Files.move(temporary.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
