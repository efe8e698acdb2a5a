package era.rank.building;

import java.awt.image.BufferedImage;

public class BlurDetector {
    private BlurDetector() {}

    public static double laplacianVariance(BufferedImage image) {
        if (image == null || image.getWidth() < 1 || image.getHeight() < 1) {
            return 0.0;
        }
        int[][] gray = toGray(image);
        int dx = image.getWidth();
        int dy = image.getHeight();

        double sum = 0.0;
        double sumSquares = 0.0;
        for (int y = 0; y < dy; y++) {
            for (int x = 0; x < dx; x++) {
                int center = gray[y][x];
                int up = gray[reflect(y - 1, dy)][x];
                int down = gray[reflect(y + 1, dy)][x];
                int left = gray[y][reflect(x - 1, dx)];
                int right = gray[y][reflect(x + 1, dx)];
                double laplacian = up + down + left + right - 4.0 * center;
                sum += laplacian;
                sumSquares += laplacian * laplacian;
            }
        }
        double n = (double) dx * dy;
        double mean = sum / n;
        return Math.max(0.0, sumSquares / n - mean * mean);
    }

    static int[][] toGray(BufferedImage image) {
        int dx = image.getWidth();
        int dy = image.getHeight();
        int[][] gray = new int[dy][dx];
        for (int y = 0; y < dy; y++) {
            for (int x = 0; x < dx; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                gray[y][x] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return gray;
    }

    // Mirror without repeating the edge pixel: -1 -> 1, n -> n - 2
    private static int reflect(int i, int n) {
        if (n == 1) {
            return 0;
        }
        if (i < 0) {
            return -i;
        }
        if (i >= n) {
            return 2 * n - i - 2;
        }
        return i;
    }
}
